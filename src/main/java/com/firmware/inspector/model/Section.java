package com.firmware.inspector.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * An ELF section header as reported by {@code readelf -S}, optionally placed into logical
 * memory blocks.
 */
@Value
@Builder(toBuilder = true)
public class Section {

    @NonNull
    String id;

    @NonNull
    String name;

    long vmaStart;
    long size;

    /** Load address from {@code objdump -h}; null when unknown. */
    Long lmaStart;

    @NonNull
    SectionFlags flags;

    String categoryId;

    @Singular
    List<SectionBlockAssignment> blockAssignments;

    String primaryBlockId;
    String primaryWindowId;

    public boolean contains(long address) {
        return address >= vmaStart && address < vmaStart + size;
    }

    /**
     * The first non-load assignment, falling back to the first one. Null without assignments.
     */
    public SectionBlockAssignment primaryAssignment() {
        for (SectionBlockAssignment assignment : blockAssignments) {
            if (assignment.getAddressType() != AddressType.LOAD) {
                return assignment;
            }
        }
        return blockAssignments.isEmpty() ? null : blockAssignments.get(0);
    }
}
