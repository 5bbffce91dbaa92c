package com.firmware.inspector.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Placement of a whole section inside one logical block.
 */
@Value
@Builder
public class SectionBlockAssignment {

    @NonNull
    String blockId;

    @NonNull
    String windowId;

    @NonNull
    AddressType addressType;

    /** Start address of the section in this block (LMA for load blocks, VMA otherwise). */
    long address;

    long size;
}
