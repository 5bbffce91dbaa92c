package com.firmware.inspector.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.firmware.inspector.model.AddressType;
import com.firmware.inspector.model.LogicalBlock;
import com.firmware.inspector.model.MemoryMap;
import com.firmware.inspector.model.Section;
import com.firmware.inspector.model.SectionBlockAssignment;
import com.firmware.inspector.model.SectionRule;

/**
 * Places allocated sections into the logical blocks of a memory map.
 *
 * Each allocated, non-empty section gets the category of the first matching rule and one
 * assignment per block of that category. The primary block is the first non-load one.
 * Sections that are not allocated or have no size are left without assignments.
 */
public class SectionBlockAssigner {
    private static final Logger log = LoggerFactory.getLogger(SectionBlockAssigner.class);

    public List<Section> assign(List<Section> sections, MemoryMap memoryMap) throws MemoryMapException {
        List<Section> unmatched = new ArrayList<>();
        List<Section> categorized = new ArrayList<>(sections.size());

        for (Section section : sections) {
            if (!isAccounted(section)) {
                categorized.add(section);
                continue;
            }
            Optional<SectionRule> rule = memoryMap.ruleFor(section.getName());
            if (rule.isEmpty()) {
                unmatched.add(section);
                categorized.add(section);
            } else {
                categorized.add(section.toBuilder().categoryId(rule.get().getCategoryId()).build());
            }
        }

        if (!unmatched.isEmpty()) {
            String details = unmatched.stream()
                    .map(s -> s.getName() + " (0x" + Long.toHexString(s.getVmaStart()) + ")")
                    .collect(Collectors.joining(", "));
            throw new MemoryMapException("No section category assigned for: " + details);
        }

        Map<String, List<LogicalBlock>> blocksByCategory = memoryMap.getBlocks().stream()
                .collect(Collectors.groupingBy(LogicalBlock::getCategoryId));

        List<Section> result = new ArrayList<>(categorized.size());
        for (Section section : categorized) {
            if (!isAccounted(section) || section.getCategoryId() == null) {
                result.add(section.toBuilder()
                        .clearBlockAssignments()
                        .primaryBlockId(null)
                        .primaryWindowId(null)
                        .build());
                continue;
            }

            List<LogicalBlock> blocks = blocksByCategory.getOrDefault(section.getCategoryId(), List.of());
            if (blocks.isEmpty()) {
                throw new MemoryMapException("No logical blocks defined for category " + section.getCategoryId() + ".");
            }

            Section.SectionBuilder builder = section.toBuilder().clearBlockAssignments();
            for (LogicalBlock block : blocks) {
                builder.blockAssignment(toAssignment(section, block));
            }
            Section placed = builder.build();
            SectionBlockAssignment primary = placed.primaryAssignment();

            result.add(placed.toBuilder()
                    .primaryBlockId(primary.getBlockId())
                    .primaryWindowId(primary.getWindowId())
                    .build());
            log.debug("Section {} -> category {}, primary block {}", section.getName(),
                    section.getCategoryId(), primary.getBlockId());
        }
        return result;
    }

    private static boolean isAccounted(Section section) {
        return section.getFlags().isAlloc() && section.getSize() != 0;
    }

    private static SectionBlockAssignment toAssignment(Section section, LogicalBlock block) {
        return SectionBlockAssignment.builder()
                .blockId(block.getId())
                .windowId(block.getWindowId())
                .addressType(block.getRole())
                .address(addressFor(section, block.getRole()))
                .size(section.getSize())
                .build();
    }

    // An LMA of 0 is what objdump reports for sections without a load image
    static long addressFor(Section section, AddressType addressType) {
        if (addressType == AddressType.LOAD && section.getLmaStart() != null && section.getLmaStart() != 0) {
            return section.getLmaStart();
        }
        return section.getVmaStart();
    }
}
