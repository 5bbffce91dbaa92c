package com.firmware.inspector.grouping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.firmware.inspector.grouping.model.GroupSymbolSummary;
import com.firmware.inspector.grouping.model.GroupTotals;
import com.firmware.inspector.grouping.model.SpecializationSummary;
import com.firmware.inspector.grouping.model.TemplateGroupSummary;

/**
 * Mutable state of one template group while a build is in progress.
 */
class GroupAccumulator {

    private final String id;
    private final String displayName;
    private final boolean template;

    private final List<GroupSymbolSummary> symbols = new ArrayList<>();
    // LinkedHashMap: keeps first-seen order and accepts the null key
    private final Map<String, SpecializationAccumulator> specializations = new LinkedHashMap<>();
    private final UniqueSizeTracker uniqueSizes = new UniqueSizeTracker();

    private long largestSymbolSize = 0;
    private long smallestSymbolSize = Long.MAX_VALUE;

    GroupAccumulator(String id, String displayName, boolean template) {
        this.id = id;
        this.displayName = displayName;
        this.template = template;
    }

    void add(GroupSymbolSummary summary, String locationKey) {
        symbols.add(summary);
        uniqueSizes.add(locationKey, summary.getSizeBytes());

        largestSymbolSize = Math.max(largestSymbolSize, summary.getSizeBytes());
        smallestSymbolSize = Math.min(smallestSymbolSize, summary.getSizeBytes());

        specializations
                .computeIfAbsent(summary.getSpecializationKey(), SpecializationAccumulator::new)
                .add(summary, locationKey);
    }

    TemplateGroupSummary finish() {
        List<SpecializationSummary> finished = new ArrayList<>(specializations.size());
        for (SpecializationAccumulator specialization : specializations.values()) {
            finished.add(specialization.finish());
        }

        long sizeBytes = 0;
        for (GroupSymbolSummary symbol : symbols) {
            sizeBytes += symbol.getSizeBytes();
        }

        return TemplateGroupSummary.builder()
                .id(id)
                .displayName(displayName)
                .template(template)
                .symbols(List.copyOf(symbols))
                .specializations(List.copyOf(finished))
                .totals(GroupTotals.builder()
                        .symbolCount(symbols.size())
                        .specializationCount(finished.size())
                        .sizeBytes(sizeBytes)
                        .uniqueSizeBytes(uniqueSizes.total())
                        .largestSymbolSizeBytes(largestSymbolSize)
                        .smallestSymbolSizeBytes(symbols.isEmpty() ? 0 : smallestSymbolSize)
                        .build())
                .build();
    }
}
