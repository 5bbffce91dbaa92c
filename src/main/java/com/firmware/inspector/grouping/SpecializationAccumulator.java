package com.firmware.inspector.grouping;

import java.util.ArrayList;
import java.util.List;

import com.firmware.inspector.grouping.model.GroupSymbolSummary;
import com.firmware.inspector.grouping.model.SpecializationSummary;
import com.firmware.inspector.grouping.model.SpecializationTotals;

/**
 * Mutable state of one specialization while a build is in progress.
 */
class SpecializationAccumulator {

    private final String key;
    private final List<GroupSymbolSummary> symbols = new ArrayList<>();
    private final UniqueSizeTracker uniqueSizes = new UniqueSizeTracker();

    SpecializationAccumulator(String key) {
        this.key = key;
    }

    void add(GroupSymbolSummary summary, String locationKey) {
        symbols.add(summary);
        uniqueSizes.add(locationKey, summary.getSizeBytes());
    }

    SpecializationSummary finish() {
        long sizeBytes = 0;
        for (GroupSymbolSummary symbol : symbols) {
            sizeBytes += symbol.getSizeBytes();
        }

        return SpecializationSummary.builder()
                .key(key)
                .symbols(List.copyOf(symbols))
                .totals(SpecializationTotals.builder()
                        .symbolCount(symbols.size())
                        .sizeBytes(sizeBytes)
                        .uniqueSizeBytes(uniqueSizes.total())
                        .build())
                .build();
    }
}
