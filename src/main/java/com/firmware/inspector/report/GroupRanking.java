package com.firmware.inspector.report;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.firmware.inspector.grouping.model.SpecializationSummary;
import com.firmware.inspector.grouping.model.TemplateGroupSummary;

/**
 * Orders groups and specializations for display: biggest unique footprint first.
 */
public final class GroupRanking {

    private static final Comparator<TemplateGroupSummary> BY_UNIQUE_SIZE =
            Comparator.comparingLong((TemplateGroupSummary g) -> g.getTotals().getUniqueSizeBytes()).reversed()
                    .thenComparing(g -> Objects.toString(g.getDisplayName(), ""));

    private static final Comparator<SpecializationSummary> SPECIALIZATION_BY_UNIQUE_SIZE =
            Comparator.comparingLong((SpecializationSummary s) -> s.getTotals().getUniqueSizeBytes()).reversed()
                    .thenComparing(s -> Objects.toString(s.getKey(), ""));

    private GroupRanking() {
        // Utility class
    }

    public static List<TemplateGroupSummary> top(List<TemplateGroupSummary> groups, boolean templatesOnly, int limit) {
        return groups.stream()
                .filter(g -> !templatesOnly || g.isTemplate())
                .sorted(BY_UNIQUE_SIZE)
                .limit(Math.max(limit, 0))
                .toList();
    }

    public static List<SpecializationSummary> topSpecializations(TemplateGroupSummary group, int limit) {
        return group.getSpecializations().stream()
                .sorted(SPECIALIZATION_BY_UNIQUE_SIZE)
                .limit(Math.max(limit, 0))
                .toList();
    }
}
