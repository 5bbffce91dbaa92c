package com.firmware.inspector.analysis;

import java.util.List;

import com.firmware.inspector.grouping.model.TemplateGroupSummary;
import com.firmware.inspector.model.Section;
import com.firmware.inspector.model.Symbol;

import lombok.Builder;
import lombok.Data;

/**
 * Result of the inspection process.
 */
@Data
@Builder
public class InspectionResult {
    private boolean success;
    private String errorMessage;
    private String failedCommand;

    @Builder.Default
    private List<Section> sections = List.of();

    @Builder.Default
    private List<Symbol> symbols = List.of();

    @Builder.Default
    private List<TemplateGroupSummary> groups = List.of();

    private InspectionDiagnostics diagnostics;

    private long elapsedMillis;

    public long getTemplateGroupCount() {
        return groups.stream().filter(TemplateGroupSummary::isTemplate).count();
    }

    public long getTotalSizeBytes() {
        return groups.stream().mapToLong(g -> g.getTotals().getSizeBytes()).sum();
    }

    public long getTotalUniqueSizeBytes() {
        return groups.stream().mapToLong(g -> g.getTotals().getUniqueSizeBytes()).sum();
    }

    public static InspectionResult failure(String errorMessage) {
        return InspectionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public static InspectionResult commandFailure(String command, String errorMessage) {
        return InspectionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .failedCommand(command)
                .build();
    }
}
