package com.firmware.inspector.cli.output;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.firmware.inspector.analysis.InspectionResult;
import com.firmware.inspector.cli.model.InspectOptions;
import com.firmware.inspector.cli.model.ValidatedInspectOptions;
import com.firmware.inspector.grouping.model.GroupTotals;
import com.firmware.inspector.grouping.model.SpecializationSummary;
import com.firmware.inspector.grouping.model.TemplateGroupSummary;
import com.firmware.inspector.report.GroupRanking;
import com.firmware.inspector.report.ReportOptions;

/**
 * Responsible only for printing CLI output for the inspect command.
 * No validation, no execution.
 */
public class TemplateGroupsPrinter {

    private static final Logger log = LoggerFactory.getLogger(TemplateGroupsPrinter.class);

    public void printBanner(InspectOptions o, ValidatedInspectOptions v) {
        log.info("=================================================");
        log.info("Firmware Symbol Inspector");
        log.info("=================================================");
        log.info("Image: {}", v.getImageName());

        if (o.getNmOutput() != null) {
            log.info("nm Output: {}", o.getNmOutput().toAbsolutePath());
            log.info("readelf Output: {}", o.getReadelfOutput() != null ? o.getReadelfOutput().toAbsolutePath() : "None");
        } else {
            log.info("ELF File: {}", o.getElfPath().toAbsolutePath());
            log.info("Toolchain Dir: {}", o.getToolchainDir() != null ? o.getToolchainDir().toAbsolutePath() : "PATH");
            log.info("Toolchain Prefix: {}", o.getToolchainPrefix());
            log.info("Command Timeout: {}", v.getCommandTimeout().isZero() ? "none" : v.getCommandTimeout());
        }

        log.info("Memory Map: {}", o.getMemoryMap() != null ? o.getMemoryMap().toAbsolutePath() : "None");
        log.info("Report: {}", v.getNormalizedReportPath() != null ? v.getNormalizedReportPath() : "None");
        log.info("=================================================");
    }

    public void printSuccess(InspectionResult result, ReportOptions reportOptions) {
        log.info("");
        log.info("=================================================");
        log.info("INSPECTION SUCCESSFUL");
        log.info("=================================================");
        log.info("Sections: {}", result.getSections().size());
        log.info("Symbols: {}", result.getSymbols().size());
        log.info("Groups: {} ({} template groups)", result.getGroups().size(), result.getTemplateGroupCount());
        log.info("Total Size: {} bytes", result.getTotalSizeBytes());
        log.info("Unique Size: {} bytes", result.getTotalUniqueSizeBytes());
        log.info("Elapsed: {} ms", result.getElapsedMillis());

        List<TemplateGroupSummary> top = GroupRanking.top(
                result.getGroups(), reportOptions.isTemplatesOnly(), reportOptions.getTopGroups());

        log.info("");
        log.info("Largest {}groups (by unique size):", reportOptions.isTemplatesOnly() ? "template " : "");
        if (top.isEmpty()) {
            log.info("  (none)");
        }
        for (TemplateGroupSummary group : top) {
            printGroup(group, reportOptions.getTopSpecializations());
        }

        if (result.getDiagnostics() != null && result.getDiagnostics().hasWarnings()) {
            log.info("");
            log.info("Warnings: {}", result.getDiagnostics().getWarnings().size());
            result.getDiagnostics().getWarnings().forEach(w -> log.warn("  {}", w));
        }
        log.info("=================================================");
    }

    public void printFailure(InspectionResult result) {
        log.error("Inspection failed: {}", result.getErrorMessage());
        if (result.getFailedCommand() != null) {
            log.error("Failing command: {}", result.getFailedCommand());
        }
    }

    private void printGroup(TemplateGroupSummary group, int specializationLimit) {
        GroupTotals totals = group.getTotals();
        log.info("  {}{}  {} bytes unique / {} bytes, {} symbols, {} specializations",
                Objects.toString(group.getDisplayName(), group.getId()),
                group.isTemplate() ? "<...>" : "",
                totals.getUniqueSizeBytes(),
                totals.getSizeBytes(),
                totals.getSymbolCount(),
                totals.getSpecializationCount());

        if (!group.isTemplate()) {
            return;
        }
        for (SpecializationSummary specialization : GroupRanking.topSpecializations(group, specializationLimit)) {
            log.info("      <{}>  {} bytes unique, {} symbols",
                    specialization.getKey() != null ? specialization.getKey() : "",
                    specialization.getTotals().getUniqueSizeBytes(),
                    specialization.getTotals().getSymbolCount());
        }
        int hidden = totals.getSpecializationCount() - Math.min(specializationLimit, totals.getSpecializationCount());
        if (hidden > 0) {
            log.info("      ... {} more", hidden);
        }
    }
}
