package com.firmware.inspector.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.firmware.inspector.analysis.InspectionConfig;
import com.firmware.inspector.analysis.InspectionResult;
import com.firmware.inspector.analysis.SymbolInspectionService;
import com.firmware.inspector.cli.exception.InvalidInspectOptionsException;
import com.firmware.inspector.cli.model.InspectOptions;
import com.firmware.inspector.cli.model.ValidatedInspectOptions;
import com.firmware.inspector.cli.output.TemplateGroupsPrinter;
import com.firmware.inspector.cli.validation.InspectOptionsValidator;
import com.firmware.inspector.report.MarkdownReportWriter;
import com.firmware.inspector.report.ReportOptions;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that groups the symbols of a firmware image by template family.
 */
@Command(
        name = "firmware-symbol-inspector",
        mixinStandardHelpOptions = true,
        version = "firmware-symbol-inspector 1.0.0",
        description = "Reports the size footprint of C++ template instantiations in a linked firmware image."
)
public class InspectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InspectCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private InspectOptions options = new InspectOptions();

    private final InspectOptionsValidator validator = new InspectOptionsValidator();
    private final TemplateGroupsPrinter printer = new TemplateGroupsPrinter();

    @Override
    public Integer call() {
        ValidatedInspectOptions validated;
        try {
            validated = validator.validate(options);
        } catch (InvalidInspectOptionsException e) {
            e.getErrors().forEach(log::error);
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(options, validated);

        InspectionConfig config = InspectionConfig.builder()
                .elfPath(options.getElfPath())
                .nmOutputFile(options.getNmOutput())
                .readelfOutputFile(options.getReadelfOutput())
                .objdumpOutputFile(options.getObjdumpOutput())
                .memoryMapFile(options.getMemoryMap())
                .toolchainDir(options.getToolchainDir())
                .toolchainPrefix(options.getToolchainPrefix())
                .commandTimeout(validated.getCommandTimeout())
                .build();

        InspectionResult result = new SymbolInspectionService(config).inspect();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return EXIT_FAILED;
        }

        ReportOptions reportOptions = ReportOptions.builder()
                .topGroups(options.getTop())
                .topSpecializations(options.getSpecializations())
                .templatesOnly(options.isTemplatesOnly())
                .build();

        printer.printSuccess(result, reportOptions);

        if (validated.getNormalizedReportPath() != null) {
            try {
                new MarkdownReportWriter().write(
                        result, reportOptions, validated.getImageName(), validated.getNormalizedReportPath());
            } catch (IOException e) {
                log.error("Failed to write report: {}", e.getMessage(), e);
                return EXIT_FAILED;
            }
        }

        return EXIT_OK;
    }
}
