package com.firmware.inspector.analysis;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.firmware.inspector.grouping.TemplateGroupBuilder;
import com.firmware.inspector.grouping.model.TemplateGroupSummary;
import com.firmware.inspector.model.MemoryMap;
import com.firmware.inspector.model.Section;
import com.firmware.inspector.model.Symbol;
import com.firmware.inspector.parser.MemoryMapParser;
import com.firmware.inspector.parser.NmOutputParser;
import com.firmware.inspector.parser.NmSymbol;
import com.firmware.inspector.parser.ObjdumpSectionParser;
import com.firmware.inspector.parser.ReadelfSectionParser;
import com.firmware.inspector.toolchain.CommandFailedException;
import com.firmware.inspector.toolchain.CommandResult;
import com.firmware.inspector.toolchain.CommandRunner;
import com.firmware.inspector.toolchain.ToolchainCommands;
import com.firmware.inspector.toolchain.ToolchainException;
import com.firmware.inspector.toolchain.ToolchainResolver;
import com.firmware.inspector.toolchain.ToolchainTool;

/**
 * Runs the whole inspection: gathers sections and symbols of an image, then groups the symbols
 * by template family.
 *
 * Section headers, load addresses and symbols come either from captured tool output or from
 * running the toolchain against the ELF file. With a memory map, sections are placed into its
 * logical blocks before symbols are assigned. Groups are only built once every input has been read
 * successfully.
 */
public class SymbolInspectionService {
    private static final Logger log = LoggerFactory.getLogger(SymbolInspectionService.class);

    static final List<String> NM_ARGS = List.of("--print-size", "--size-sort", "--numeric-sort", "--demangle");
    static final List<String> READELF_ARGS = List.of("-S", "-W");
    static final List<String> OBJDUMP_ARGS = List.of("-h");

    private final InspectionConfig config;
    private final CommandRunner commandRunner;
    private final NmOutputParser nmParser = new NmOutputParser();
    private final ReadelfSectionParser readelfParser = new ReadelfSectionParser();
    private final ObjdumpSectionParser objdumpParser = new ObjdumpSectionParser();
    private final MemoryMapParser memoryMapParser = new MemoryMapParser();
    private final SectionBlockAssigner blockAssigner = new SectionBlockAssigner();
    private final SymbolSectionAssigner assigner = new SymbolSectionAssigner();
    private final TemplateGroupBuilder groupBuilder = new TemplateGroupBuilder();

    public SymbolInspectionService(InspectionConfig config) {
        this(config, new CommandRunner());
    }

    public SymbolInspectionService(InspectionConfig config, CommandRunner commandRunner) {
        this.config = config;
        this.commandRunner = commandRunner;
    }

    public InspectionResult inspect() {
        long start = System.currentTimeMillis();
        InspectionDiagnostics diagnostics = new InspectionDiagnostics();

        if (config.getElfPath() == null && config.getNmOutputFile() == null) {
            return InspectionResult.failure("Either an ELF file or captured nm output is required");
        }

        try {
            log.info("Starting symbol inspection...");

            MemoryMap memoryMap = null;
            if (config.getMemoryMapFile() != null) {
                log.info("Loading memory map from {}", config.getMemoryMapFile());
                memoryMap = memoryMapParser.parse(config.getMemoryMapFile());
                if (memoryMap.hasErrors()) {
                    return InspectionResult.failure("Invalid memory map " + config.getMemoryMapFile() + ":"
                            + System.lineSeparator() + String.join(System.lineSeparator(), memoryMap.getErrors()));
                }
                memoryMap.getWarnings().forEach(diagnostics::warn);
            }

            ToolchainCommands commands = null;
            if (config.requiresToolchain()) {
                commands = new ToolchainResolver(config.getToolchainDir(), config.getToolchainPrefix()).resolve();
            }

            // Step 1: section headers
            log.info("Step 1: Reading section headers...");
            List<Section> sections = loadSections(commands, diagnostics);
            log.info("Found {} sections", sections.size());

            // Step 2: memory blocks
            if (memoryMap != null && !sections.isEmpty()) {
                log.info("Step 2: Placing sections into memory blocks...");
                sections = blockAssigner.assign(applyLoadAddresses(sections, commands, diagnostics), memoryMap);
            } else {
                log.info("Step 2: Skipping memory block placement (no {})",
                        memoryMap == null ? "memory map" : "section headers");
            }

            // Step 3: symbols
            log.info("Step 3: Reading symbols...");
            List<NmSymbol> nmSymbols = loadNmSymbols(commands);
            List<Symbol> symbols = assigner.assign(nmSymbols, sections, diagnostics);
            log.info("Found {} symbols", symbols.size());

            // Step 4: grouping
            log.info("Step 4: Grouping symbols by template family...");
            List<TemplateGroupSummary> groups = groupBuilder.build(symbols);
            log.info("Built {} groups", groups.size());

            return InspectionResult.builder()
                    .success(true)
                    .sections(sections)
                    .symbols(symbols)
                    .groups(groups)
                    .diagnostics(diagnostics)
                    .elapsedMillis(System.currentTimeMillis() - start)
                    .build();

        } catch (MemoryMapException e) {
            return InspectionResult.failure(e.getMessage());
        } catch (ToolchainException e) {
            log.debug("Toolchain failure", e);
            return InspectionResult.commandFailure(e.getCommand(), e.getMessage());
        } catch (IOException e) {
            log.debug("I/O failure", e);
            return InspectionResult.failure("Failed to read tool output: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return InspectionResult.failure("Inspection interrupted");
        }
    }

    private List<Section> loadSections(ToolchainCommands commands, InspectionDiagnostics diagnostics)
            throws IOException, InterruptedException {
        if (config.getReadelfOutputFile() != null) {
            return readelfParser.parse(config.getReadelfOutputFile());
        }
        if (config.getElfPath() == null) {
            diagnostics.info("No section headers available; symbols are not assigned to sections.");
            return List.of();
        }
        String stdout = runTool(commands, ToolchainTool.READELF, READELF_ARGS,
                "Failed to read section headers from ELF.");
        return readelfParser.parse(stdout);
    }

    private List<Section> applyLoadAddresses(List<Section> sections, ToolchainCommands commands,
            InspectionDiagnostics diagnostics) throws IOException, InterruptedException {
        Map<String, Long> lmaByName;
        if (config.getObjdumpOutputFile() != null) {
            lmaByName = objdumpParser.parse(config.getObjdumpOutputFile());
        } else if (config.getElfPath() != null) {
            lmaByName = objdumpParser.parse(runTool(commands, ToolchainTool.OBJDUMP, OBJDUMP_ARGS,
                    "Failed to read load addresses from ELF."));
        } else {
            diagnostics.info("No load addresses available; load blocks use section virtual addresses.");
            return sections;
        }

        List<Section> withLoadAddresses = new ArrayList<>(sections.size());
        for (Section section : sections) {
            withLoadAddresses.add(section.toBuilder().lmaStart(lmaByName.get(section.getName())).build());
        }
        return withLoadAddresses;
    }

    private List<NmSymbol> loadNmSymbols(ToolchainCommands commands) throws IOException, InterruptedException {
        if (config.getNmOutputFile() != null) {
            return nmParser.parse(config.getNmOutputFile());
        }
        String stdout = runTool(commands, ToolchainTool.NM, NM_ARGS, "Failed to read symbols from ELF.");
        return nmParser.parse(stdout);
    }

    private String runTool(ToolchainCommands commands, ToolchainTool tool, List<String> args, String failureMessage)
            throws ToolchainException, InterruptedException {
        String command = commands.commandFor(tool);
        Path elf = config.getElfPath().toAbsolutePath();

        List<String> fullArgs = new ArrayList<>(args);
        fullArgs.add(elf.toString());

        CommandResult result = commandRunner.run(command, fullArgs, config.getEffectiveTimeout());
        if (!result.isSuccess()) {
            String display = command + " " + String.join(" ", fullArgs);
            throw new CommandFailedException(
                    "%s%nCommand: %s%nExit code: %d%n%s".formatted(
                            failureMessage, display, result.getExitCode(), result.getStderr().trim()),
                    display, result.getExitCode(), result.getStderr());
        }
        return result.getStdout();
    }
}
