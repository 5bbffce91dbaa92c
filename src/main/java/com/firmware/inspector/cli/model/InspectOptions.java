package com.firmware.inspector.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the inspect command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class InspectOptions {

	@Option(names = { "--elf", "-e" }, description = "ELF image to inspect (required unless --nm-output is given)")
	private Path elfPath;

	// Captured tool output instead of running the toolchain
	@Option(names = { "--nm-output" }, description = "File with captured 'nm --print-size --demangle' output")
	private Path nmOutput;

	@Option(names = { "--readelf-output" }, description = "File with captured 'readelf -S -W' output")
	private Path readelfOutput;

	@Option(names = { "--objdump-output" }, description = "File with captured 'objdump -h' output (load addresses)")
	private Path objdumpOutput;

	@Option(names = { "--memory-map", "-m" }, description = "Memory map file with logical blocks and section rules")
	private Path memoryMap;

	@Option(names = { "--toolchain-dir", "-d" }, description = "Directory containing the toolchain executables")
	private Path toolchainDir;

	@Option(names = {
			"--toolchain-prefix" }, defaultValue = "arm-none-eabi-", description = "Prefix of the toolchain commands (default: ${DEFAULT-VALUE})")
	private String toolchainPrefix;

	@Option(names = {
			"--timeout-seconds" }, defaultValue = "60", description = "Timeout per toolchain command in seconds, 0 for none (default: ${DEFAULT-VALUE})")
	private long timeoutSeconds;

	@Option(names = { "--top", "-n" }, defaultValue = "20", description = "Number of groups to report (default: ${DEFAULT-VALUE})")
	private int top;

	@Option(names = {
			"--specializations" }, defaultValue = "5", description = "Specializations listed per group (default: ${DEFAULT-VALUE})")
	private int specializations;

	@Option(names = { "--templates-only" }, description = "Only report template groups")
	private boolean templatesOnly;

	@Option(names = { "--report", "-r" }, description = "Write a Markdown report to this file")
	private Path reportPath;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing report file")
	private boolean force;

}
