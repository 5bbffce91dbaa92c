package com.firmware.inspector.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.firmware.inspector.cli.exception.InvalidInspectOptionsException;
import com.firmware.inspector.cli.model.InspectOptions;
import com.firmware.inspector.cli.model.ValidatedInspectOptions;

public class InspectOptionsValidator {

	public ValidatedInspectOptions validate(InspectOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getElfPath() == null && o.getNmOutput() == null) {
			errors.add("Either --elf or --nm-output must be provided.");
		}
		if (o.getElfPath() != null && !Files.isRegularFile(o.getElfPath())) {
			errors.add("ELF file does not exist or is not a file: " + o.getElfPath());
		}
		if (o.getNmOutput() != null && !Files.isRegularFile(o.getNmOutput())) {
			errors.add("nm output file does not exist: " + o.getNmOutput());
		}
		if (o.getReadelfOutput() != null && !Files.isRegularFile(o.getReadelfOutput())) {
			errors.add("readelf output file does not exist: " + o.getReadelfOutput());
		}

		if (o.getObjdumpOutput() != null && !Files.isRegularFile(o.getObjdumpOutput())) {
			errors.add("objdump output file does not exist: " + o.getObjdumpOutput());
		}
		if (o.getMemoryMap() != null && !Files.isRegularFile(o.getMemoryMap())) {
			errors.add("Memory map file does not exist: " + o.getMemoryMap());
		}

		// Only matters when a command will actually run
		if (o.getToolchainDir() != null && runsToolchain(o) && !Files.isDirectory(o.getToolchainDir())) {
			errors.add("Toolchain directory does not exist or is not a directory: " + o.getToolchainDir());
		}

		if (o.getTimeoutSeconds() < 0) {
			errors.add("Timeout must be >= 0 seconds. Got: " + o.getTimeoutSeconds());
		}
		if (o.getTop() < 1) {
			errors.add("--top must be at least 1. Got: " + o.getTop());
		}
		if (o.getSpecializations() < 1) {
			errors.add("--specializations must be at least 1. Got: " + o.getSpecializations());
		}

		Path reportPath = null;
		if (o.getReportPath() != null) {
			reportPath = o.getReportPath().toAbsolutePath().normalize();
			if (Files.isDirectory(reportPath)) {
				errors.add("Report path is a directory: " + reportPath);
			} else if (Files.exists(reportPath) && !o.isForce()) {
				errors.add("Report file already exists: " + reportPath + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new InvalidInspectOptionsException(errors);
		}

		return new ValidatedInspectOptions(imageName(o), Duration.ofSeconds(o.getTimeoutSeconds()), reportPath);
	}

	private static boolean runsToolchain(InspectOptions o) {
		if (o.getNmOutput() == null) {
			return true;
		}
		if (o.getElfPath() == null) {
			return false;
		}
		return o.getReadelfOutput() == null || (o.getMemoryMap() != null && o.getObjdumpOutput() == null);
	}

	private static String imageName(InspectOptions o) {
		Path source = o.getElfPath() != null ? o.getElfPath() : o.getNmOutput();
		return source.getFileName().toString();
	}
}
