package com.firmware.inspector.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.firmware.inspector.cli.exception.InvalidInspectOptionsException;
import com.firmware.inspector.cli.model.InspectOptions;
import com.firmware.inspector.cli.model.ValidatedInspectOptions;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class InspectOptionsValidatorTest {

	@TempDir
	Path tempDir;

	private final InspectOptionsValidator validator = new InspectOptionsValidator();

	private Path elf;
	private Path nmDump;

	@BeforeEach
	void setUp() throws IOException {
		elf = Files.write(tempDir.resolve("app.elf"), new byte[] { 0x7f, 'E', 'L', 'F' });
		nmDump = Files.writeString(tempDir.resolve("app.nm.txt"), "08000000 00000004 T main\n");
	}

	@Test
	void testValidElfOptions() {
		ValidatedInspectOptions validated = validator.validate(parse("--elf", elf.toString(), "--timeout-seconds", "15"));

		assertThat(validated.getImageName()).isEqualTo("app.elf");
		assertThat(validated.getCommandTimeout()).isEqualTo(Duration.ofSeconds(15));
		assertThat(validated.getNormalizedReportPath()).isNull();
	}

	@Test
	void testImageNameFallsBackToNmDump() {
		ValidatedInspectOptions validated = validator.validate(parse("--nm-output", nmDump.toString()));

		assertThat(validated.getImageName()).isEqualTo("app.nm.txt");
		assertThat(validated.getCommandTimeout()).isEqualTo(Duration.ofSeconds(60));
	}

	@Test
	void testMissingInputIsRejected() {
		assertThatThrownBy(() -> validator.validate(parse()))
				.isInstanceOf(InvalidInspectOptionsException.class)
				.satisfies(e -> assertThat(((InvalidInspectOptionsException) e).getErrors())
						.containsExactly("Either --elf or --nm-output must be provided."));
	}

	@Test
	void testAllErrorsAreCollected() {
		InspectOptions options = parse(
				"--elf", tempDir.resolve("missing.elf").toString(),
				"--toolchain-dir", tempDir.resolve("no-such-dir").toString(),
				"--timeout-seconds", "-1",
				"--top", "0",
				"--specializations", "0");

		assertThatThrownBy(() -> validator.validate(options))
				.isInstanceOf(InvalidInspectOptionsException.class)
				.satisfies(e -> assertThat(((InvalidInspectOptionsException) e).getErrors()).hasSize(5));
	}

	@Test
	void testToolchainDirIgnoredWhenNoCommandRuns() throws IOException {
		Path readelfDump = Files.writeString(tempDir.resolve("app.readelf.txt"), "");
		String missingDir = tempDir.resolve("no-such-dir").toString();

		ValidatedInspectOptions validated = validator.validate(parse(
				"--nm-output", nmDump.toString(),
				"--readelf-output", readelfDump.toString(),
				"--toolchain-dir", missingDir));
		assertThat(validated.getImageName()).isEqualTo("app.nm.txt");

		assertThatThrownBy(() -> validator.validate(parse(
				"--elf", elf.toString(),
				"--nm-output", nmDump.toString(),
				"--toolchain-dir", missingDir)))
				.isInstanceOf(InvalidInspectOptionsException.class)
				.hasMessageContaining("Toolchain directory does not exist");
	}

	@Test
	void testMemoryMapWithoutLoadAddressesRunsObjdump() throws IOException {
		Path readelfDump = Files.writeString(tempDir.resolve("app.readelf.txt"), "");
		Path memoryMap = Files.writeString(tempDir.resolve("app.memmap"), "");

		assertThatThrownBy(() -> validator.validate(parse(
				"--elf", elf.toString(),
				"--nm-output", nmDump.toString(),
				"--readelf-output", readelfDump.toString(),
				"--memory-map", memoryMap.toString(),
				"--toolchain-dir", tempDir.resolve("no-such-dir").toString())))
				.isInstanceOf(InvalidInspectOptionsException.class)
				.hasMessageContaining("Toolchain directory");
	}

	@Test
	void testMissingMemoryMapIsRejected() {
		assertThatThrownBy(() -> validator.validate(parse(
				"--nm-output", nmDump.toString(),
				"-m", tempDir.resolve("missing.memmap").toString())))
				.isInstanceOf(InvalidInspectOptionsException.class)
				.satisfies(e -> assertThat(((InvalidInspectOptionsException) e).getErrors())
						.singleElement().asString().startsWith("Memory map file does not exist"));
	}

	@Test
	void testHugeTimeoutIsAccepted() {
		ValidatedInspectOptions validated = validator.validate(
				parse("--elf", elf.toString(), "--timeout-seconds", String.valueOf(Long.MAX_VALUE)));

		assertThat(validated.getCommandTimeout()).isEqualTo(Duration.ofSeconds(Long.MAX_VALUE));
	}

	@Test
	void testExistingReportRequiresForce() throws IOException {
		Path report = Files.writeString(tempDir.resolve("report.md"), "old");

		assertThatThrownBy(() -> validator.validate(parse("--elf", elf.toString(), "--report", report.toString())))
				.isInstanceOf(InvalidInspectOptionsException.class)
				.hasMessageContaining("--force");

		ValidatedInspectOptions validated = validator.validate(
				parse("--elf", elf.toString(), "--report", report.toString(), "--force"));
		assertThat(validated.getNormalizedReportPath()).isEqualTo(report.toAbsolutePath().normalize());
	}

	@Test
	void testReportPathMustNotBeDirectory() {
		assertThatThrownBy(() -> validator.validate(parse("--elf", elf.toString(), "-r", tempDir.toString(), "-f")))
				.isInstanceOf(InvalidInspectOptionsException.class)
				.hasMessageContaining("directory");
	}

	private static InspectOptions parse(String... args) {
		InspectOptions options = new InspectOptions();
		new CommandLine(options).parseArgs(args);
		return options;
	}
}
