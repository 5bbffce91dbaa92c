package com.firmware.inspector.analysis;

import java.nio.file.Path;
import java.time.Duration;

import com.firmware.inspector.toolchain.CommandRunner;
import com.firmware.inspector.toolchain.ToolchainResolver;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one inspection run.
 */
@Data
@Builder
public class InspectionConfig {
    private Path elfPath;

    // Captured tool output used instead of running the tools
    private Path nmOutputFile;
    private Path readelfOutputFile;
    private Path objdumpOutputFile;

    // Section rules and logical blocks; without it no block placement is done
    private Path memoryMapFile;

    private Path toolchainDir;

    @Builder.Default
    private String toolchainPrefix = ToolchainResolver.DEFAULT_PREFIX;

    @Builder.Default
    private Duration commandTimeout = Duration.ofSeconds(60);

    /**
     * True when at least one binutils command has to be executed.
     */
    public boolean requiresToolchain() {
        if (nmOutputFile == null) {
            return true;
        }
        if (elfPath == null) {
            return false;
        }
        return readelfOutputFile == null || (memoryMapFile != null && objdumpOutputFile == null);
    }

    public Duration getEffectiveTimeout() {
        return commandTimeout != null ? commandTimeout : CommandRunner.UNLIMITED_TIMEOUT;
    }
}
