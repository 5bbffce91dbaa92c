package com.firmware.inspector.toolchain;

import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the prefixed binutils executables of a cross toolchain.
 *
 * For each tool the command name is {@code prefix + executable}. When a toolchain directory is
 * configured, {@code dir/command} and then {@code dir/command.exe} are tried; otherwise, or when
 * neither is an executable file, the bare command name is used and left to PATH lookup.
 */
public class ToolchainResolver {
    private static final Logger log = LoggerFactory.getLogger(ToolchainResolver.class);

    public static final String DEFAULT_PREFIX = "arm-none-eabi-";

    private final Path toolchainDir;
    private final String prefix;

    public ToolchainResolver(Path toolchainDir, String prefix) {
        this.toolchainDir = toolchainDir;
        this.prefix = prefix != null ? prefix : DEFAULT_PREFIX;
    }

    public ToolchainCommands resolve() {
        ToolchainCommands.ToolchainCommandsBuilder builder = ToolchainCommands.builder();
        for (ToolchainTool tool : ToolchainTool.values()) {
            builder.command(tool, resolve(tool));
        }
        return builder.build();
    }

    public String resolve(ToolchainTool tool) {
        String commandName = prefix + tool.getExecutable();

        if (toolchainDir != null) {
            Path candidate = toolchainDir.resolve(commandName);
            if (isExecutableFile(candidate)) {
                log.debug("Resolved {} to {}", tool, candidate);
                return candidate.toString();
            }

            Path windowsCandidate = toolchainDir.resolve(commandName + ".exe");
            if (isExecutableFile(windowsCandidate)) {
                log.debug("Resolved {} to {}", tool, windowsCandidate);
                return windowsCandidate.toString();
            }

            log.warn("{} not found in {}, falling back to PATH lookup", commandName, toolchainDir);
        }

        return commandName;
    }

    private static boolean isExecutableFile(Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }
}
