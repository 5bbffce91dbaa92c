package com.firmware.inspector.toolchain;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Resolved command (absolute path or bare name for PATH lookup) per tool.
 */
@Value
@Builder
public class ToolchainCommands {

    @NonNull
    @Singular
    Map<ToolchainTool, String> commands;

    public String commandFor(ToolchainTool tool) {
        String command = commands.get(tool);
        if (command == null) {
            throw new IllegalStateException("No command resolved for " + tool);
        }
        return command;
    }
}
