package com.firmware.inspector.toolchain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Captured outcome of a finished command.
 */
@Value
@Builder
public class CommandResult {

    @NonNull
    String stdout;

    @NonNull
    String stderr;

    int exitCode;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
