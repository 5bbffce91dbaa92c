package com.firmware.inspector.toolchain;

import java.io.IOException;

/**
 * Base exception for failures of an external toolchain command.
 */
public abstract class ToolchainException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String command;

    protected ToolchainException(String message, String command) {
        super(message);
        this.command = command;
    }

    protected ToolchainException(String message, String command, Throwable cause) {
        super(message, cause);
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
