package com.firmware.inspector.toolchain;

/**
 * The executable could not be started (missing, not executable, ...).
 */
public class CommandStartupException extends ToolchainException {

    private static final long serialVersionUID = 1L;

    public CommandStartupException(String message, String command, Throwable cause) {
        super(message, command, cause);
    }
}
