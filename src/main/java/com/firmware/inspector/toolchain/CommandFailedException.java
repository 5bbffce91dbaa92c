package com.firmware.inspector.toolchain;

/**
 * The command ran to completion but exited with a non-zero code.
 */
public class CommandFailedException extends ToolchainException {

    private static final long serialVersionUID = 1L;

    private final int exitCode;
    private final String stderr;

    public CommandFailedException(String message, String command, int exitCode, String stderr) {
        super(message, command);
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
