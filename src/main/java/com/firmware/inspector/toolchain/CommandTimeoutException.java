package com.firmware.inspector.toolchain;

import java.time.Duration;

/**
 * The command did not finish within its timeout and was killed.
 */
public class CommandTimeoutException extends ToolchainException {

    private static final long serialVersionUID = 1L;

    private final Duration timeout;

    public CommandTimeoutException(String command, Duration timeout) {
        super("Command timed out after %d ms: %s".formatted(timeout.toMillis(), command), command);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
