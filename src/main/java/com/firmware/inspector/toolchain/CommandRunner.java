package com.firmware.inspector.toolchain;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a toolchain executable and captures its output.
 *
 * A non-zero exit code is reported through {@link CommandResult#getExitCode()}; callers decide
 * whether that is fatal. A timeout is never reported as an exit code: the process is destroyed and
 * {@link CommandTimeoutException} is thrown.
 */
public class CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    /** Disables the timeout guard. */
    public static final Duration UNLIMITED_TIMEOUT = Duration.ZERO;

    private static final long STREAM_DRAIN_SECONDS = 5;
    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    public CommandResult run(String command, List<String> args, Duration timeout)
            throws ToolchainException, InterruptedException {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout duration cannot be negative: " + timeout);
        }

        List<String> commandLine = new ArrayList<>(args.size() + 1);
        commandLine.add(command);
        commandLine.addAll(args);
        String display = String.join(" ", commandLine);
        log.debug("Running: {}", display);

        Process process;
        try {
            process = new ProcessBuilder(commandLine).start();
        } catch (IOException e) {
            throw new CommandStartupException(
                    "Unable to start %s (%s)".formatted(command, e.getMessage()), display, e);
        }

        // stdin is never used
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", command, e.getMessage());
        }

        CompletableFuture<String> stdoutFuture =
                CompletableFuture.supplyAsync(() -> readStream(process.getInputStream()));
        CompletableFuture<String> stderrFuture =
                CompletableFuture.supplyAsync(() -> readStream(process.getErrorStream()));

        try {
            boolean finished;
            if (timeout.equals(UNLIMITED_TIMEOUT)) {
                process.waitFor();
                finished = true;
            } else {
                finished = process.waitFor(toNanosSaturated(timeout), TimeUnit.NANOSECONDS);
            }
            if (!finished) {
                process.destroyForcibly();
                stdoutFuture.cancel(true);
                stderrFuture.cancel(true);
                throw new CommandTimeoutException(display, timeout);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            stdoutFuture.cancel(true);
            stderrFuture.cancel(true);
            log.warn("Command '{}' interrupted", display);
            throw e;
        }

        int exitCode = process.exitValue();
        String stdout = collect(stdoutFuture, display);
        String stderr = collect(stderrFuture, display);

        log.debug("{} exited with {} ({} chars stdout)", command, exitCode, stdout.length());
        return CommandResult.builder()
                .stdout(stdout)
                .stderr(stderr)
                .exitCode(exitCode)
                .build();
    }

    // Duration.toNanos() overflows past ~292 years
    static long toNanosSaturated(Duration timeout) {
        if (timeout.compareTo(MAX_NANOS) >= 0) {
            return Long.MAX_VALUE;
        }
        return timeout.toNanos();
    }

    private static String readStream(InputStream in) {
        try (InputStream stream = in) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Error reading process stream: {}", e.getMessage());
            return "";
        }
    }

    private static String collect(CompletableFuture<String> future, String command) throws InterruptedException {
        try {
            return future.get(STREAM_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException | java.util.concurrent.TimeoutException e) {
            log.warn("Could not collect output of '{}': {}", command, e.getMessage());
            future.cancel(true);
            return "";
        }
    }
}
