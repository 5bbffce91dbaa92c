package com.firmware.inspector.toolchain;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import static org.assertj.core.api.Assertions.*;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class CommandRunnerTest {

    private final CommandRunner runner = new CommandRunner();

    @Test
    void testRunCapturesOutputAndExitCode() throws Exception {
        CommandResult result = runner.run("sh", List.of("-c", "echo out; echo err >&2; exit 3"),
                Duration.ofSeconds(10));

        assertThat(result.getStdout()).isEqualTo("out\n");
        assertThat(result.getStderr()).isEqualTo("err\n");
        assertThat(result.getExitCode()).isEqualTo(3);
        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    void testRunWithoutTimeout() throws Exception {
        CommandResult result = runner.run("sh", List.of("-c", "echo ok"), CommandRunner.UNLIMITED_TIMEOUT);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStdout()).isEqualTo("ok\n");
    }

    @Test
    void testRunWithHugeTimeout() throws Exception {
        CommandResult result = runner.run("sh", List.of("-c", "echo ok"), Duration.ofSeconds(Long.MAX_VALUE));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStdout()).isEqualTo("ok\n");
    }

    @Test
    void testTimeoutNanosSaturate() {
        assertThat(CommandRunner.toNanosSaturated(Duration.ofSeconds(Long.MAX_VALUE))).isEqualTo(Long.MAX_VALUE);
        assertThat(CommandRunner.toNanosSaturated(Duration.ofDays(365L * 300))).isEqualTo(Long.MAX_VALUE);
        assertThat(CommandRunner.toNanosSaturated(Duration.ofMillis(1500))).isEqualTo(1_500_000_000L);
    }

    @Test
    void testRunTimesOut() {
        assertThatThrownBy(() -> runner.run("sleep", List.of("5"), Duration.ofMillis(200)))
                .isInstanceOf(CommandTimeoutException.class)
                .hasMessageContaining("sleep 5")
                .satisfies(e -> assertThat(((CommandTimeoutException) e).getTimeout()).isEqualTo(Duration.ofMillis(200)));
    }

    @Test
    void testRunMissingExecutable() {
        assertThatThrownBy(() -> runner.run("/nonexistent/arm-none-eabi-nm", List.of("a.elf"), Duration.ofSeconds(5)))
                .isInstanceOf(CommandStartupException.class)
                .satisfies(e -> assertThat(((ToolchainException) e).getCommand())
                        .isEqualTo("/nonexistent/arm-none-eabi-nm a.elf"));
    }

    @Test
    void testRunRejectsNegativeTimeout() {
        assertThatThrownBy(() -> runner.run("true", List.of(), Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
