package com.contextcatalog.engine.provider;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandAiProviderTest {

    @TempDir Path cwd;

    // ------------------------------------------------------------------
    // Command parsing
    // ------------------------------------------------------------------

    @Test
    void splitCommand_quotesGroupWords() {
        assertThat(CommandAiProvider.splitCommand("claude -p  --append-system-prompt \"be brief\""))
                .containsExactly("claude", "-p", "--append-system-prompt", "be brief");
    }

    @Test
    void constructor_blankCommand_rejected() {
        assertThatThrownBy(() -> new CommandAiProvider("   ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isAvailable_unknownExecutable_false() {
        assertThat(new CommandAiProvider("definitely-not-a-real-binary-4711").isAvailable()).isFalse();
    }

    // ------------------------------------------------------------------
    // Process execution
    // ------------------------------------------------------------------

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void invoke_promptOnStdin_answerFromStdout() {
        CommandAiProvider provider = new CommandAiProvider("cat");

        ProviderResponse response = provider.invoke("  Summarize this document.\n", options(Duration.ofSeconds(10)));

        assertThat(response.result()).isEqualTo("Summarize this document.");
        assertThat(response.durationMs()).isNotNull();
        assertThat(response.costUsd()).isNull();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void invoke_nonZeroExit_processError() {
        assertThatThrownBy(() -> new CommandAiProvider("false").invoke("x", options(Duration.ofSeconds(10))))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getKind())
                .isEqualTo(ProviderException.Kind.PROCESS_ERROR);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void invoke_noOutput_emptyResponse() {
        assertThatThrownBy(() -> new CommandAiProvider("true").invoke("x", options(Duration.ofSeconds(10))))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getKind())
                .isEqualTo(ProviderException.Kind.EMPTY_RESPONSE);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void invoke_deadlineExceeded_timeout() {
        assertThatThrownBy(() -> new CommandAiProvider("sleep 5").invoke("x", options(Duration.ofMillis(200))))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getKind())
                .isEqualTo(ProviderException.Kind.TIMEOUT);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void invoke_backgroundChildHoldsOutputOpen_timeoutStillEnforced() {
        CommandAiProvider provider = new CommandAiProvider("sh -c \"(sleep 10) & echo a-long-enough-answer\"");
        long start = System.nanoTime();

        assertThatThrownBy(() -> provider.invoke("x", options(Duration.ofSeconds(1))))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getKind())
                .isEqualTo(ProviderException.Kind.TIMEOUT);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void invoke_missingExecutable_unavailable() {
        assertThatThrownBy(() -> new CommandAiProvider("definitely-not-a-real-binary-4711")
                .invoke("x", options(Duration.ofSeconds(1))))
                .isInstanceOf(ProviderException.class)
                .extracting(e -> ((ProviderException) e).getKind())
                .isEqualTo(ProviderException.Kind.UNAVAILABLE);
    }

    private ProviderInvokeOptions options(Duration timeout) {
        return new ProviderInvokeOptions(cwd, timeout, false);
    }
}
