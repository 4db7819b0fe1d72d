package com.contextcatalog.engine.sandbox;

import com.contextcatalog.engine.provider.AiProvider;
import com.contextcatalog.engine.provider.ProviderException;
import com.contextcatalog.engine.provider.ProviderInvokeOptions;
import com.contextcatalog.engine.provider.ProviderResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IsolatedInvokerTest {

    @TempDir Path project;
    @Mock AiProvider provider;

    SimpleMeterRegistry meterRegistry;
    IsolatedInvoker invoker;
    Path sandboxRoot;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        sandboxRoot = project.resolve("tmp/isolated-prompts");
        invoker = new IsolatedInvoker(sandboxRoot.toString(), project.toString(), meterRegistry);
        lenient().when(provider.name()).thenReturn("fake");
    }

    // ------------------------------------------------------------------
    // invokeIsolated()
    // ------------------------------------------------------------------

    @Test
    void invokeIsolated_runsInFreshEmptyDirectory_removedAfterwards() {
        Path[] seenCwd = new Path[1];
        boolean[] emptyDuringCall = new boolean[1];
        when(provider.invoke(eq("prompt"), any())).thenAnswer(inv -> {
            ProviderInvokeOptions opts = inv.getArgument(1);
            seenCwd[0] = opts.cwd();
            try (Stream<Path> entries = Files.list(opts.cwd())) {
                emptyDuringCall[0] = entries.findAny().isEmpty();
            }
            return ProviderResponse.of("A detailed summary sentence.");
        });

        ProviderResponse response = invoker.invokeIsolated(provider, "prompt",
                new ProviderInvokeOptions(project, Duration.ofSeconds(5), true));

        assertThat(response.result()).isEqualTo("A detailed summary sentence.");
        assertThat(seenCwd[0].getParent()).isEqualTo(sandboxRoot);
        assertThat(seenCwd[0].getFileName().toString()).startsWith("prompt-");
        assertThat(emptyDuringCall[0]).isTrue();
        assertThat(seenCwd[0]).doesNotExist();
        assertThat(meterRegistry.counter("catalog.sandbox.calls", "provider", "fake", "status", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void invokeIsolated_passesOtherOptionsThrough() {
        when(provider.invoke(any(), any())).thenReturn(ProviderResponse.of("ok, a summary"));

        invoker.invokeIsolated(provider, "p", new ProviderInvokeOptions(project, Duration.ofSeconds(7), true));

        ArgumentCaptor<ProviderInvokeOptions> captor = ArgumentCaptor.forClass(ProviderInvokeOptions.class);
        verify(provider).invoke(eq("p"), captor.capture());
        assertThat(captor.getValue().timeout()).isEqualTo(Duration.ofSeconds(7));
        assertThat(captor.getValue().verbose()).isTrue();
        assertThat(captor.getValue().cwd()).isNotEqualTo(project);
    }

    @Test
    void invokeIsolated_providerFails_directoryRemovedAndErrorPropagated() {
        Path[] seenCwd = new Path[1];
        when(provider.invoke(any(), any())).thenAnswer(inv -> {
            ProviderInvokeOptions opts = inv.getArgument(1);
            seenCwd[0] = opts.cwd();
            Files.writeString(opts.cwd().resolve("scratch.txt"), "left behind by the tool");
            throw new ProviderException(ProviderException.Kind.TIMEOUT, "too slow");
        });

        assertThatThrownBy(() -> invoker.invokeIsolated(provider, "p", ProviderInvokeOptions.defaults()))
                .isInstanceOf(ProviderException.class);

        assertThat(seenCwd[0]).doesNotExist();
        assertThat(meterRegistry.counter("catalog.sandbox.calls", "provider", "fake", "status", "timeout").count())
                .isEqualTo(1.0);
    }

    @Test
    void invokeIsolated_concurrentCalls_getDistinctDirectories() throws Exception {
        Set<Path> dirs = ConcurrentHashMap.newKeySet();
        CountDownLatch bothInside = new CountDownLatch(2);
        when(provider.invoke(any(), any())).thenAnswer(inv -> {
            ProviderInvokeOptions opts = inv.getArgument(1);
            dirs.add(opts.cwd());
            bothInside.countDown();
            bothInside.await(5, TimeUnit.SECONDS);
            return ProviderResponse.of("concurrent summary");
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<ProviderResponse>> calls = List.of(
                    pool.submit(() -> invoker.invokeIsolated(provider, "a", ProviderInvokeOptions.defaults())),
                    pool.submit(() -> invoker.invokeIsolated(provider, "b", ProviderInvokeOptions.defaults())));
            for (Future<ProviderResponse> call : calls) {
                call.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(dirs).hasSize(2);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void invokeIsolated_cleanupFails_providerResultStillReturned() throws Exception {
        // Nested deeper than PATH_MAX, so walking the sandbox for deletion fails.
        String nest = "d".repeat(40);
        String script = "i=0; while [ $i -lt 150 ]; do mkdir " + nest + " && cd " + nest
                + " || exit 1; i=$((i+1)); done";
        when(provider.invoke(any(), any())).thenAnswer(inv -> {
            ProviderInvokeOptions opts = inv.getArgument(1);
            Process mkdirs = new ProcessBuilder("sh", "-c", script).directory(opts.cwd().toFile()).start();
            assertThat(mkdirs.waitFor(30, TimeUnit.SECONDS)).isTrue();
            return ProviderResponse.of("A perfectly good one-sentence summary.");
        });

        try {
            ProviderResponse response = invoker.invokeIsolated(provider, "p", ProviderInvokeOptions.defaults());

            assertThat(response.result()).isEqualTo("A perfectly good one-sentence summary.");
            assertThat(meterRegistry.counter("catalog.sandbox.calls", "provider", "fake", "status", "success").count())
                    .isEqualTo(1.0);
        } finally {
            new ProcessBuilder("rm", "-rf", sandboxRoot.toString()).start().waitFor(30, TimeUnit.SECONDS);
        }
    }

    @Test
    void invokeIsolated_providerWithoutName_taggedUnknown() {
        when(provider.name()).thenReturn(null);
        when(provider.invoke(any(), any())).thenReturn(ProviderResponse.of("an anonymous summary"));

        ProviderResponse response = invoker.invokeIsolated(provider, "p", ProviderInvokeOptions.defaults());

        assertThat(response.result()).isEqualTo("an anonymous summary");
        assertThat(meterRegistry.counter("catalog.sandbox.calls", "provider", "unknown", "status", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void invokeIsolated_rootNotCreatable_sandboxException() throws IOException {
        Files.writeString(project.resolve("blocker"), "a file where a directory should be");
        IsolatedInvoker blocked = new IsolatedInvoker(
                project.resolve("blocker/isolated-prompts").toString(), project.toString(), meterRegistry);

        assertThatThrownBy(() -> blocked.invokeIsolated(provider, "p", ProviderInvokeOptions.defaults()))
                .isInstanceOf(SandboxException.class);
    }

    // ------------------------------------------------------------------
    // sweepEmptyDirectories()
    // ------------------------------------------------------------------

    @Test
    void sweepEmptyDirectories_removesEmptyChainUpToProjectRoot() throws IOException {
        Files.createDirectories(sandboxRoot);

        List<Path> removed = invoker.sweepEmptyDirectories();

        assertThat(removed).containsExactly(sandboxRoot, sandboxRoot.getParent());
        assertThat(project.resolve("tmp")).doesNotExist();
        assertThat(project).exists();
    }

    @Test
    void sweepEmptyDirectories_stopsAtNonEmptyParent() throws IOException {
        Files.createDirectories(sandboxRoot);
        Files.writeString(project.resolve("tmp/keep.txt"), "keep");

        assertThat(invoker.sweepEmptyDirectories()).containsExactly(sandboxRoot);
        assertThat(project.resolve("tmp")).exists();
    }

    @Test
    void sweepEmptyDirectories_nothingToDo_empty() {
        assertThat(invoker.sweepEmptyDirectories()).isEmpty();
    }
}
