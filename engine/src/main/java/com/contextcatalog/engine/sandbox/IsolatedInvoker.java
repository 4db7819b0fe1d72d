package com.contextcatalog.engine.sandbox;

import com.contextcatalog.engine.provider.AiProvider;
import com.contextcatalog.engine.provider.ProviderException;
import com.contextcatalog.engine.provider.ProviderInvokeOptions;
import com.contextcatalog.engine.provider.ProviderResponse;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Runs provider calls inside a fresh, empty working directory so that a
 * command-line AI tool cannot pick up the repository's own AGENTS.md, CLAUDE.md
 * or rules while summarizing a document.
 *
 * <p>Each call gets {@code <root>/prompt-<random>}; the directory is removed
 * after the call whatever its outcome. Every call is instrumented:
 * <pre>
 *   catalog.sandbox.calls{provider, status="success|timeout|process_error|unavailable|empty_response|error"}
 *   catalog.sandbox.duration{provider}
 * </pre>
 */
@Component
public class IsolatedInvoker {

    private static final Logger log = LoggerFactory.getLogger(IsolatedInvoker.class);

    private static final String DIRECTORY_PREFIX = "prompt-";

    private final Path sandboxRoot;
    private final Path projectRoot;
    private final MeterRegistry meterRegistry;

    public IsolatedInvoker(
            @Value("${catalog.sandbox.root:${user.dir}/tmp/isolated-prompts}") String sandboxRoot,
            @Value("${catalog.sandbox.project-root:${user.dir}}") String projectRoot,
            MeterRegistry meterRegistry) {
        this.sandboxRoot   = Path.of(sandboxRoot).toAbsolutePath().normalize();
        this.projectRoot   = Path.of(projectRoot).toAbsolutePath().normalize();
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Invocation
    // ------------------------------------------------------------------

    /**
     * Invoke {@code provider} with its working directory replaced by a new sandbox
     * directory. All other options pass through unchanged. Provider failures
     * propagate after cleanup.
     *
     * @throws SandboxException if the sandbox directory cannot be created
     */
    public ProviderResponse invokeIsolated(AiProvider provider, String prompt, ProviderInvokeOptions options) {
        Path sandbox = createSandbox();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return provider.invoke(prompt, options.withCwd(sandbox));
        } catch (ProviderException e) {
            status = e.getKind().name().toLowerCase(Locale.ROOT);
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            deleteQuietly(sandbox);
            String providerTag = providerTag(provider);
            sample.stop(meterRegistry.timer("catalog.sandbox.duration", "provider", providerTag));
            meterRegistry.counter("catalog.sandbox.calls",
                    "provider", providerTag, "status", status).increment();
        }
    }

    public Path sandboxRoot() {
        return sandboxRoot;
    }

    private static String providerTag(AiProvider provider) {
        String name = provider.name();
        return name != null ? name : "unknown";
    }

    private Path createSandbox() {
        try {
            Files.createDirectories(sandboxRoot);
            Path dir = Files.createTempDirectory(sandboxRoot, DIRECTORY_PREFIX);
            log.debug("Created sandbox {}", dir);
            return dir;
        } catch (IOException e) {
            throw new SandboxException("Cannot create sandbox directory under " + sandboxRoot, e);
        }
    }

    // ------------------------------------------------------------------
    // Cleanup
    // ------------------------------------------------------------------

    /**
     * Remove the sandbox root and its empty ancestors, walking upwards and stopping
     * at the first non-empty directory or at the project root (never removed).
     * Failures end the sweep quietly.
     *
     * @return the directories removed, innermost first
     */
    public List<Path> sweepEmptyDirectories() {
        List<Path> removed = new ArrayList<>();
        Path dir = sandboxRoot;
        while (dir != null && !dir.equals(projectRoot) && dir.startsWith(projectRoot)) {
            if (!Files.isDirectory(dir) || !isEmpty(dir)) {
                break;
            }
            try {
                Files.delete(dir);
                removed.add(dir);
            } catch (IOException e) {
                log.debug("Could not remove empty directory {}: {}", dir, e.getMessage());
                break;
            }
            dir = dir.getParent();
        }
        if (!removed.isEmpty()) {
            log.debug("Removed {} empty sandbox director(ies): {}", removed.size(), removed);
        }
        return removed;
    }

    private static boolean isEmpty(Path dir) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            return !entries.iterator().hasNext();
        } catch (IOException e) {
            log.debug("Could not list {}: {}", dir, e.getMessage());
            return false;
        }
    }

    /** Best effort: a failure here never replaces the provider's result or error. */
    static void deleteQuietly(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.debug("Failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to clean up sandbox {}: {}", dir, e.getMessage());
        }
    }
}
