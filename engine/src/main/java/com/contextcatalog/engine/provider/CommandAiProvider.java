package com.contextcatalog.engine.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a local command-line AI tool once per prompt.
 *
 * The prompt is written to the process's stdin and the answer is read from its
 * stdout. A non-zero exit status or an exceeded deadline is reported as a
 * {@link ProviderException}. The timeout covers the whole call, including
 * reading the output; on overrun the process and its attached descendants are
 * killed.
 *
 * <pre>
 *   catalog:
 *     provider:
 *       command: claude -p --model haiku
 * </pre>
 */
public class CommandAiProvider implements AiProvider {

    private static final Logger log = LoggerFactory.getLogger(CommandAiProvider.class);

    // Cap on the stderr excerpt carried in a PROCESS_ERROR message.
    private static final int MAX_STDERR_CHARS = 500;

    private final List<String> command;

    public CommandAiProvider(String commandLine) {
        this.command = splitCommand(commandLine);
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Provider command must not be blank");
        }
    }

    @Override
    public String name() {
        return "command";
    }

    @Override
    public String displayName() {
        return "Command (" + String.join(" ", command) + ")";
    }

    @Override
    public boolean isAvailable() {
        return resolveExecutable(command.get(0)) != null;
    }

    @Override
    public ProviderResponse invoke(String prompt, ProviderInvokeOptions options) {
        Duration timeout = options.timeout() != null ? options.timeout() : ProviderInvokeOptions.DEFAULT_TIMEOUT;
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();

        ProcessBuilder builder = new ProcessBuilder(command);
        if (options.cwd() != null) {
            builder.directory(options.cwd().toFile());
        }
        builder.redirectErrorStream(false);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ProviderException(ProviderException.Kind.UNAVAILABLE,
                    "Failed to start " + command.get(0) + ": " + e.getMessage(), e);
        }

        // Drain both pipes while the process runs so a chatty tool cannot block on a full buffer.
        ExecutorService drains = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "provider-output");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<String> stdout = drains.submit(() -> readAll(process.getInputStream()));
            Future<String> stderr = drains.submit(() -> readAll(process.getErrorStream()));

            // A tool that exits without reading stdin closes the pipe; its exit status decides the outcome.
            try (OutputStream in = process.getOutputStream()) {
                in.write(prompt.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.debug("Could not write prompt to {}: {}", command.get(0), e.getMessage());
            }

            boolean finished;
            try {
                finished = process.waitFor(remaining(deadline), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                kill(process);
                throw new ProviderException(ProviderException.Kind.PROCESS_ERROR,
                        "Interrupted while waiting for " + command.get(0), e);
            }
            if (!finished) {
                kill(process);
                throw new ProviderException(ProviderException.Kind.TIMEOUT,
                        command.get(0) + " did not answer within " + timeout.toMillis() + " ms");
            }

            // A helper the tool left running can hold the pipes open; the deadline covers it too.
            String output = await(stdout, deadline, process, timeout);
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            if (process.exitValue() != 0) {
                throw new ProviderException(ProviderException.Kind.PROCESS_ERROR,
                        command.get(0) + " exited with status " + process.exitValue() + ": "
                                + excerpt(await(stderr, deadline, process, timeout)));
            }
            if (output.isBlank()) {
                throw new ProviderException(ProviderException.Kind.EMPTY_RESPONSE,
                        command.get(0) + " produced no output");
            }
            if (options.verbose()) {
                log.debug("{} answered in {} ms ({} chars)", command.get(0), durationMs, output.length());
            }
            return new ProviderResponse(output.strip(), null, durationMs);
        } finally {
            drains.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Split on whitespace; double quotes group words and are removed. */
    static List<String> splitCommand(String commandLine) {
        List<String> out = new ArrayList<>();
        if (commandLine == null) {
            return out;
        }
        boolean inQuote = false;
        StringBuilder cur = new StringBuilder();
        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (Character.isWhitespace(c) && !inQuote) {
                if (cur.length() > 0) {
                    out.add(cur.toString());
                    cur.setLength(0);
                }
            } else {
                cur.append(c);
            }
        }
        if (cur.length() > 0) {
            out.add(cur.toString());
        }
        return out;
    }

    /** The executable as a path, looked up on {@code PATH} when it has no separator; null if not found. */
    static Path resolveExecutable(String executable) {
        if (executable.contains("/") || executable.contains("\\")) {
            Path path = Path.of(executable);
            return Files.isExecutable(path) ? path : null;
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null) {
            return null;
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate = Path.of(dir, executable);
            if (Files.isExecutable(candidate) && !Files.isDirectory(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static String readAll(InputStream stream) throws IOException {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private String await(Future<String> output, long deadline, Process process, Duration timeout) {
        try {
            return output.get(remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            kill(process);
            throw new ProviderException(ProviderException.Kind.TIMEOUT,
                    command.get(0) + " kept its output open past " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            throw new ProviderException(ProviderException.Kind.PROCESS_ERROR,
                    "Interrupted while reading output of " + command.get(0), e);
        } catch (ExecutionException e) {
            throw new ProviderException(ProviderException.Kind.PROCESS_ERROR,
                    "Failed to read process output", e.getCause());
        }
    }

    private static long remaining(long deadline) {
        return Math.max(0L, deadline - System.nanoTime());
    }

    /** Kill the process and whatever it spawned that is still attached to it. */
    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static String excerpt(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= MAX_STDERR_CHARS ? trimmed : trimmed.substring(0, MAX_STDERR_CHARS) + "...";
    }
}
