package com.contextcatalog.engine.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Bounded fan-out over a list of items.
 *
 * A fixed pool of at most {@code limit} workers is created per call and shut
 * down before returning, so at most {@code limit} tasks run at once. Results
 * come back in input order. A failing task is logged and captured in its own
 * {@link TaskOutcome}; its siblings keep running.
 */
public final class ConcurrencyLimiter {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyLimiter.class);

    private ConcurrencyLimiter() {}

    public static <T, R> List<TaskOutcome<R>> runWithConcurrencyLimit(
            List<T> items, int limit, Function<T, R> task) {
        if (items.isEmpty()) {
            return List.of();
        }

        int workers = Math.max(1, Math.min(limit, items.size()));
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        // Workers inherit the caller's MDC so their log lines stay attributable.
        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        try {
            List<Future<R>> futures = new ArrayList<>(items.size());
            for (T item : items) {
                futures.add(pool.submit(() -> {
                    if (callerContext != null) {
                        MDC.setContextMap(callerContext);
                    }
                    try {
                        return task.apply(item);
                    } finally {
                        MDC.clear();
                    }
                }));
            }

            List<TaskOutcome<R>> outcomes = new ArrayList<>(items.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), items.get(i)));
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private static <T, R> TaskOutcome<R> await(Future<R> future, T item) {
        try {
            return TaskOutcome.success(future.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Task failed for {}: {}", item, cause.getMessage(), cause);
            return TaskOutcome.failure(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for task on {}", item);
            return TaskOutcome.failure(e);
        }
    }
}
