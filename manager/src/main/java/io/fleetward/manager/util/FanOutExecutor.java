package io.fleetward.manager.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs one operation against many targets concurrently and waits for all of
 * them before returning.
 *
 * <p>Every call submits one task per target and joins on all of them, so no
 * task outlives the call that spawned it. A target whose task throws is
 * mapped through the supplied failure function; the result map always holds
 * one entry per distinct target, in input order.</p>
 */
public class FanOutExecutor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FanOutExecutor.class);

    private final ExecutorService executor;

    /**
     * Create a fan-out executor backed by a cached pool of daemon threads.
     *
     * @param threadPrefix thread name prefix
     */
    public FanOutExecutor(@Nonnull String threadPrefix) {
        Objects.requireNonNull(threadPrefix, "threadPrefix");
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, threadPrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Apply {@code task} to every distinct target and collect the results.
     *
     * @param targets target keys, duplicates are ignored
     * @param task operation to run per target
     * @param onFailure maps a target and its failure to a result
     * @return results keyed by target, in input order
     */
    @Nonnull
    public <T, R> Map<T, R> invokeAll(
            @Nonnull Collection<T> targets,
            @Nonnull Function<T, R> task,
            @Nonnull BiFunction<T, Throwable, R> onFailure) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(onFailure, "onFailure");

        List<T> distinct = new ArrayList<>(new LinkedHashSet<>(targets));
        Map<T, CompletableFuture<R>> futures = new LinkedHashMap<>();
        for (T target : distinct) {
            futures.put(target, CompletableFuture.supplyAsync(() -> task.apply(target), executor));
        }

        Map<T, R> results = new LinkedHashMap<>();
        for (Map.Entry<T, CompletableFuture<R>> entry : futures.entrySet()) {
            results.put(entry.getKey(), await(entry.getKey(), entry.getValue(), onFailure));
        }
        return results;
    }

    private <T, R> R await(T target, CompletableFuture<R> future, BiFunction<T, Throwable, R> onFailure) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOGGER.debug("Fan-out task for '{}' failed: {}", target, cause.getMessage());
            return onFailure.apply(target, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return onFailure.apply(target, e);
        }
    }

    /**
     * Submit a single background task on the shared pool.
     */
    @Nonnull
    public CompletableFuture<Void> runAsync(@Nonnull Runnable task) {
        return CompletableFuture.runAsync(task, executor);
    }

    /**
     * Stop accepting work and wait briefly for running tasks.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
