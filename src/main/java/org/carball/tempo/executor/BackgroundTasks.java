package org.carball.tempo.executor;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fire-and-forget task runner. Failures are caught at the task boundary and logged; the returned
 * futures always complete normally so no caller ever observes another request's failure.
 */
@Slf4j
public class BackgroundTasks implements AutoCloseable {

    private final ExecutorService executor;
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicInteger failures = new AtomicInteger();

    public BackgroundTasks(int threads) {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "tempo-background-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<Void> submit(String description, Callable<?> task) {
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(() -> runQuietly(description, task), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Background task {} rejected: {}", description, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }

        inFlight.add(future);
        future.whenComplete((ignored, error) -> inFlight.remove(future));
        return future;
    }

    /**
     * Waits until every task submitted so far has finished.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        CompletableFuture<Void> all = CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0]));
        try {
            all.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // tasks never complete exceptionally; see runQuietly
            throw new IllegalStateException("Background task completed exceptionally", e.getCause());
        }
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    public int pendingTasks() {
        return inFlight.size();
    }

    public int failedTasks() {
        return failures.get();
    }

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

    private void runQuietly(String description, Callable<?> task) {
        try {
            task.call();
        } catch (Exception e) {
            failures.incrementAndGet();
            log.warn("Background task {} failed: {}", description, e.getMessage(), e);
        }
    }
}
