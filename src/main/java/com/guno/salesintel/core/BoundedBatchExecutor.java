package com.guno.salesintel.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Fans work out in fixed-size batches: every item of a batch runs concurrently, the next batch
 * starts once the current one has settled, and a pacing delay separates consecutive batches.
 */
@Slf4j
@RequiredArgsConstructor
public class BoundedBatchExecutor {

    private final ExecutorService executor;
    private final Sleeper sleeper;

    /**
     * Outcome of one item. Exactly one of {@code value} and {@code error} is meaningful.
     */
    @Value
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class Settled<I, R> {
        I item;
        R value;
        Throwable error;

        public boolean isSuccess() {
            return error == null;
        }
    }

    /**
     * Results come back in input order. A failing item never fails its batch.
     */
    public <I, R> List<Settled<I, R>> withBoundedConcurrency(List<I> items, int batchSize, long pacingMs,
                                                             Function<I, R> task) {
        int size = Math.max(1, batchSize);
        List<Settled<I, R>> results = new ArrayList<>(items.size());

        for (int start = 0; start < items.size(); start += size) {
            List<I> batch = items.subList(start, Math.min(start + size, items.size()));
            log.debug("Running batch {}-{} of {}", start + 1, start + batch.size(), items.size());

            List<CompletableFuture<R>> futures = new ArrayList<>(batch.size());
            for (I item : batch) {
                futures.add(CompletableFuture.supplyAsync(() -> task.apply(item), executor));
            }

            for (int i = 0; i < batch.size(); i++) {
                results.add(settle(batch.get(i), futures.get(i)));
            }

            boolean moreBatches = start + size < items.size();
            if (moreBatches && pacingMs > 0) {
                try {
                    sleeper.sleep(pacingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted between batches - continuing without pacing");
                }
            }
        }

        return results;
    }

    private static <I, R> Settled<I, R> settle(I item, CompletableFuture<R> future) {
        try {
            return new Settled<>(item, future.join(), null);
        } catch (CompletionException e) {
            return new Settled<>(item, null, e.getCause() != null ? e.getCause() : e);
        } catch (Exception e) {
            return new Settled<>(item, null, e);
        }
    }
}
