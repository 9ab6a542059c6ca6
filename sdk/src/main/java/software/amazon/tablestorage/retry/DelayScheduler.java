// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Waits between two attempts of a retried operation.
 *
 * <p>The returned future completes once the delay has elapsed. A blocking scheduler waits on the calling thread and
 * returns an already-completed future; a non-blocking one returns immediately.
 */
@FunctionalInterface
public interface DelayScheduler {

    /**
     * @param delay time to wait, never negative
     * @return future completed when the delay has elapsed, or completed exceptionally if the wait was interrupted
     */
    CompletableFuture<Void> delay(Duration delay);

    /** @return a scheduler that sleeps on the calling thread */
    static DelayScheduler blocking() {
        return delay -> {
            if (delay.isZero()) {
                return CompletableFuture.completedFuture(null);
            }
            try {
                TimeUnit.NANOSECONDS.sleep(delay.toNanos());
                return CompletableFuture.completedFuture(null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    /**
     * @param executor executor that continues the chain once the delay has elapsed
     * @return a scheduler that waits without blocking any thread
     */
    static DelayScheduler nonBlocking(Executor executor) {
        Objects.requireNonNull(executor, "executor cannot be null");
        return delay -> {
            if (delay.isZero()) {
                return CompletableFuture.completedFuture(null);
            }
            var delayed = CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS, executor);
            return CompletableFuture.runAsync(() -> {}, delayed);
        };
    }
}
