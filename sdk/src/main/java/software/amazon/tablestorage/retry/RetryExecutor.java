// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.retry;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ForkJoinPool;
import java.util.function.IntSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.tablestorage.util.ExceptionHelper;

/**
 * Runs an operation until it succeeds, fails with an abort-class error, or exhausts the attempt budget of a
 * {@link RetryPolicy}.
 *
 * <p>Both forms share the classification and budget step. The synchronous form runs its attempts in a loop on the
 * caller's thread and waits with a blocking {@link DelayScheduler}. The asynchronous form chains the operation's
 * futures with a non-blocking scheduler, looping over attempts and delays that complete without suspending.
 *
 * <p>The failure surfaced to the caller is always the one raised by the last attempt, unwrapped: no aggregation and
 * no "retries exhausted" exception. The executor holds no per-call state and is safe to share between threads.
 */
public class RetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private static final String UNNAMED_OPERATION = "operation";

    private final ErrorClassifier errorClassifier;
    private final DelayScheduler blockingScheduler;
    private final DelayScheduler asyncScheduler;

    /** Outcome of one attempt of the loop. */
    private record Attempt<T>(int index, T value, Throwable failure) {
        boolean succeeded() {
            return failure == null;
        }
    }

    /**
     * Creates an executor that sleeps on the caller thread for synchronous calls and resumes asynchronous calls on the
     * common fork-join pool.
     *
     * @param errorClassifier classifier consulted after every failed attempt
     */
    public RetryExecutor(ErrorClassifier errorClassifier) {
        this(errorClassifier, DelayScheduler.blocking(), DelayScheduler.nonBlocking(ForkJoinPool.commonPool()));
    }

    /**
     * @param errorClassifier classifier consulted after every failed attempt
     * @param blockingScheduler scheduler used between attempts of {@link #execute}
     * @param asyncScheduler scheduler used between attempts of {@link #executeAsync}
     */
    public RetryExecutor(
            ErrorClassifier errorClassifier, DelayScheduler blockingScheduler, DelayScheduler asyncScheduler) {
        this.errorClassifier = Objects.requireNonNull(errorClassifier, "ErrorClassifier cannot be null");
        this.blockingScheduler = Objects.requireNonNull(blockingScheduler, "blocking DelayScheduler cannot be null");
        this.asyncScheduler = Objects.requireNonNull(asyncScheduler, "async DelayScheduler cannot be null");
    }

    public ErrorClassifier getErrorClassifier() {
        return errorClassifier;
    }

    public <T> T execute(Callable<T> operation, RetryPolicy policy) {
        return execute(UNNAMED_OPERATION, operation, policy);
    }

    /**
     * Runs a blocking operation with retries on the calling thread.
     *
     * <p>Checked exceptions thrown by the operation are rethrown as they are, without wrapping.
     *
     * @param operationName name used in log messages
     * @param operation the operation to run
     * @param policy attempt budget and delay
     * @return the value of the first successful attempt
     */
    public <T> T execute(String operationName, Callable<T> operation, RetryPolicy policy) {
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        for (int attempt = 1; ; attempt++) {
            Throwable failure;
            try {
                return operation.call();
            } catch (Throwable e) {
                failure = e;
            }

            if (!shouldRetry(operationName, new Attempt<T>(attempt, null, failure), policy)) {
                ExceptionHelper.sneakyThrow(failure);
            }
            if (!awaitBlockingDelay(policy)) {
                logger.debug(
                        "{}: wait before attempt {} was interrupted, surfacing last failure", operationName, attempt + 1);
                ExceptionHelper.sneakyThrow(failure);
            }
        }
    }

    public <T> CompletableFuture<T> executeAsync(Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
        return executeAsync(UNNAMED_OPERATION, operation, policy);
    }

    /**
     * Runs an asynchronous operation with retries. The next attempt starts only after the previous attempt's future
     * has completed and the delay has elapsed.
     *
     * <p>Cancelling the returned future stops the loop: no attempt is started after the cancellation is observed.
     *
     * @param operationName name used in log messages
     * @param operation supplier starting one attempt; throwing from it counts as a failed attempt
     * @param policy attempt budget and delay
     * @return future completed with the first successful value, or exceptionally with the last attempt's failure
     */
    public <T> CompletableFuture<T> executeAsync(
            String operationName, Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        return new AsyncLoop<>(operationName, operation, policy).start();
    }

    private boolean awaitBlockingDelay(RetryPolicy policy) {
        try {
            startDelay(blockingScheduler, policy).join();
            return true;
        } catch (CompletionException | CancellationException e) {
            return false;
        }
    }

    /**
     * Drives the attempts of one asynchronous call. Attempts and delays that are already complete are handled in a
     * plain loop; a callback is registered only for a future that is still pending, so the stack does not grow with
     * the number of attempts.
     */
    private final class AsyncLoop<T> {
        private final String operationName;
        private final Supplier<CompletableFuture<T>> operation;
        private final RetryPolicy policy;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        AsyncLoop(String operationName, Supplier<CompletableFuture<T>> operation, RetryPolicy policy) {
            this.operationName = operationName;
            this.operation = operation;
            this.policy = policy;
        }

        CompletableFuture<T> start() {
            resumeWith(() -> 1);
            return result;
        }

        private void run(int firstAttempt) {
            int attempt = firstAttempt;
            while (attempt > 0 && !result.isDone()) {
                int current = attempt;
                var outcomeFuture = invokeAsync(operation)
                        .handle((value, error) -> new Attempt<T>(
                                current, value, error != null ? ExceptionHelper.unwrapCompletableFuture(error) : null));
                if (!outcomeFuture.isDone()) {
                    outcomeFuture.whenComplete((outcome, ignored) -> resumeWith(() -> onOutcome(outcome)));
                    return;
                }
                attempt = onOutcome(outcomeFuture.join());
            }
        }

        private void resumeWith(IntSupplier step) {
            try {
                int next = step.getAsInt();
                if (next > 0) {
                    run(next);
                }
            } catch (Throwable e) {
                result.completeExceptionally(e);
            }
        }

        /** @return the next attempt to run on this thread, or 0 when the call is settled or continues in a callback */
        private int onOutcome(Attempt<T> outcome) {
            if (outcome.succeeded()) {
                result.complete(outcome.value());
                return 0;
            }
            if (!shouldRetry(operationName, outcome, policy)) {
                result.completeExceptionally(outcome.failure());
                return 0;
            }
            if (result.isDone()) {
                logger.debug("{}: cancelled after attempt {}", operationName, outcome.index());
                return 0;
            }

            var wait = startDelay(asyncScheduler, policy);
            if (!wait.isDone()) {
                wait.whenComplete((ignored, delayError) -> resumeWith(() -> afterDelay(outcome, delayError != null)));
                return 0;
            }
            return afterDelay(outcome, wait.isCompletedExceptionally());
        }

        private int afterDelay(Attempt<T> outcome, boolean delayFailed) {
            if (delayFailed) {
                logger.debug(
                        "{}: wait before attempt {} was interrupted, surfacing last failure",
                        operationName,
                        outcome.index() + 1);
                result.completeExceptionally(outcome.failure());
                return 0;
            }
            return outcome.index() + 1;
        }
    }

    private boolean shouldRetry(String operationName, Attempt<?> attempt, RetryPolicy policy) {
        var failure = attempt.failure();
        Classification classification;
        try {
            classification = errorClassifier.classify(failure);
        } catch (RuntimeException e) {
            logger.warn("{}: error classifier failed, surfacing attempt {} failure", operationName, attempt.index(), e);
            return false;
        }

        if (classification == Classification.ABORT_IMMEDIATELY) {
            logger.debug("{}: attempt {} failed with non-retryable error: {}", operationName, attempt.index(), failure);
            return false;
        }
        if (policy.isLastAttempt(attempt.index())) {
            logger.warn(
                    "{}: giving up after {} attempt(s), last error: {}", operationName, attempt.index(), failure);
            return false;
        }

        logger.debug(
                "{}: attempt {}/{} failed, retrying in {} ms: {}",
                operationName,
                attempt.index(),
                policy.maxAttempts(),
                policy.delay().toMillis(),
                failure);
        return true;
    }

    private static CompletableFuture<Void> startDelay(DelayScheduler scheduler, RetryPolicy policy) {
        try {
            return scheduler.delay(policy.delay());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static <T> CompletableFuture<T> invokeAsync(Supplier<CompletableFuture<T>> operation) {
        try {
            var future = operation.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new NullPointerException("operation returned a null future"));
            }
            return future;
        } catch (Throwable e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
