// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import software.amazon.tablestorage.retry.ErrorClassifier;
import software.amazon.tablestorage.retry.ErrorClassifiers;
import software.amazon.tablestorage.retry.RetryPolicy;
import software.amazon.tablestorage.validation.ParameterValidator;

/**
 * Configuration for {@link RetryingTableStorage}. This class provides a builder pattern for the attempt budgets, the
 * delay between attempts and the error classifier.
 *
 * <p>Configuration is validated once in {@link Builder#build()} and is immutable afterwards, so one instance can be
 * shared by any number of decorators.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * var config = RetryConfig.builder()
 *     .withWriteAttempts(5)
 *     .withReadAttempts(3)
 *     .withRetryDelay(Duration.ofMillis(500))
 *     .build();
 *
 * TableStorage<Order> orders = RetryingTableStorage.wrap(ordersTable, config);
 * }</pre>
 */
public final class RetryConfig {

    public static final int DEFAULT_WRITE_ATTEMPTS = 10;
    public static final int DEFAULT_READ_ATTEMPTS = 10;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(200);

    private final int writeAttempts;
    private final int readAttempts;
    private final Duration retryDelay;
    private final ErrorClassifier errorClassifier;
    private final Executor delayExecutor;

    private RetryConfig(Builder builder) {
        this.writeAttempts = builder.writeAttempts != null ? builder.writeAttempts : DEFAULT_WRITE_ATTEMPTS;
        this.readAttempts = builder.readAttempts != null ? builder.readAttempts : DEFAULT_READ_ATTEMPTS;
        this.retryDelay = builder.retryDelay != null ? builder.retryDelay : DEFAULT_RETRY_DELAY;
        this.errorClassifier =
                builder.errorClassifier != null ? builder.errorClassifier : ErrorClassifiers.Presets.DEFAULT;
        this.delayExecutor = builder.delayExecutor != null ? builder.delayExecutor : ForkJoinPool.commonPool();

        ParameterValidator.validatePositiveInteger(writeAttempts, "writeAttempts");
        ParameterValidator.validatePositiveInteger(readAttempts, "readAttempts");
        ParameterValidator.validateNonNegativeDuration(retryDelay, "retryDelay");
    }

    /**
     * Creates a RetryConfig with default settings: 10 write attempts, 10 read attempts, 200 ms between attempts and
     * the default error classifier.
     *
     * @return RetryConfig with default configuration
     */
    public static RetryConfig defaultConfig() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getWriteAttempts() {
        return writeAttempts;
    }

    public int getReadAttempts() {
        return readAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public ErrorClassifier getErrorClassifier() {
        return errorClassifier;
    }

    /** @return executor the asynchronous inter-attempt delay hands off to (never null) */
    public Executor getDelayExecutor() {
        return delayExecutor;
    }

    /** @return retry policy applied to operations that mutate remote state */
    public RetryPolicy writePolicy() {
        return RetryPolicy.of(writeAttempts, retryDelay);
    }

    /** @return retry policy applied to operations that only read remote state */
    public RetryPolicy readPolicy() {
        return RetryPolicy.of(readAttempts, retryDelay);
    }

    @Override
    public String toString() {
        return "RetryConfig{writeAttempts=" + writeAttempts + ", readAttempts=" + readAttempts + ", retryDelay="
                + retryDelay + "}";
    }

    /** Builder for RetryConfig. */
    public static final class Builder {
        private Integer writeAttempts;
        private Integer readAttempts;
        private Duration retryDelay;
        private ErrorClassifier errorClassifier;
        private Executor delayExecutor;

        private Builder() {}

        /**
         * Sets the maximum number of attempts for write operations, including the first one.
         *
         * @param writeAttempts attempt budget, must be at least 1
         * @return This builder
         */
        public Builder withWriteAttempts(int writeAttempts) {
            this.writeAttempts = writeAttempts;
            return this;
        }

        /**
         * Sets the maximum number of attempts for read operations, including the first one.
         *
         * @param readAttempts attempt budget, must be at least 1
         * @return This builder
         */
        public Builder withReadAttempts(int readAttempts) {
            this.readAttempts = readAttempts;
            return this;
        }

        /**
         * Sets the fixed wait between two attempts. Zero retries immediately.
         *
         * @param retryDelay delay, must not be negative
         * @return This builder
         */
        public Builder withRetryDelay(Duration retryDelay) {
            this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay cannot be null");
            return this;
        }

        /**
         * Sets the classifier deciding which failures are retried.
         *
         * @param errorClassifier Custom ErrorClassifier instance
         * @return This builder
         * @throws NullPointerException if errorClassifier is null
         */
        public Builder withErrorClassifier(ErrorClassifier errorClassifier) {
            this.errorClassifier = Objects.requireNonNull(errorClassifier, "ErrorClassifier cannot be null");
            return this;
        }

        /**
         * Sets the executor that resumes asynchronous calls once the delay between attempts has elapsed. If not set,
         * the common fork-join pool is used. Synchronous calls always wait on the caller thread.
         *
         * @param delayExecutor Custom Executor instance
         * @return This builder
         */
        public Builder withDelayExecutor(Executor delayExecutor) {
            this.delayExecutor = Objects.requireNonNull(delayExecutor, "delayExecutor cannot be null");
            return this;
        }

        /**
         * Builds the RetryConfig instance.
         *
         * @return Immutable RetryConfig instance
         * @throws IllegalArgumentException if an attempt budget is below 1 or the delay is negative
         */
        public RetryConfig build() {
            return new RetryConfig(this);
        }
    }
}
