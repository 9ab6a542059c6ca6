// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.retry;

import java.time.Duration;
import software.amazon.tablestorage.validation.ParameterValidator;

/**
 * Attempt budget and fixed inter-attempt delay for one category of operations.
 *
 * @param maxAttempts maximum number of attempts, including the first one
 * @param delay wait between two consecutive attempts
 */
public record RetryPolicy(int maxAttempts, Duration delay) {

    public RetryPolicy {
        ParameterValidator.validatePositiveInteger(maxAttempts, "maxAttempts");
        ParameterValidator.validateNonNegativeDuration(delay, "delay");
    }

    public static RetryPolicy of(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay);
    }

    /** @return a policy that makes a single attempt */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO);
    }

    /** @return true if an attempt with this 1-based index is the last one allowed */
    public boolean isLastAttempt(int attempt) {
        return attempt >= maxAttempts;
    }
}
