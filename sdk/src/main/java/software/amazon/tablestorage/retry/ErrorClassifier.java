// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.retry;

import java.util.Objects;

/**
 * Decides whether a failed storage call may be retried.
 *
 * <p>Implementations must be pure: the verdict depends only on the failure itself, never on the attempt number or on
 * earlier failures.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies a failure.
     *
     * @param error the failure raised by the attempt
     * @return ABORT_IMMEDIATELY to surface it now, RETRY_THEN_SURFACE to keep retrying within the budget
     */
    Classification classify(Throwable error);

    /**
     * Combines two classifiers: the result aborts if either of them aborts.
     *
     * @param other classifier consulted when this one allows a retry
     * @return the combined classifier
     */
    default ErrorClassifier or(ErrorClassifier other) {
        Objects.requireNonNull(other, "other classifier cannot be null");
        return error -> classify(error) == Classification.ABORT_IMMEDIATELY
                ? Classification.ABORT_IMMEDIATELY
                : other.classify(error);
    }
}
