// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.retry;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.tablestorage.exception.OptimisticConcurrencyException;
import software.amazon.tablestorage.exception.StatusCodes;
import software.amazon.tablestorage.exception.TableStorageException;
import software.amazon.tablestorage.util.ExceptionHelper;

/**
 * Factory class for creating common error classifiers.
 *
 * <p>Status codes are read from {@link TableStorageException} and from AWS SDK {@link SdkServiceException}, so
 * storage implementations backed by an AWS SDK client are classified without translating their exceptions.
 * {@code CompletionException} and {@code ExecutionException} wrappers are looked through.
 */
public final class ErrorClassifiers {

    /** Preset classifiers for common use cases. */
    public static final class Presets {

        /**
         * Default classifier. Aborts on optimistic-concurrency violations, on status 400 (bad request), 409 (conflict)
         * and 412 (precondition failed), and on cancellation. Everything else is retried.
         */
        public static final ErrorClassifier DEFAULT = abortOn(OptimisticConcurrencyException.class)
                .or(abortOnStatusCodes(
                        StatusCodes.BAD_REQUEST, StatusCodes.CONFLICT, StatusCodes.PRECONDITION_FAILED))
                .or(abortOnCancellation());

        /** Retries every failure until the budget is exhausted. */
        public static final ErrorClassifier ALWAYS_RETRY = error -> Classification.RETRY_THEN_SURFACE;

        /** Surfaces every failure on first occurrence. */
        public static final ErrorClassifier NEVER_RETRY = error -> Classification.ABORT_IMMEDIATELY;

        private Presets() {}
    }

    private ErrorClassifiers() {}

    /**
     * Creates a classifier aborting on failures that carry one of the given transport status codes.
     *
     * @param statusCodes status codes that must not be retried
     * @return the classifier
     */
    public static ErrorClassifier abortOnStatusCodes(int... statusCodes) {
        if (statusCodes == null || statusCodes.length == 0) {
            throw new IllegalArgumentException("statusCodes cannot be empty");
        }
        Set<Integer> codes = Arrays.stream(statusCodes).boxed().collect(Collectors.toUnmodifiableSet());
        return error -> codes.contains(statusCodeOf(error))
                ? Classification.ABORT_IMMEDIATELY
                : Classification.RETRY_THEN_SURFACE;
    }

    /**
     * Creates a classifier aborting on failures of the given types or their subtypes.
     *
     * @param types failure types that must not be retried
     * @return the classifier
     */
    @SafeVarargs
    public static ErrorClassifier abortOn(Class<? extends Throwable>... types) {
        if (types == null || types.length == 0) {
            throw new IllegalArgumentException("types cannot be empty");
        }
        List<Class<? extends Throwable>> abortTypes = List.of(types);
        return error -> {
            var cause = ExceptionHelper.unwrapAsyncWrappers(error);
            return abortTypes.stream().anyMatch(type -> type.isInstance(cause))
                    ? Classification.ABORT_IMMEDIATELY
                    : Classification.RETRY_THEN_SURFACE;
        };
    }

    /** @return a classifier aborting on cancellation and interruption of the attempt */
    public static ErrorClassifier abortOnCancellation() {
        return abortOn(CancellationException.class, InterruptedException.class, AbortedException.class);
    }

    /**
     * Extracts the transport status code of a failure.
     *
     * @param error the failure
     * @return the status code, or {@link StatusCodes#UNKNOWN} if the failure does not carry one
     */
    public static int statusCodeOf(Throwable error) {
        var cause = ExceptionHelper.unwrapAsyncWrappers(error);
        if (cause instanceof TableStorageException storageException) {
            return storageException.getStatusCode();
        }
        if (cause instanceof SdkServiceException serviceException) {
            return serviceException.statusCode();
        }
        return StatusCodes.UNKNOWN;
    }
}
