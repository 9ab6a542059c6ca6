// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.exception;

/**
 * Failure reported by a {@link software.amazon.tablestorage.TableStorage} implementation.
 *
 * <p>Carries the transport-level status code of the failed request, or {@link StatusCodes#UNKNOWN} when the failure
 * did not come with one (for example a client-side timeout).
 */
public class TableStorageException extends RuntimeException {
    private final int statusCode;

    public TableStorageException(String message) {
        this(message, StatusCodes.UNKNOWN, null);
    }

    public TableStorageException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public TableStorageException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
