// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.exception;

/**
 * A write was rejected because the stored entity changed since the writer read it (ETag mismatch).
 *
 * <p>Retrying such a write either repeats the same conflict or overwrites a concurrent change, so it is never retried
 * by the default classifier.
 */
public class OptimisticConcurrencyException extends TableStorageException {
    private final String partitionKey;
    private final String rowKey;

    public OptimisticConcurrencyException(String partitionKey, String rowKey, String message) {
        super(message, StatusCodes.PRECONDITION_FAILED);
        this.partitionKey = partitionKey;
        this.rowKey = rowKey;
    }

    public String getPartitionKey() {
        return partitionKey;
    }

    public String getRowKey() {
        return rowKey;
    }
}
