// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.model;

import java.util.Objects;

/** Partition key and row key pair identifying a single entity. */
public record EntityKey(String partitionKey, String rowKey) {

    public EntityKey {
        Objects.requireNonNull(partitionKey, "partitionKey cannot be null");
        Objects.requireNonNull(rowKey, "rowKey cannot be null");
    }

    public static EntityKey of(String partitionKey, String rowKey) {
        return new EntityKey(partitionKey, rowKey);
    }
}
