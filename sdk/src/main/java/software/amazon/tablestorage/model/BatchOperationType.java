// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.model;

/** Kind of write applied to one entity of a {@link TableBatch}. */
public enum BatchOperationType {
    INSERT,
    INSERT_OR_REPLACE,
    INSERT_OR_MERGE,
    REPLACE,
    MERGE,
    DELETE
}
