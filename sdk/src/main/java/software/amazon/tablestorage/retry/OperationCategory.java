// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.retry;

/** Category of a storage operation, deciding which retry budget applies to it. */
public enum OperationCategory {
    /** Operation that only reads remote state. */
    READ,
    /** Operation that mutates remote state. */
    WRITE
}
