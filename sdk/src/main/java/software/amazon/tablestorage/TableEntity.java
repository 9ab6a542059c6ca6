// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage;

/**
 * Capability required of every entity stored in a {@link TableStorage}.
 *
 * <p>An entity is located by its partition key and row key. The ETag is an opaque version tag assigned by the store on
 * every write; a value of {@code "*"} matches any version when used as a write precondition.
 */
public interface TableEntity {

    /** ETag value that matches any stored version. */
    String ANY_ETAG = "*";

    String getPartitionKey();

    String getRowKey();

    String getETag();

    void setETag(String eTag);
}
