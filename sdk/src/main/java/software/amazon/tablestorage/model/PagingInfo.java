// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.model;

/**
 * Position of a page within a paginated query.
 *
 * @param continuationToken token of the page to fetch, or null for the first page
 * @param elementCount maximum number of entities per page
 * @param currentPage zero-based index of the page
 */
public record PagingInfo(String continuationToken, int elementCount, int currentPage) {

    /** Default page size used by {@link #firstPage()}. */
    public static final int DEFAULT_ELEMENT_COUNT = 1000;

    public PagingInfo {
        if (elementCount <= 0) {
            throw new IllegalArgumentException("elementCount must be positive, got: " + elementCount);
        }
    }

    public static PagingInfo firstPage() {
        return new PagingInfo(null, DEFAULT_ELEMENT_COUNT, 0);
    }

    public static PagingInfo firstPage(int elementCount) {
        return new PagingInfo(null, elementCount, 0);
    }

    /** @return paging info for the page following this one, located by the given token */
    public PagingInfo next(String nextToken) {
        return new PagingInfo(nextToken, elementCount, currentPage + 1);
    }
}
