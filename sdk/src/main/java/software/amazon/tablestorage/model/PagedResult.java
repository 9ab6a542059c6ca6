// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.model;

import java.util.List;

/**
 * One page of a paginated query.
 *
 * @param entities the entities of this page
 * @param pagingInfo paging info for the next page; its continuation token is null when this page is the last one
 */
public record PagedResult<T>(List<T> entities, PagingInfo pagingInfo) {

    public PagedResult {
        entities = List.copyOf(entities);
    }

    public boolean hasMore() {
        return pagingInfo.continuationToken() != null;
    }
}
