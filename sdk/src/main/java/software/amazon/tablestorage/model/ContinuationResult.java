// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.model;

import java.util.List;

/**
 * Single segment of a query together with the token that resumes it.
 *
 * @param entities entities of the segment
 * @param continuationToken token for the next segment, or null when the query is exhausted
 */
public record ContinuationResult<T>(List<T> entities, String continuationToken) {

    public ContinuationResult {
        entities = List.copyOf(entities);
    }
}
