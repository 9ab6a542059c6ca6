// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import software.amazon.tablestorage.TableEntity;

/**
 * Store-side query: an optional partition restriction, an entity filter and an optional result limit.
 *
 * <p>How a query is evaluated is up to the {@link software.amazon.tablestorage.TableStorage} implementation; this type
 * only carries the request.
 *
 * @param <T> entity type
 */
public final class TableQuery<T extends TableEntity> {
    private final String partitionKey;
    private final Predicate<T> filter;
    private final Integer takeCount;

    private TableQuery(String partitionKey, Predicate<T> filter, Integer takeCount) {
        this.partitionKey = partitionKey;
        this.filter = filter;
        this.takeCount = takeCount;
    }

    /** @return a query matching every entity of the table */
    public static <T extends TableEntity> TableQuery<T> all() {
        return new TableQuery<>(null, entity -> true, null);
    }

    /** @return a query matching every entity of one partition */
    public static <T extends TableEntity> TableQuery<T> partition(String partitionKey) {
        Objects.requireNonNull(partitionKey, "partitionKey cannot be null");
        return new TableQuery<>(partitionKey, entity -> true, null);
    }

    /** @return a copy of this query that additionally requires {@code predicate} */
    public TableQuery<T> where(Predicate<T> predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        return new TableQuery<>(partitionKey, filter.and(predicate), takeCount);
    }

    /** @return a copy of this query limited to the first {@code count} matches */
    public TableQuery<T> take(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("take count must be positive, got: " + count);
        }
        return new TableQuery<>(partitionKey, filter, count);
    }

    public Optional<String> partitionKey() {
        return Optional.ofNullable(partitionKey);
    }

    public Optional<Integer> takeCount() {
        return Optional.ofNullable(takeCount);
    }

    /** @return true if the entity satisfies the partition restriction and the filter */
    public boolean matches(T entity) {
        if (partitionKey != null && !partitionKey.equals(entity.getPartitionKey())) {
            return false;
        }
        return filter.test(entity);
    }

    @Override
    public String toString() {
        return "TableQuery{partitionKey=" + partitionKey + ", takeCount=" + takeCount + "}";
    }
}
