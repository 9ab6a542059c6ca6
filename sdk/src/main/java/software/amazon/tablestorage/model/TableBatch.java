// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import software.amazon.tablestorage.TableEntity;

/**
 * Ordered group of writes submitted to the store as one unit.
 *
 * <p>Example:
 *
 * <pre>{@code
 * var batch = TableBatch.<Order>builder()
 *         .insert(newOrder)
 *         .merge(updatedOrder)
 *         .delete(cancelledOrder)
 *         .build();
 * storage.doBatchAsync(batch).join();
 * }</pre>
 *
 * @param <T> entity type
 */
public final class TableBatch<T extends TableEntity> {

    /** One entry of the batch. */
    public record Operation<T extends TableEntity>(BatchOperationType type, T entity) {
        public Operation {
            Objects.requireNonNull(type, "type cannot be null");
            Objects.requireNonNull(entity, "entity cannot be null");
        }
    }

    private final List<Operation<T>> operations;

    private TableBatch(List<Operation<T>> operations) {
        this.operations = List.copyOf(operations);
    }

    public static <T extends TableEntity> Builder<T> builder() {
        return new Builder<>();
    }

    /** @return the operations in submission order */
    public List<Operation<T>> operations() {
        return operations;
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /** Builder for TableBatch. */
    public static final class Builder<T extends TableEntity> {
        private final List<Operation<T>> operations = new ArrayList<>();

        private Builder() {}

        public Builder<T> add(BatchOperationType type, T entity) {
            operations.add(new Operation<>(type, entity));
            return this;
        }

        public Builder<T> insert(T entity) {
            return add(BatchOperationType.INSERT, entity);
        }

        public Builder<T> insertOrReplace(T entity) {
            return add(BatchOperationType.INSERT_OR_REPLACE, entity);
        }

        public Builder<T> insertOrMerge(T entity) {
            return add(BatchOperationType.INSERT_OR_MERGE, entity);
        }

        public Builder<T> replace(T entity) {
            return add(BatchOperationType.REPLACE, entity);
        }

        public Builder<T> merge(T entity) {
            return add(BatchOperationType.MERGE, entity);
        }

        public Builder<T> delete(T entity) {
            return add(BatchOperationType.DELETE, entity);
        }

        public TableBatch<T> build() {
            return new TableBatch<>(operations);
        }
    }
}
