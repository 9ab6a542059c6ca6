// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import software.amazon.tablestorage.model.ContinuationResult;
import software.amazon.tablestorage.model.EntityKey;
import software.amazon.tablestorage.model.PagedResult;
import software.amazon.tablestorage.model.PagingInfo;
import software.amazon.tablestorage.model.TableBatch;
import software.amazon.tablestorage.model.TableQuery;

/**
 * Data access to one table of a key-partitioned store.
 *
 * <p>Entities are addressed by partition key and row key. Failures are reported as
 * {@link software.amazon.tablestorage.exception.TableStorageException} (thrown, or carried by the returned future);
 * a write that loses an ETag race fails with
 * {@link software.amazon.tablestorage.exception.OptimisticConcurrencyException}.
 *
 * <p>Methods taking a chunk consumer, a yield callback or paging state deliver results incrementally. Everything else
 * is a point operation that completes with its whole result.
 *
 * @param <T> entity type
 */
public interface TableStorage<T extends TableEntity> extends Iterable<T> {

    /** @return the table name */
    String getName();

    // ---------------------------------------------------------------- writes

    /**
     * Inserts a new entity. Fails with status 409 if an entity with the same keys exists.
     *
     * @param item entity to insert
     * @param notLogCodes status codes the implementation should not log as failures
     */
    CompletableFuture<Void> insertAsync(T item, int... notLogCodes);

    /** Inserts all entities; fails with status 409 if any key already exists. */
    CompletableFuture<Void> insertAsync(Collection<T> items);

    CompletableFuture<Void> insertOrMergeAsync(T item);

    CompletableFuture<Void> insertOrMergeBatchAsync(Collection<T> items);

    /**
     * Reads the entity, applies {@code replaceAction} and replaces it conditionally on the ETag that was read.
     *
     * @return the replaced entity, or null if no entity exists or the action returned null
     */
    CompletableFuture<T> replaceAsync(String partitionKey, String rowKey, UnaryOperator<T> replaceAction);

    /** Replaces an existing entity, conditional on its ETag unless the ETag is {@code "*"} or null. */
    CompletableFuture<Void> replaceAsync(T entity);

    /**
     * Reads the entity, applies {@code mergeAction} and merges the result conditionally on the ETag that was read.
     *
     * @return the merged entity, or null if no entity exists or the action returned null
     */
    CompletableFuture<T> mergeAsync(String partitionKey, String rowKey, UnaryOperator<T> mergeAction);

    CompletableFuture<Void> insertOrReplaceBatchAsync(Collection<T> entities);

    CompletableFuture<Void> insertOrReplaceAsync(T item);

    CompletableFuture<Void> insertOrReplaceAsync(Collection<T> items);

    /**
     * Inserts the entity, or replaces the stored one if {@code replaceCondition} accepts it.
     *
     * @return true if the entity was written
     */
    CompletableFuture<Boolean> insertOrReplaceAsync(T entity, Predicate<T> replaceCondition);

    /**
     * Inserts the entity built by {@code create} if none exists, otherwise applies {@code modify} to the stored entity
     * and replaces it when {@code modify} returns true.
     *
     * @return true if anything was written
     */
    CompletableFuture<Boolean> insertOrModifyAsync(
            String partitionKey, String rowKey, Supplier<T> create, Predicate<T> modify);

    CompletableFuture<Void> deleteAsync(T item);

    /** @return the deleted entity, or null if there was none */
    CompletableFuture<T> deleteAsync(String partitionKey, String rowKey);

    /** @return true if an entity was deleted */
    CompletableFuture<Boolean> deleteIfExistAsync(String partitionKey, String rowKey);

    /** @return true if an entity existed, satisfied {@code deleteCondition} and was deleted */
    CompletableFuture<Boolean> deleteIfExistAsync(String partitionKey, String rowKey, Predicate<T> deleteCondition);

    /**
     * Deletes the table itself.
     *
     * @return true if the table existed
     */
    CompletableFuture<Boolean> deleteAsync();

    CompletableFuture<Void> deleteAsync(Collection<T> items);

    /** @return true if the entity was created, false if an entity with the same keys already existed */
    CompletableFuture<Boolean> createIfNotExistsAsync(T item);

    CompletableFuture<Void> doBatchAsync(TableBatch<T> batch);

    // ----------------------------------------------------------------- reads

    /** @return the entity, or null if none exists */
    T get(String partitionKey, String rowKey);

    /** @return all entities of the partition ordered by row key */
    List<T> get(String partitionKey);

    boolean recordExists(T item);

    CompletableFuture<Boolean> recordExistsAsync(T item);

    /** @return the entity, or null if none exists */
    CompletableFuture<T> getDataAsync(String partitionKey, String rowKey);

    /** @return all entities accepted by {@code filter}; a null filter accepts everything */
    CompletableFuture<List<T>> getDataAsync(Predicate<T> filter);

    /**
     * @param pieceSize maximum number of row keys requested from the store at once
     * @return the entities of the partition whose row keys are listed and which {@code filter} accepts
     */
    CompletableFuture<List<T>> getDataAsync(
            String partitionKey, Collection<String> rowKeys, int pieceSize, Predicate<T> filter);

    /** @param pieceSize maximum number of partition keys requested from the store at once */
    CompletableFuture<List<T>> getDataByPartitionsAsync(
            Collection<String> partitionKeys, int pieceSize, Predicate<T> filter);

    /** @param pieceSize maximum number of keys requested from the store at once */
    CompletableFuture<List<T>> getDataByKeysAsync(Collection<EntityKey> keys, int pieceSize, Predicate<T> filter);

    CompletableFuture<List<T>> getDataAsync(String partitionKey, Predicate<T> filter);

    /** @return the entity with the lowest row key of the partition, or null if the partition is empty */
    CompletableFuture<T> getTopRecordAsync(String partitionKey);

    CompletableFuture<List<T>> getTopRecordsAsync(String partitionKey, int n);

    CompletableFuture<T> getTopRecordAsync(TableQuery<T> query);

    CompletableFuture<List<T>> getTopRecordsAsync(TableQuery<T> query, int n);

    CompletableFuture<List<T>> whereAsync(TableQuery<T> query, Predicate<T> filter);

    /** Like {@link #whereAsync(TableQuery, Predicate)} with a filter that completes asynchronously. */
    CompletableFuture<List<T>> filterAsync(TableQuery<T> query, Function<T, CompletableFuture<Boolean>> filter);

    /**
     * Fetches one segment of the query.
     *
     * @param continuationToken token returned by the previous segment, or null to start
     */
    CompletableFuture<ContinuationResult<T>> getDataWithContinuationTokenAsync(
            TableQuery<T> query, String continuationToken);

    // ------------------------------------------------ incremental / bulk reads

    /** Feeds the whole table to {@code chunkHandler} chunk by chunk, waiting for each returned future. */
    CompletableFuture<Void> getDataByChunksAsync(Function<List<T>, CompletableFuture<Void>> chunkHandler);

    CompletableFuture<Void> getDataByChunksAsync(
            TableQuery<T> query, Function<List<T>, CompletableFuture<Void>> chunkHandler);

    /** Reads a partition chunk by chunk until {@code chunkHandler} returns false. */
    CompletableFuture<Void> getDataByChunksAsync(String partitionKey, Predicate<List<T>> chunkHandler);

    CompletableFuture<Void> forEachChunkAsync(Consumer<List<T>> chunkConsumer);

    CompletableFuture<Void> forEachChunkAsync(TableQuery<T> query, Consumer<List<T>> chunkConsumer);

    CompletableFuture<Void> forEachChunkAsync(String partitionKey, Consumer<List<T>> chunkConsumer);

    CompletableFuture<Void> scanDataAsync(String partitionKey, Function<List<T>, CompletableFuture<Void>> chunk);

    CompletableFuture<Void> scanDataAsync(TableQuery<T> query, Function<List<T>, CompletableFuture<Void>> chunk);

    /**
     * Scans the partition chunk by chunk, passing each chunk to {@code dataToSearch} until it returns a non-null entity.
     *
     * @return the first entity found, or null
     */
    CompletableFuture<T> firstOrNullViaScanAsync(String partitionKey, Function<List<T>, T> dataToSearch);

    CompletableFuture<List<T>> getDataRowKeysOnlyAsync(Collection<String> rowKeys);

    /**
     * Runs the query, yielding each segment to {@code yieldResult} until the query is exhausted or
     * {@code stopCondition} returns true.
     *
     * @param stopCondition checked after every segment; may be null
     */
    CompletableFuture<Void> executeAsync(
            TableQuery<T> query, Consumer<List<T>> yieldResult, BooleanSupplier stopCondition);

    CompletableFuture<PagedResult<T>> executeQueryWithPaginationAsync(TableQuery<T> query, PagingInfo pagingInfo);

    CompletableFuture<Void> createTableIfNotExistsAsync();
}
