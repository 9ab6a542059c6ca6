// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage;

import java.time.Duration;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
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
import software.amazon.tablestorage.retry.DelayScheduler;
import software.amazon.tablestorage.retry.OperationCategory;
import software.amazon.tablestorage.retry.RetryExecutor;
import software.amazon.tablestorage.retry.RetryPolicy;

/**
 * {@link TableStorage} decorator that retries the point operations of the wrapped storage.
 *
 * <p>Operations that mutate the table use the write budget, operations that only read it use the read budget. Which
 * failures are retried is decided by the configured {@link software.amazon.tablestorage.retry.ErrorClassifier}; the
 * failure surfaced once the budget is exhausted is the one raised by the wrapped storage, unchanged.
 *
 * <p>Methods without retries, forwarded as they are:
 *
 * <ul>
 *   <li>{@code getDataByChunksAsync} and {@code forEachChunkAsync}
 *   <li>{@code scanDataAsync}
 *   <li>{@code firstOrNullViaScanAsync}
 *   <li>{@code getDataRowKeysOnlyAsync}
 *   <li>{@code executeAsync}
 *   <li>{@code executeQueryWithPaginationAsync}
 *   <li>{@code createTableIfNotExistsAsync}
 * </ul>
 *
 * <p>The chunked and callback-driven methods hand partial results to caller code while they run; replaying them could
 * deliver chunks the caller has already consumed.
 *
 * @param <T> entity type
 */
public class RetryingTableStorage<T extends TableEntity> implements TableStorage<T> {

    private final TableStorage<T> impl;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy writePolicy;
    private final RetryPolicy readPolicy;

    /**
     * Creates decorator with budgets, delay and classifier taken from {@code config}.
     *
     * @param impl storage to which actual work will be delegated
     * @param config retry configuration
     */
    public RetryingTableStorage(TableStorage<T> impl, RetryConfig config) {
        this(
                impl,
                new RetryExecutor(
                        Objects.requireNonNull(config, "RetryConfig cannot be null").getErrorClassifier(),
                        DelayScheduler.blocking(),
                        DelayScheduler.nonBlocking(config.getDelayExecutor())),
                config.writePolicy(),
                config.readPolicy());
    }

    /**
     * Creates decorator with the default error classifier.
     *
     * @param impl storage to which actual work will be delegated
     * @param writeAttempts attempts for write operations, at least 1
     * @param readAttempts attempts for read operations, at least 1
     * @param retryDelay delay between attempts
     */
    public RetryingTableStorage(TableStorage<T> impl, int writeAttempts, int readAttempts, Duration retryDelay) {
        this(
                impl,
                RetryConfig.builder()
                        .withWriteAttempts(writeAttempts)
                        .withReadAttempts(readAttempts)
                        .withRetryDelay(retryDelay)
                        .build());
    }

    /**
     * @param impl storage to which actual work will be delegated
     * @param retryExecutor engine running the retry loop
     * @param writePolicy policy for write operations
     * @param readPolicy policy for read operations
     */
    public RetryingTableStorage(
            TableStorage<T> impl, RetryExecutor retryExecutor, RetryPolicy writePolicy, RetryPolicy readPolicy) {
        this.impl = Objects.requireNonNull(impl, "TableStorage cannot be null");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "RetryExecutor cannot be null");
        this.writePolicy = Objects.requireNonNull(writePolicy, "write RetryPolicy cannot be null");
        this.readPolicy = Objects.requireNonNull(readPolicy, "read RetryPolicy cannot be null");
    }

    /** Wraps {@code impl} with {@link RetryConfig#defaultConfig()}. */
    public static <T extends TableEntity> TableStorage<T> wrap(TableStorage<T> impl) {
        return new RetryingTableStorage<>(impl, RetryConfig.defaultConfig());
    }

    public static <T extends TableEntity> TableStorage<T> wrap(TableStorage<T> impl, RetryConfig config) {
        return new RetryingTableStorage<>(impl, config);
    }

    @Override
    public String getName() {
        return impl.getName();
    }

    @Override
    public Iterator<T> iterator() {
        return retry("iterator", impl::iterator);
    }

    @Override
    public CompletableFuture<Void> insertAsync(T item, int... notLogCodes) {
        return retryAsync(OperationCategory.WRITE, "insertAsync", () -> impl.insertAsync(item, notLogCodes));
    }

    @Override
    public CompletableFuture<Void> insertAsync(Collection<T> items) {
        return retryAsync(OperationCategory.WRITE, "insertAsync", () -> impl.insertAsync(items));
    }

    @Override
    public CompletableFuture<Void> insertOrMergeAsync(T item) {
        return retryAsync(OperationCategory.WRITE, "insertOrMergeAsync", () -> impl.insertOrMergeAsync(item));
    }

    @Override
    public CompletableFuture<Void> insertOrMergeBatchAsync(Collection<T> items) {
        return retryAsync(
                OperationCategory.WRITE, "insertOrMergeBatchAsync", () -> impl.insertOrMergeBatchAsync(items));
    }

    @Override
    public CompletableFuture<T> replaceAsync(String partitionKey, String rowKey, UnaryOperator<T> replaceAction) {
        return retryAsync(
                OperationCategory.WRITE,
                "replaceAsync",
                () -> impl.replaceAsync(partitionKey, rowKey, replaceAction));
    }

    @Override
    public CompletableFuture<Void> replaceAsync(T entity) {
        return retryAsync(OperationCategory.WRITE, "replaceAsync", () -> impl.replaceAsync(entity));
    }

    @Override
    public CompletableFuture<T> mergeAsync(String partitionKey, String rowKey, UnaryOperator<T> mergeAction) {
        return retryAsync(
                OperationCategory.WRITE, "mergeAsync", () -> impl.mergeAsync(partitionKey, rowKey, mergeAction));
    }

    @Override
    public CompletableFuture<Void> insertOrReplaceBatchAsync(Collection<T> entities) {
        return retryAsync(
                OperationCategory.WRITE,
                "insertOrReplaceBatchAsync",
                () -> impl.insertOrReplaceBatchAsync(entities));
    }

    @Override
    public CompletableFuture<Void> insertOrReplaceAsync(T item) {
        return retryAsync(OperationCategory.WRITE, "insertOrReplaceAsync", () -> impl.insertOrReplaceAsync(item));
    }

    @Override
    public CompletableFuture<Void> insertOrReplaceAsync(Collection<T> items) {
        return retryAsync(OperationCategory.WRITE, "insertOrReplaceAsync", () -> impl.insertOrReplaceAsync(items));
    }

    @Override
    public CompletableFuture<Boolean> insertOrReplaceAsync(T entity, Predicate<T> replaceCondition) {
        return retryAsync(
                OperationCategory.WRITE,
                "insertOrReplaceAsync",
                () -> impl.insertOrReplaceAsync(entity, replaceCondition));
    }

    @Override
    public CompletableFuture<Boolean> insertOrModifyAsync(
            String partitionKey, String rowKey, Supplier<T> create, Predicate<T> modify) {
        return retryAsync(
                OperationCategory.WRITE,
                "insertOrModifyAsync",
                () -> impl.insertOrModifyAsync(partitionKey, rowKey, create, modify));
    }

    @Override
    public CompletableFuture<Void> deleteAsync(T item) {
        return retryAsync(OperationCategory.WRITE, "deleteAsync", () -> impl.deleteAsync(item));
    }

    @Override
    public CompletableFuture<T> deleteAsync(String partitionKey, String rowKey) {
        return retryAsync(OperationCategory.WRITE, "deleteAsync", () -> impl.deleteAsync(partitionKey, rowKey));
    }

    @Override
    public CompletableFuture<Boolean> deleteIfExistAsync(String partitionKey, String rowKey) {
        return retryAsync(
                OperationCategory.WRITE, "deleteIfExistAsync", () -> impl.deleteIfExistAsync(partitionKey, rowKey));
    }

    @Override
    public CompletableFuture<Boolean> deleteIfExistAsync(
            String partitionKey, String rowKey, Predicate<T> deleteCondition) {
        return retryAsync(
                OperationCategory.WRITE,
                "deleteIfExistAsync",
                () -> impl.deleteIfExistAsync(partitionKey, rowKey, deleteCondition));
    }

    @Override
    public CompletableFuture<Boolean> deleteAsync() {
        return retryAsync(OperationCategory.WRITE, "deleteAsync", () -> impl.deleteAsync());
    }

    @Override
    public CompletableFuture<Void> deleteAsync(Collection<T> items) {
        return retryAsync(OperationCategory.WRITE, "deleteAsync", () -> impl.deleteAsync(items));
    }

    @Override
    public CompletableFuture<Boolean> createIfNotExistsAsync(T item) {
        return retryAsync(OperationCategory.WRITE, "createIfNotExistsAsync", () -> impl.createIfNotExistsAsync(item));
    }

    @Override
    public CompletableFuture<Void> doBatchAsync(TableBatch<T> batch) {
        return retryAsync(OperationCategory.WRITE, "doBatchAsync", () -> impl.doBatchAsync(batch));
    }

    @Override
    public T get(String partitionKey, String rowKey) {
        return retry("get", () -> impl.get(partitionKey, rowKey));
    }

    @Override
    public List<T> get(String partitionKey) {
        return retry("get", () -> impl.get(partitionKey));
    }

    @Override
    public boolean recordExists(T item) {
        return retry("recordExists", () -> impl.recordExists(item));
    }

    @Override
    public CompletableFuture<Boolean> recordExistsAsync(T item) {
        return retryAsync(OperationCategory.READ, "recordExistsAsync", () -> impl.recordExistsAsync(item));
    }

    @Override
    public CompletableFuture<T> getDataAsync(String partitionKey, String rowKey) {
        return retryAsync(OperationCategory.READ, "getDataAsync", () -> impl.getDataAsync(partitionKey, rowKey));
    }

    @Override
    public CompletableFuture<List<T>> getDataAsync(Predicate<T> filter) {
        return retryAsync(OperationCategory.READ, "getDataAsync", () -> impl.getDataAsync(filter));
    }

    @Override
    public CompletableFuture<List<T>> getDataAsync(
            String partitionKey, Collection<String> rowKeys, int pieceSize, Predicate<T> filter) {
        return retryAsync(
                OperationCategory.READ,
                "getDataAsync",
                () -> impl.getDataAsync(partitionKey, rowKeys, pieceSize, filter));
    }

    @Override
    public CompletableFuture<List<T>> getDataByPartitionsAsync(
            Collection<String> partitionKeys, int pieceSize, Predicate<T> filter) {
        return retryAsync(
                OperationCategory.READ,
                "getDataByPartitionsAsync",
                () -> impl.getDataByPartitionsAsync(partitionKeys, pieceSize, filter));
    }

    @Override
    public CompletableFuture<List<T>> getDataByKeysAsync(
            Collection<EntityKey> keys, int pieceSize, Predicate<T> filter) {
        return retryAsync(
                OperationCategory.READ, "getDataByKeysAsync", () -> impl.getDataByKeysAsync(keys, pieceSize, filter));
    }

    @Override
    public CompletableFuture<List<T>> getDataAsync(String partitionKey, Predicate<T> filter) {
        return retryAsync(OperationCategory.READ, "getDataAsync", () -> impl.getDataAsync(partitionKey, filter));
    }

    @Override
    public CompletableFuture<T> getTopRecordAsync(String partitionKey) {
        return retryAsync(OperationCategory.READ, "getTopRecordAsync", () -> impl.getTopRecordAsync(partitionKey));
    }

    @Override
    public CompletableFuture<List<T>> getTopRecordsAsync(String partitionKey, int n) {
        return retryAsync(
                OperationCategory.READ, "getTopRecordsAsync", () -> impl.getTopRecordsAsync(partitionKey, n));
    }

    @Override
    public CompletableFuture<T> getTopRecordAsync(TableQuery<T> query) {
        return retryAsync(OperationCategory.READ, "getTopRecordAsync", () -> impl.getTopRecordAsync(query));
    }

    @Override
    public CompletableFuture<List<T>> getTopRecordsAsync(TableQuery<T> query, int n) {
        return retryAsync(OperationCategory.READ, "getTopRecordsAsync", () -> impl.getTopRecordsAsync(query, n));
    }

    @Override
    public CompletableFuture<List<T>> whereAsync(TableQuery<T> query, Predicate<T> filter) {
        return retryAsync(OperationCategory.READ, "whereAsync", () -> impl.whereAsync(query, filter));
    }

    @Override
    public CompletableFuture<List<T>> filterAsync(
            TableQuery<T> query, Function<T, CompletableFuture<Boolean>> filter) {
        return retryAsync(OperationCategory.READ, "filterAsync", () -> impl.filterAsync(query, filter));
    }

    @Override
    public CompletableFuture<ContinuationResult<T>> getDataWithContinuationTokenAsync(
            TableQuery<T> query, String continuationToken) {
        return retryAsync(
                OperationCategory.READ,
                "getDataWithContinuationTokenAsync",
                () -> impl.getDataWithContinuationTokenAsync(query, continuationToken));
    }

    @Override
    public CompletableFuture<Void> getDataByChunksAsync(Function<List<T>, CompletableFuture<Void>> chunkHandler) {
        return impl.getDataByChunksAsync(chunkHandler);
    }

    @Override
    public CompletableFuture<Void> getDataByChunksAsync(
            TableQuery<T> query, Function<List<T>, CompletableFuture<Void>> chunkHandler) {
        return impl.getDataByChunksAsync(query, chunkHandler);
    }

    @Override
    public CompletableFuture<Void> getDataByChunksAsync(String partitionKey, Predicate<List<T>> chunkHandler) {
        return impl.getDataByChunksAsync(partitionKey, chunkHandler);
    }

    @Override
    public CompletableFuture<Void> forEachChunkAsync(Consumer<List<T>> chunkConsumer) {
        return impl.forEachChunkAsync(chunkConsumer);
    }

    @Override
    public CompletableFuture<Void> forEachChunkAsync(TableQuery<T> query, Consumer<List<T>> chunkConsumer) {
        return impl.forEachChunkAsync(query, chunkConsumer);
    }

    @Override
    public CompletableFuture<Void> forEachChunkAsync(String partitionKey, Consumer<List<T>> chunkConsumer) {
        return impl.forEachChunkAsync(partitionKey, chunkConsumer);
    }

    @Override
    public CompletableFuture<Void> scanDataAsync(
            String partitionKey, Function<List<T>, CompletableFuture<Void>> chunk) {
        return impl.scanDataAsync(partitionKey, chunk);
    }

    @Override
    public CompletableFuture<Void> scanDataAsync(
            TableQuery<T> query, Function<List<T>, CompletableFuture<Void>> chunk) {
        return impl.scanDataAsync(query, chunk);
    }

    @Override
    public CompletableFuture<T> firstOrNullViaScanAsync(String partitionKey, Function<List<T>, T> dataToSearch) {
        return impl.firstOrNullViaScanAsync(partitionKey, dataToSearch);
    }

    @Override
    public CompletableFuture<List<T>> getDataRowKeysOnlyAsync(Collection<String> rowKeys) {
        return impl.getDataRowKeysOnlyAsync(rowKeys);
    }

    @Override
    public CompletableFuture<Void> executeAsync(
            TableQuery<T> query, Consumer<List<T>> yieldResult, BooleanSupplier stopCondition) {
        return impl.executeAsync(query, yieldResult, stopCondition);
    }

    @Override
    public CompletableFuture<PagedResult<T>> executeQueryWithPaginationAsync(
            TableQuery<T> query, PagingInfo pagingInfo) {
        return impl.executeQueryWithPaginationAsync(query, pagingInfo);
    }

    @Override
    public CompletableFuture<Void> createTableIfNotExistsAsync() {
        return impl.createTableIfNotExistsAsync();
    }

    private RetryPolicy policyFor(OperationCategory category) {
        return category == OperationCategory.WRITE ? writePolicy : readPolicy;
    }

    // all blocking operations of the interface are reads
    private <R> R retry(String operationName, Callable<R> operation) {
        return retryExecutor.execute(operationName, operation, policyFor(OperationCategory.READ));
    }

    private <R> CompletableFuture<R> retryAsync(
            OperationCategory category, String operationName, Supplier<CompletableFuture<R>> operation) {
        return retryExecutor.executeAsync(operationName, operation, policyFor(category));
    }
}
