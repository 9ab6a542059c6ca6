// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package software.amazon.tablestorage.testing;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.tablestorage.TableEntity;
import software.amazon.tablestorage.exception.OptimisticConcurrencyException;
import software.amazon.tablestorage.exception.StatusCodes;
import software.amazon.tablestorage.exception.TableStorageException;
import software.amazon.tablestorage.model.EntityKey;
import software.amazon.tablestorage.model.PagingInfo;
import software.amazon.tablestorage.model.TableBatch;
import software.amazon.tablestorage.model.TableQuery;

class InMemoryTableStorageTest {

    private InMemoryTableStorage<Order> storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryTableStorage<>("orders", Order.class, 2);
    }

    private static int statusOf(CompletableFuture<?> future) {
        var thrown = assertThrows(CompletionException.class, future::join);
        return assertInstanceOf(TableStorageException.class, thrown.getCause()).getStatusCode();
    }

    private void seed(String customerId, int count) {
        for (int i = 1; i <= count; i++) {
            storage.insertAsync(new Order(customerId, "order-" + i, "NEW", i * 10)).join();
        }
    }

    private static List<String> rowKeys(List<Order> orders) {
        return orders.stream().map(Order::getRowKey).collect(Collectors.toList());
    }

    @Test
    void insert_assignsETagAndStoresCopy() {
        var order = new Order("customer-1", "order-1", "NEW", 10);

        storage.insertAsync(order).join();
        order.setStatus("CHANGED_AFTER_INSERT");

        var stored = storage.get("customer-1", "order-1");
        assertNotNull(order.getETag());
        assertEquals(order.getETag(), stored.getETag());
        assertEquals("NEW", stored.getStatus());

        stored.setStatus("CHANGED_AFTER_READ");
        assertEquals("NEW", storage.get("customer-1", "order-1").getStatus());
    }

    @Test
    void insert_whenEntityExists_failsWithConflict() {
        seed("customer-1", 1);

        var status = statusOf(storage.insertAsync(new Order("customer-1", "order-1", "DUP", 0), 409));

        assertEquals(StatusCodes.CONFLICT, status);
        assertEquals("NEW", storage.get("customer-1", "order-1").getStatus());
    }

    @Test
    void insertCollection_withDuplicateKeys_storesNothing() {
        var status = statusOf(storage.insertAsync(List.of(
                new Order("customer-1", "order-1", "A", 1), new Order("customer-1", "order-1", "B", 2))));

        assertEquals(StatusCodes.BAD_REQUEST, status);
        assertEquals(0, storage.size());
    }

    @Test
    void insert_withoutKeys_failsWithBadRequest() {
        assertEquals(StatusCodes.BAD_REQUEST, statusOf(storage.insertAsync(new Order(null, "order-1", "NEW", 1))));
    }

    @Test
    void replace_withStaleETag_failsWithOptimisticConcurrencyViolation() {
        seed("customer-1", 1);
        var first = storage.get("customer-1", "order-1");
        var second = storage.get("customer-1", "order-1");
        first.setStatus("PAID");
        storage.replaceAsync(first).join();

        second.setStatus("CANCELLED");
        var thrown = assertThrows(CompletionException.class, () -> storage.replaceAsync(second).join());

        var violation = assertInstanceOf(OptimisticConcurrencyException.class, thrown.getCause());
        assertEquals(StatusCodes.PRECONDITION_FAILED, violation.getStatusCode());
        assertEquals("customer-1", violation.getPartitionKey());
        assertEquals("PAID", storage.get("customer-1", "order-1").getStatus());
    }

    @Test
    void replace_withWildcardETag_isUnconditional() {
        seed("customer-1", 1);
        var replacement = new Order("customer-1", "order-1", "SHIPPED", 99);
        replacement.setETag(TableEntity.ANY_ETAG);

        storage.replaceAsync(replacement).join();

        assertEquals("SHIPPED", storage.get("customer-1", "order-1").getStatus());
    }

    @Test
    void replace_whenMissing_failsWithNotFound() {
        assertEquals(
                StatusCodes.NOT_FOUND, statusOf(storage.replaceAsync(new Order("customer-1", "order-9", "X", 1))));
    }

    @Test
    void replaceWithAction_returnsUpdatedEntityWithNewETag() {
        seed("customer-1", 1);
        var before = storage.get("customer-1", "order-1").getETag();

        var updated = storage.replaceAsync("customer-1", "order-1", order -> {
                    order.setStatus("PAID");
                    return order;
                })
                .join();

        assertEquals("PAID", updated.getStatus());
        assertNotEquals(before, updated.getETag());
        assertNull(storage.replaceAsync("customer-1", "missing", order -> order).join());
    }

    @Test
    void replaceWithAction_rejectsKeyChange() {
        seed("customer-1", 1);

        var status = statusOf(storage.replaceAsync("customer-1", "order-1", order -> {
            order.setRowKey("order-2");
            return order;
        }));

        assertEquals(StatusCodes.BAD_REQUEST, status);
    }

    @Test
    void mergeWithAction_keepsPropertiesTheActionLeavesUntouched() {
        seed("customer-1", 1);

        var merged = storage.mergeAsync("customer-1", "order-1", order -> {
                    order.setAmount(500);
                    return order;
                })
                .join();

        assertEquals(500, merged.getAmount());
        assertEquals("NEW", merged.getStatus());
    }

    @Test
    void insertOrMerge_overlaysNonNullProperties() {
        seed("customer-1", 1);
        var partial = new Order("customer-1", "order-1", null, 77);

        storage.insertOrMergeAsync(partial).join();

        var stored = storage.get("customer-1", "order-1");
        assertEquals("NEW", stored.getStatus());
        assertEquals(77, stored.getAmount());
        assertEquals(stored.getETag(), partial.getETag());
    }

    @Test
    void insertOrMerge_insertsWhenMissing() {
        storage.insertOrMergeBatchAsync(List.of(new Order("customer-1", "order-1", "NEW", 1))).join();

        assertTrue(storage.recordExists(new Order("customer-1", "order-1", null, null)));
    }

    @Test
    void insertOrReplace_withCondition_onlyReplacesWhenConditionHolds() {
        seed("customer-1", 1);

        var replaced = storage.insertOrReplaceAsync(
                        new Order("customer-1", "order-1", "PAID", 10),
                        current -> "CANCELLED".equals(current.getStatus()))
                .join();
        var inserted = storage.insertOrReplaceAsync(new Order("customer-1", "order-2", "NEW", 20), current -> false)
                .join();

        assertFalse(replaced);
        assertTrue(inserted);
        assertEquals("NEW", storage.get("customer-1", "order-1").getStatus());
    }

    @Test
    void insertOrModify_createsThenModifies() {
        var created = storage.insertOrModifyAsync(
                        "customer-1", "order-1", () -> new Order("customer-1", "order-1", "NEW", 1), order -> true)
                .join();
        var modified = storage.insertOrModifyAsync(
                        "customer-1",
                        "order-1",
                        () -> new Order("customer-1", "order-1", "NEW", 1),
                        order -> {
                            order.setAmount(order.getAmount() + 1);
                            return true;
                        })
                .join();
        var skipped = storage.insertOrModifyAsync("customer-1", "order-1", Order::new, order -> false)
                .join();

        assertTrue(created);
        assertTrue(modified);
        assertFalse(skipped);
        assertEquals(2, storage.get("customer-1", "order-1").getAmount());
    }

    @Test
    void createIfNotExists_reportsWhetherItCreated() {
        assertTrue(storage.createIfNotExistsAsync(new Order("customer-1", "order-1", "NEW", 1))
                .join());
        assertFalse(storage.createIfNotExistsAsync(new Order("customer-1", "order-1", "OTHER", 2))
                .join());
        assertEquals("NEW", storage.get("customer-1", "order-1").getStatus());
    }

    @Test
    void deleteByKey_returnsRemovedEntityOrNull() {
        seed("customer-1", 2);

        var removed = storage.deleteAsync("customer-1", "order-1").join();

        assertEquals("order-1", removed.getRowKey());
        assertNull(storage.deleteAsync("customer-1", "order-1").join());
        assertFalse(storage.deleteIfExistAsync("customer-1", "order-1").join());
        assertTrue(storage.deleteIfExistAsync("customer-1", "order-2").join());
        assertEquals(0, storage.size());
    }

    @Test
    void deleteIfExist_withCondition() {
        seed("customer-1", 1);

        assertFalse(storage.deleteIfExistAsync("customer-1", "order-1", order -> order.getAmount() > 100)
                .join());
        assertTrue(storage.deleteIfExistAsync("customer-1", "order-1", order -> order.getAmount() == 10)
                .join());
    }

    @Test
    void deleteEntity_whenMissing_failsWithNotFound() {
        assertEquals(
                StatusCodes.NOT_FOUND, statusOf(storage.deleteAsync(new Order("customer-1", "order-1", null, null))));
    }

    @Test
    void deleteCollection_removesAll() {
        seed("customer-1", 3);

        storage.deleteAsync(storage.get("customer-1")).join();

        assertEquals(0, storage.size());
    }

    @Test
    void batch_isAppliedAtomically() {
        seed("customer-1", 1);
        var batch = TableBatch.<Order>builder()
                .insert(new Order("customer-1", "order-2", "NEW", 20))
                .insert(new Order("customer-1", "order-1", "DUP", 0))
                .build();

        assertEquals(StatusCodes.CONFLICT, statusOf(storage.doBatchAsync(batch)));

        assertNull(storage.get("customer-1", "order-2"));
        assertEquals(1, storage.size());
    }

    @Test
    void batch_appliesMixedOperations() {
        seed("customer-1", 2);
        var toDelete = storage.get("customer-1", "order-2");
        var batch = TableBatch.<Order>builder()
                .insert(new Order("customer-1", "order-3", "NEW", 30))
                .merge(new Order("customer-1", "order-1", "PAID", null))
                .delete(toDelete)
                .build();

        storage.doBatchAsync(batch).join();

        assertEquals(List.of("order-1", "order-3"), rowKeys(storage.get("customer-1")));
        var merged = storage.get("customer-1", "order-1");
        assertEquals("PAID", merged.getStatus());
        assertEquals(10, merged.getAmount());
    }

    @Test
    void batch_rejectsInvalidShapes() {
        var empty = TableBatch.<Order>builder().build();
        var crossPartition = TableBatch.<Order>builder()
                .insert(new Order("customer-1", "order-1", "NEW", 1))
                .insert(new Order("customer-2", "order-1", "NEW", 1))
                .build();
        var oversized = TableBatch.<Order>builder();
        IntStream.rangeClosed(1, InMemoryTableStorage.MAX_BATCH_SIZE + 1)
                .forEach(i -> oversized.insert(new Order("customer-1", "order-" + i, "NEW", i)));

        assertEquals(StatusCodes.BAD_REQUEST, statusOf(storage.doBatchAsync(empty)));
        assertEquals(StatusCodes.BAD_REQUEST, statusOf(storage.doBatchAsync(crossPartition)));
        assertEquals(StatusCodes.BAD_REQUEST, statusOf(storage.doBatchAsync(oversized.build())));
        assertEquals(0, storage.size());
    }

    @Test
    void reads_returnEntitiesOrderedByKeys() {
        storage.insertAsync(new Order("customer-2", "b", "NEW", 1)).join();
        storage.insertAsync(new Order("customer-1", "b", "NEW", 2)).join();
        storage.insertAsync(new Order("customer-1", "a", "NEW", 3)).join();

        var all = new ArrayList<Order>();
        storage.forEach(all::add);

        assertEquals(
                List.of("customer-1", "customer-1", "customer-2"),
                all.stream().map(Order::getPartitionKey).collect(Collectors.toList()));
        assertEquals(List.of("a", "b"), rowKeys(storage.get("customer-1")));
        assertEquals("a", storage.getTopRecordAsync("customer-1").join().getRowKey());
        assertEquals(List.of("a"), rowKeys(storage.getTopRecordsAsync("customer-1", 1).join()));
    }

    @Test
    void getTopRecords_withNonPositiveCount_failsWithBadRequest() {
        assertEquals(StatusCodes.BAD_REQUEST, statusOf(storage.getTopRecordsAsync("customer-1", 0)));
    }

    @Test
    void filteredReads() {
        seed("customer-1", 3);
        seed("customer-2", 2);

        assertEquals(2, storage.getDataAsync(order -> order.getAmount() == 10).join().size());
        var partitionMatches = storage.getDataAsync("customer-1", order -> order.getAmount() > 10)
                .join();
        var queryMatches = storage.whereAsync(TableQuery.partition("customer-1"), order -> order.getAmount() == 30)
                .join();

        assertEquals(List.of("order-2", "order-3"), rowKeys(partitionMatches));
        assertEquals(List.of("order-3"), rowKeys(queryMatches));
        assertTrue(storage.recordExistsAsync(new Order("customer-2", "order-2", null, null)).join());
        assertNull(storage.getDataAsync("customer-2", "order-3").join());
    }

    @Test
    void pieceReads_fetchRequestedKeys() {
        seed("customer-1", 5);
        seed("customer-2", 1);

        var byRowKeys = storage.getDataAsync(
                        "customer-1", List.of("order-1", "order-4", "order-9"), 2, order -> true)
                .join();
        var byPartitions = storage.getDataByPartitionsAsync(List.of("customer-2", "customer-3"), 1, null)
                .join();
        var byKeys = storage.getDataByKeysAsync(
                        List.of(EntityKey.of("customer-1", "order-5"), EntityKey.of("customer-2", "order-1")),
                        10,
                        order -> order.getAmount() > 10)
                .join();

        assertEquals(List.of("order-1", "order-4"), rowKeys(byRowKeys));
        assertEquals(1, byPartitions.size());
        assertEquals(List.of("order-5"), rowKeys(byKeys));
    }

    @Test
    void pieceReads_withNonPositivePieceSize_failWithBadRequest() {
        assertEquals(
                StatusCodes.BAD_REQUEST,
                statusOf(storage.getDataAsync("customer-1", List.of("order-1"), 0, null)));
        assertEquals(StatusCodes.BAD_REQUEST, statusOf(storage.getDataByKeysAsync(List.of(), -1, null)));
    }

    @Test
    void filterAsync_appliesAsynchronousPredicate() {
        seed("customer-1", 4);

        var even = storage.filterAsync(
                        TableQuery.partition("customer-1"),
                        order -> CompletableFuture.supplyAsync(() -> order.getAmount() % 20 == 0))
                .join();

        assertEquals(List.of("order-2", "order-4"), rowKeys(even));
    }

    @Test
    void continuationToken_walksThroughSegments() {
        seed("customer-1", 5);
        TableQuery<Order> query = TableQuery.partition("customer-1");
        var segments = new ArrayList<List<String>>();

        String token = null;
        do {
            var segment = storage.getDataWithContinuationTokenAsync(query, token).join();
            segments.add(rowKeys(segment.entities()));
            token = segment.continuationToken();
        } while (token != null);

        assertEquals(
                List.of(List.of("order-1", "order-2"), List.of("order-3", "order-4"), List.of("order-5")), segments);
    }

    @Test
    void continuationToken_invalid_failsWithBadRequest() {
        assertEquals(
                StatusCodes.BAD_REQUEST,
                statusOf(storage.getDataWithContinuationTokenAsync(TableQuery.all(), "%%not-base64%%")));
    }

    @Test
    void pagination_advancesPages() {
        seed("customer-1", 3);
        TableQuery<Order> query = TableQuery.all();

        var first = storage.executeQueryWithPaginationAsync(query, PagingInfo.firstPage(2)).join();
        var second = storage.executeQueryWithPaginationAsync(query, first.pagingInfo()).join();

        assertEquals(List.of("order-1", "order-2"), rowKeys(first.entities()));
        assertTrue(first.hasMore());
        assertEquals(1, first.pagingInfo().currentPage());
        assertEquals(List.of("order-3"), rowKeys(second.entities()));
        assertFalse(second.hasMore());
    }

    @Test
    void chunkedReads_deliverChunksInOrder() {
        seed("customer-1", 5);
        var chunkSizes = new ArrayList<Integer>();
        var consumed = new ArrayList<Integer>();

        storage.getDataByChunksAsync(chunk -> {
                    chunkSizes.add(chunk.size());
                    return CompletableFuture.completedFuture(null);
                })
                .join();
        storage.forEachChunkAsync("customer-1", chunk -> consumed.add(chunk.size())).join();

        assertEquals(List.of(2, 2, 1), chunkSizes);
        assertEquals(List.of(2, 2, 1), consumed);
    }

    @Test
    void chunkedRead_stopsWhenHandlerReturnsFalse() {
        seed("customer-1", 5);
        var seen = new ArrayList<String>();

        storage.getDataByChunksAsync("customer-1", chunk -> {
                    seen.addAll(rowKeys(chunk));
                    return false;
                })
                .join();

        assertEquals(List.of("order-1", "order-2"), seen);
    }

    @Test
    void scan_findsFirstMatchAcrossChunks() {
        seed("customer-1", 5);
        var scanned = new ArrayList<String>();

        storage.scanDataAsync("customer-1", chunk -> {
                    scanned.addAll(rowKeys(chunk));
                    return CompletableFuture.completedFuture(null);
                })
                .join();
        var found = storage.firstOrNullViaScanAsync("customer-1", chunk -> chunk.stream()
                        .filter(order -> order.getAmount() == 40)
                        .findFirst()
                        .orElse(null))
                .join();

        assertEquals(5, scanned.size());
        assertEquals("order-4", found.getRowKey());
        assertNull(storage.firstOrNullViaScanAsync("customer-1", chunk -> null).join());
    }

    @Test
    void rowKeysOnly_matchesAcrossPartitions() {
        seed("customer-1", 2);
        seed("customer-2", 2);

        var found = storage.getDataRowKeysOnlyAsync(List.of("order-2")).join();

        assertEquals(2, found.size());
    }

    @Test
    void execute_stopsWhenStopConditionHolds() {
        seed("customer-1", 5);
        var chunks = new ArrayList<List<Order>>();

        storage.executeAsync(TableQuery.all(), chunks::add, () -> chunks.size() == 2).join();

        assertEquals(2, chunks.size());
    }

    @Test
    void dropTable_thenOperationsFailUntilRecreated() {
        seed("customer-1", 1);

        assertTrue(storage.deleteAsync().join());
        assertFalse(storage.tableExists());
        assertFalse(storage.deleteAsync().join());
        assertEquals(StatusCodes.NOT_FOUND, statusOf(storage.getDataAsync("customer-1", "order-1")));
        assertThrows(TableStorageException.class, () -> storage.get("customer-1", "order-1"));

        storage.createTableIfNotExistsAsync().join();

        assertTrue(storage.tableExists());
        assertEquals(0, storage.size());
        assertNull(storage.getDataAsync("customer-1", "order-1").join());
    }

    @Test
    void constructor_rejectsNonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryTableStorage<>("orders", Order.class, 0));
    }
}
