package com.knowledgecore.vector;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.knowledgecore.ingest.KnowledgeItem;
import com.knowledgecore.runtime.RetryPolicy;

/**
 * Scroll-based enumeration and batched deletion shared by stores that expose cursor pagination but no
 * server-side filtered delete. Subclasses supply the two wire primitives.
 */
public abstract class PaginatedVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(PaginatedVectorStore.class);

    private final int scrollPageSize;
    private final int deleteBatchSize;
    private final Duration scanTimeout;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    protected PaginatedVectorStore(int scrollPageSize,
            int deleteBatchSize,
            Duration scanTimeout,
            RetryPolicy retryPolicy,
            Clock clock) {
        this.scrollPageSize = Math.max(1, scrollPageSize);
        this.deleteBatchSize = Math.max(1, deleteBatchSize);
        this.scanTimeout = scanTimeout;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    /** Fetches one page starting at {@code offset} ({@code null} for the first page). */
    protected abstract ScrollPage scrollPage(String collection, int limit, Object offset);

    /** Deletes exactly the given ids in one request. */
    protected abstract void deletePoints(String collection, List<String> ids);

    @Override
    public void deleteVectors(String collection, List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        deleteInBatches(collection, ids, CancellationToken.none());
    }

    @Override
    public List<String> findIdsBySource(String collection, String source, CancellationToken token) {
        List<String> ids = new ArrayList<>();
        int pages = scan(collection, token, item -> {
            if (source.equals(item.metadata().source())) {
                ids.add(item.id());
            }
        });
        log.debug("vector.findBySource collection={} source={} matches={} pages={}", collection, source, ids.size(), pages);
        return ids;
    }

    @Override
    public int deleteBySource(String collection, String source, CancellationToken token) {
        List<String> ids = findIdsBySource(collection, source, token);
        if (ids.isEmpty()) {
            log.info("vector.deleteBySource collection={} source={} deleted=0", collection, source);
            return 0;
        }
        int deleted = deleteInBatches(collection, ids, token);
        log.info("vector.deleteBySource collection={} source={} deleted={}", collection, source, deleted);
        return deleted;
    }

    @Override
    public List<KnowledgeItem> listItems(String collection, CancellationToken token) {
        Map<String, KnowledgeItem> items = new LinkedHashMap<>();
        int pages = scan(collection, token, item -> items.putIfAbsent(item.id(), item));
        log.info("vector.list collection={} points={} pages={}", collection, items.size(), pages);
        return new ArrayList<>(items.values());
    }

    protected RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    private int scan(String collection, CancellationToken token, Consumer<KnowledgeItem> visitor) {
        long deadline = scanTimeout == null ? Long.MAX_VALUE : clock.millis() + scanTimeout.toMillis();
        Object offset = null;
        int pages = 0;
        do {
            if (token.isStopRequested()) {
                throw new ScanCancelledException(collection, pages, 0, -1, false);
            }
            if (clock.millis() > deadline) {
                throw new ScanCancelledException(collection, pages, 0, -1, true);
            }
            Object cursor = offset;
            ScrollPage page = retryPolicy.call("scroll " + collection,
                    () -> scrollPage(collection, scrollPageSize, cursor));
            pages++;
            page.points().forEach(visitor);
            log.debug("vector.scroll collection={} page={} points={} next={}", collection, pages, page.points().size(), page.nextOffset());
            offset = page.nextOffset();
        } while (offset != null);
        return pages;
    }

    private int deleteInBatches(String collection, List<String> ids, CancellationToken token) {
        int deleted = 0;
        int batchNumber = 0;
        for (int start = 0; start < ids.size(); start += deleteBatchSize) {
            if (token.isStopRequested()) {
                throw new ScanCancelledException(collection, 0, deleted, ids.size(), false);
            }
            List<String> batch = List.copyOf(ids.subList(start, Math.min(ids.size(), start + deleteBatchSize)));
            batchNumber++;
            try {
                retryPolicy.run("delete batch " + batchNumber + " " + collection, () -> deletePoints(collection, batch));
            } catch (VectorStoreException e) {
                log.error("vector.delete batch={} collection={} deleted={} requested={}", batchNumber, collection, deleted, ids.size(), e);
                throw new PartialDeletionException(collection, deleted, ids.size(), e);
            }
            deleted += batch.size();
            log.debug("vector.delete batch={} collection={} size={}", batchNumber, collection, batch.size());
        }
        return deleted;
    }
}
