package com.knowledgecore.ingest;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.knowledgecore.embedding.EmbeddingGenerator;
import com.knowledgecore.embedding.ModelUnavailableException;
import com.knowledgecore.registry.KnowledgeDocument;
import com.knowledgecore.registry.MetadataRegistry;
import com.knowledgecore.registry.RegistryDrift;
import com.knowledgecore.registry.RegistryDriftException;
import com.knowledgecore.registry.RegistryUnavailableException;
import com.knowledgecore.vector.CancellationToken;
import com.knowledgecore.vector.PartialDeletionException;
import com.knowledgecore.vector.ScanCancelledException;
import com.knowledgecore.vector.SchemaMismatchException;
import com.knowledgecore.vector.VectorStore;
import com.knowledgecore.vector.VectorStoreException;

/**
 * Adds and removes whole documents. The vector store is the source of truth; the registry is a listing
 * kept in step on a best-effort basis and repaired by {@link #reconcile()}.
 *
 * <p>Operations on the same source are serialized. Re-ingesting a source writes the new chunks first and
 * only then removes the previous ones, so a failed re-ingest leaves the earlier version searchable.
 */
public class IngestionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);

    private final VectorStore vectorStore;
    private final MetadataRegistry registry;
    private final EmbeddingGenerator embeddingGenerator;
    private final Chunker chunker;
    private final String collection;
    private final Executor executor;
    private final Clock clock;
    private final SourceLocks locks = new SourceLocks();
    private final AtomicBoolean collectionReady = new AtomicBoolean(false);

    /**
     * @param registry {@code null} when no registry is configured; listings are then derived from the
     *                 vector store
     */
    public IngestionCoordinator(VectorStore vectorStore,
            MetadataRegistry registry,
            EmbeddingGenerator embeddingGenerator,
            Chunker chunker,
            String collection,
            Executor executor,
            Clock clock) {
        this.vectorStore = vectorStore;
        this.registry = registry;
        this.embeddingGenerator = embeddingGenerator;
        this.chunker = chunker;
        this.collection = collection;
        this.executor = executor;
        this.clock = clock;
    }

    /** Creates or verifies the collection. Later calls are no-ops once it succeeded. */
    public void initialize() {
        if (collectionReady.get()) {
            return;
        }
        synchronized (collectionReady) {
            if (!collectionReady.get()) {
                vectorStore.ensureCollection(collection);
                collectionReady.set(true);
                log.info("ingest.ready collection={} registry={}", collection, registry != null);
            }
        }
    }

    public IngestionResult ingest(ParsedDocument document) {
        return ingest(document, CancellationToken.none());
    }

    public IngestionResult ingest(ParsedDocument document, CancellationToken token) {
        if (document == null || document.source() == null || document.source().isBlank()) {
            return IngestionResult.failed("", FailureCategory.INVALID_DOCUMENT, "Document has no source");
        }
        String source = document.source();
        if (document.content() == null || document.content().isBlank()) {
            log.warn("ingest.rejected source={} reason=empty", source);
            return IngestionResult.failed(source, FailureCategory.INVALID_DOCUMENT, "Document has no text");
        }
        return locks.withLock(source, () -> ingestLocked(document, token));
    }

    public CompletableFuture<IngestionResult> ingestAsync(ParsedDocument document, CancellationToken token) {
        return CompletableFuture.supplyAsync(() -> ingest(document, token), executor);
    }

    public DeletionResult delete(String source) {
        return delete(source, CancellationToken.none());
    }

    /** Removes every chunk of {@code source}, then its registry row. The row stays if any chunk remains. */
    public DeletionResult delete(String source, CancellationToken token) {
        if (source == null || source.isBlank()) {
            return new DeletionResult("", false, 0, 0, false, FailureCategory.INVALID_DOCUMENT, "No source given");
        }
        return locks.withLock(source, () -> deleteLocked(source, token));
    }

    public CompletableFuture<DeletionResult> deleteAsync(String source, CancellationToken token) {
        return CompletableFuture.supplyAsync(() -> delete(source, token), executor);
    }

    /** Stores a remembered fact as a single point. Memories never appear in the document listing. */
    public IngestionResult storeMemory(MemoryEntry entry) {
        if (entry == null || entry.content() == null || entry.content().isBlank()) {
            return IngestionResult.failed("", FailureCategory.INVALID_DOCUMENT, "Memory has no content");
        }
        try {
            UUID.fromString(entry.id());
        } catch (IllegalArgumentException | NullPointerException e) {
            return IngestionResult.failed(entry.source(), FailureCategory.INVALID_DOCUMENT, "Memory id must be a UUID");
        }
        return locks.withLock(entry.source(), () -> storeMemoryLocked(entry));
    }

    /**
     * Documents for display, newest first. Falls back to grouping the vector store's points when the
     * registry is absent or unreachable.
     */
    public List<KnowledgeDocument> listDocuments() {
        if (registry != null) {
            try {
                return registry.list();
            } catch (RegistryUnavailableException e) {
                log.warn("ingest.list registry unavailable, deriving from vector store: {}", e.getMessage());
            }
        }
        initialize();
        List<KnowledgeDocument> documents = new ArrayList<>();
        for (SourceSummary summary : summarize(vectorStore.listItems(collection)).values()) {
            documents.add(new KnowledgeDocument(null, summary.source, summary.title, summary.type,
                    summary.chunkCount, summary.dateAdded, null));
        }
        documents.sort(Comparator.comparing(KnowledgeDocument::dateAdded,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return documents;
    }

    /** Every stored chunk, without vectors. Walks the whole collection. */
    public List<KnowledgeItem> listChunks(CancellationToken token) {
        initialize();
        return vectorStore.listItems(collection, token);
    }

    public ReconciliationReport migrate() {
        return migrate(false);
    }

    /**
     * Registers every document found in the vector store, overwriting existing rows.
     *
     * @param resetFirst delete every registry row before registering
     */
    public ReconciliationReport migrate(boolean resetFirst) {
        MetadataRegistry target = requireRegistry();
        initialize();
        if (resetFirst) {
            target.clearAll();
        }
        Map<String, SourceSummary> documents = summarize(vectorStore.listItems(collection));
        int registered = 0;
        int failed = 0;
        for (SourceSummary summary : documents.values()) {
            try {
                target.register(summary.source, summary.title, summary.type, summary.chunkCount);
                registered++;
            } catch (RegistryUnavailableException e) {
                failed++;
                log.error("ingest.migrate source={} failed", summary.source, e);
            }
        }
        log.info("ingest.migrate documents={} registered={} failed={}", documents.size(), registered, failed);
        return new ReconciliationReport(documents.size(), List.of(), registered, failed);
    }

    /** Compares registry rows with the vector store without changing either. */
    public ReconciliationReport audit() {
        Map<String, SourceSummary> documents = actualDocuments();
        List<RegistryDrift> drifts = findDrifts(documents, requireRegistry().list());
        for (RegistryDrift drift : drifts) {
            log.warn("ingest.drift source={} kind={} registered={} actual={}",
                    drift.source(), drift.kind(), drift.registeredCount(), drift.actualCount());
        }
        log.info("ingest.audit documents={} drifts={}", documents.size(), drifts.size());
        return new ReconciliationReport(documents.size(), drifts, 0, 0);
    }

    /** Brings the registry back in line with the vector store. */
    public ReconciliationReport reconcile() {
        MetadataRegistry target = requireRegistry();
        Map<String, SourceSummary> documents = actualDocuments();
        List<RegistryDrift> drifts = findDrifts(documents, target.list());
        int repaired = 0;
        int failed = 0;
        for (RegistryDrift drift : drifts) {
            try {
                switch (drift.kind()) {
                    case MISSING_ROW -> {
                        SourceSummary summary = documents.get(drift.source());
                        target.register(summary.source, summary.title, summary.type, summary.chunkCount);
                    }
                    case COUNT_MISMATCH -> target.updateChunkCount(drift.source(), drift.actualCount());
                    case ORPHAN_ROW -> target.unregister(drift.source());
                }
                repaired++;
                log.info("ingest.reconcile source={} kind={} repaired", drift.source(), drift.kind());
            } catch (RegistryUnavailableException e) {
                failed++;
                log.error("ingest.reconcile source={} kind={} failed", drift.source(), drift.kind(), e);
            }
        }
        return new ReconciliationReport(documents.size(), drifts, repaired, failed);
    }

    /** Throws {@link RegistryDriftException} when the registry disagrees with the vector store. */
    public void requireConsistent() {
        ReconciliationReport report = audit();
        if (!report.consistent()) {
            throw new RegistryDriftException(report.drifts());
        }
    }

    public boolean hasRegistry() {
        return registry != null;
    }

    public String collection() {
        return collection;
    }

    private IngestionResult ingestLocked(ParsedDocument document, CancellationToken token) {
        String source = document.source();
        List<Chunk> chunks = chunker.chunk(document.content());
        if (chunks.isEmpty()) {
            log.warn("ingest.rejected source={} reason=no-chunks", source);
            return IngestionResult.failed(source, FailureCategory.INVALID_DOCUMENT, "Document produced no chunks");
        }

        List<KnowledgeItem> items;
        List<String> previous;
        try {
            initialize();
            List<String> texts = new ArrayList<>(chunks.size());
            chunks.forEach(chunk -> texts.add(chunk.text()));
            List<float[]> vectors = embeddingGenerator.embedMany(texts);

            String dateAdded = Instant.now(clock).toString();
            items = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                KnowledgeMetadata metadata = KnowledgeMetadata.forChunk(
                        source, document.filename(), document.type(), i, chunks.size(), dateAdded);
                items.add(new KnowledgeItem(UUID.randomUUID().toString(), chunks.get(i).text(), metadata, vectors.get(i)));
            }

            previous = vectorStore.findIdsBySource(collection, source, token);
        } catch (RuntimeException e) {
            return failure(source, e);
        }

        try {
            vectorStore.upsert(collection, items);
        } catch (RuntimeException e) {
            rollback(source, items);
            return failure(source, e);
        }

        try {
            vectorStore.deleteVectors(collection, previous);
        } catch (PartialDeletionException e) {
            log.error("ingest.replace source={} stale chunks remain deleted={} requested={}",
                    source, e.deletedCount(), e.requestedCount(), e);
            return new IngestionResult(source, false, items.size(), e.deletedCount(), false,
                    FailureCategory.PARTIAL_DELETION, e.getMessage());
        }
        log.info("ingest.stored source={} chunks={} replaced={}", source, items.size(), previous.size());

        String registryError = null;
        boolean registered = false;
        if (registry != null && document.type().registrable()) {
            try {
                registry.register(source, document.filename(), document.type(), items.size());
                registered = true;
            } catch (RegistryUnavailableException e) {
                registryError = e.getMessage();
                log.warn("ingest.register source={} failed, run reconcile to restore the listing: {}", source, e.getMessage());
            }
        }
        return IngestionResult.ingested(source, items.size(), previous.size(), registered, registryError);
    }

    private DeletionResult deleteLocked(String source, CancellationToken token) {
        int deleted;
        try {
            initialize();
            deleted = vectorStore.deleteBySource(collection, source, token);
        } catch (PartialDeletionException e) {
            log.error("ingest.delete source={} incomplete deleted={} requested={}",
                    source, e.deletedCount(), e.requestedCount());
            return new DeletionResult(source, false, e.deletedCount(), e.requestedCount(), false,
                    FailureCategory.PARTIAL_DELETION, e.getMessage());
        } catch (ScanCancelledException e) {
            log.warn("ingest.delete source={} stopped deleted={} requested={} timedOut={}",
                    source, e.deletedCount(), e.requestedCount(), e.timedOut());
            return new DeletionResult(source, false, e.deletedCount(), e.requestedCount(), false,
                    FailureCategory.CANCELLED, e.getMessage());
        } catch (VectorStoreException e) {
            log.error("ingest.delete source={} failed", source, e);
            return new DeletionResult(source, false, 0, 0, false, categorize(e), e.getMessage());
        }

        if (registry == null) {
            return new DeletionResult(source, true, deleted, deleted, false, null, null);
        }
        try {
            registry.unregister(source);
            return new DeletionResult(source, true, deleted, deleted, true, null, null);
        } catch (RegistryUnavailableException e) {
            log.warn("ingest.unregister source={} failed, run reconcile to restore the listing: {}", source, e.getMessage());
            return new DeletionResult(source, true, deleted, deleted, false,
                    FailureCategory.REGISTRY_UNAVAILABLE, e.getMessage());
        }
    }

    private IngestionResult storeMemoryLocked(MemoryEntry entry) {
        Instant createdAt = entry.createdAt() == null ? Instant.now(clock) : entry.createdAt();
        String category = entry.category() == null || entry.category().isBlank() ? "general" : entry.category();
        Map<String, Object> extras = new LinkedHashMap<>();
        extras.put("created_at", createdAt.toString());
        extras.put("category", category);
        extras.put("importance", entry.importance());
        extras.put("source_type", entry.sourceType());
        try {
            initialize();
            float[] vector = embeddingGenerator.embed(entry.content());
            KnowledgeMetadata metadata = KnowledgeMetadata.forChunk(
                    entry.source(), "memory_" + category, DocumentType.MEMORY, 0, 1, createdAt.toString())
                    .withExtras(extras);
            vectorStore.upsert(collection, List.of(new KnowledgeItem(entry.id(), entry.content(), metadata, vector)));
        } catch (RuntimeException e) {
            return failure(entry.source(), e);
        }
        log.info("ingest.memory id={} category={}", entry.id(), category);
        return IngestionResult.ingested(entry.source(), 1, 0, false, null);
    }

    private void rollback(String source, List<KnowledgeItem> items) {
        List<String> ids = new ArrayList<>(items.size());
        items.forEach(item -> ids.add(item.id()));
        try {
            vectorStore.deleteVectors(collection, ids);
        } catch (VectorStoreException e) {
            log.error("ingest.rollback source={} could not remove {} new chunks", source, ids.size(), e);
        }
    }

    private IngestionResult failure(String source, RuntimeException e) {
        FailureCategory category = categorize(e);
        log.error("ingest.failed source={} category={}", source, category, e);
        return IngestionResult.failed(source, category, e.getMessage());
    }

    private static FailureCategory categorize(RuntimeException e) {
        if (e instanceof ModelUnavailableException) {
            return FailureCategory.MODEL_UNAVAILABLE;
        }
        if (e instanceof SchemaMismatchException) {
            return FailureCategory.SCHEMA_MISMATCH;
        }
        if (e instanceof ScanCancelledException) {
            return FailureCategory.CANCELLED;
        }
        if (e instanceof PartialDeletionException) {
            return FailureCategory.PARTIAL_DELETION;
        }
        if (e instanceof VectorStoreException) {
            return FailureCategory.STORE_UNREACHABLE;
        }
        throw e;
    }

    private MetadataRegistry requireRegistry() {
        if (registry == null) {
            throw new IllegalStateException("No metadata registry configured");
        }
        return registry;
    }

    private Map<String, SourceSummary> actualDocuments() {
        initialize();
        return summarize(vectorStore.listItems(collection));
    }

    private static List<RegistryDrift> findDrifts(Map<String, SourceSummary> documents, List<KnowledgeDocument> rows) {
        Map<String, KnowledgeDocument> bySource = new HashMap<>();
        rows.forEach(row -> bySource.put(row.source(), row));

        List<RegistryDrift> drifts = new ArrayList<>();
        for (SourceSummary summary : documents.values()) {
            KnowledgeDocument row = bySource.get(summary.source);
            if (row == null) {
                drifts.add(new RegistryDrift(summary.source, RegistryDrift.Kind.MISSING_ROW, -1, summary.chunkCount));
            } else if (row.chunkCount() != summary.chunkCount) {
                drifts.add(new RegistryDrift(summary.source, RegistryDrift.Kind.COUNT_MISMATCH,
                        row.chunkCount(), summary.chunkCount));
            }
        }
        for (KnowledgeDocument row : rows) {
            if (!documents.containsKey(row.source())) {
                drifts.add(new RegistryDrift(row.source(), RegistryDrift.Kind.ORPHAN_ROW, row.chunkCount(), 0));
            }
        }
        return drifts;
    }

    /** Groups points by source, skipping memories and points without a source. */
    private static Map<String, SourceSummary> summarize(List<KnowledgeItem> items) {
        Map<String, SourceSummary> summaries = new LinkedHashMap<>();
        for (KnowledgeItem item : items) {
            KnowledgeMetadata metadata = item.metadata();
            if (!metadata.type().registrable() || metadata.source().isBlank()) {
                continue;
            }
            SourceSummary summary = summaries.computeIfAbsent(metadata.source(),
                    source -> new SourceSummary(source, metadata.filename(), metadata.type()));
            summary.chunkCount++;
            OffsetDateTime added = parseTimestamp(metadata.dateAdded());
            if (added != null && (summary.dateAdded == null || added.isBefore(summary.dateAdded))) {
                summary.dateAdded = added;
            }
        }
        return summaries;
    }

    private static OffsetDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static final class SourceSummary {
        private final String source;
        private final String title;
        private final DocumentType type;
        private int chunkCount;
        private OffsetDateTime dateAdded;

        private SourceSummary(String source, String title, DocumentType type) {
            this.source = source;
            this.title = title == null || title.isBlank() ? source : title;
            this.type = type;
        }
    }
}
