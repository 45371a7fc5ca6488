package com.knowledgecore.ingest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.knowledgecore.embedding.EmbeddingGenerator;
import com.knowledgecore.embedding.HashingEmbeddingService;
import com.knowledgecore.runtime.RetryPolicy;
import com.knowledgecore.registry.InMemoryMetadataRegistry;
import com.knowledgecore.registry.KnowledgeDocument;
import com.knowledgecore.registry.RegistryDrift;
import com.knowledgecore.registry.RegistryDriftException;
import com.knowledgecore.vector.CancellationToken;
import com.knowledgecore.vector.InMemoryVectorStore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionCoordinatorTest {
    private static final String COLLECTION = "knowledge";
    private static final int DIMENSION = 64;

    private InMemoryVectorStore store;
    private InMemoryMetadataRegistry registry;
    private ExecutorService executor;
    private IngestionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        store = new InMemoryVectorStore(DIMENSION, 7, 5, RetryPolicy.none());
        registry = new InMemoryMetadataRegistry();
        executor = Executors.newFixedThreadPool(4);
        coordinator = coordinator(registry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldStoreOnePointPerChunkWithMetadata() {
        IngestionResult result = coordinator.ingest(document("guide.md", paragraphs(5)));

        assertTrue(result.success());
        assertTrue(result.registered());
        assertNull(result.failure());
        assertEquals(result.chunksIngested(), store.countBySource(COLLECTION, "guide.md"));
        assertTrue(result.chunksIngested() > 1);
        assertTrue(store.ensured.contains(COLLECTION));

        KnowledgeItem first = store.points(COLLECTION).get(0);
        assertEquals(DocumentType.MARKDOWN, first.metadata().type());
        assertEquals(result.chunksIngested(), first.metadata().totalChunks());
        assertEquals("2026-04-02T09:00:00Z", first.metadata().dateAdded());
        assertEquals(result.chunksIngested(), registry.row("guide.md").chunkCount());
    }

    @Test
    void shouldReplacePreviousChunksOnReingest() {
        IngestionResult first = coordinator.ingest(document("guide.md", paragraphs(5)));
        Set<String> firstIds = idsFor("guide.md");

        IngestionResult second = coordinator.ingest(document("guide.md", paragraphs(3)));

        assertTrue(second.success());
        assertEquals(first.chunksIngested(), second.chunksReplaced());
        assertEquals(second.chunksIngested(), store.countBySource(COLLECTION, "guide.md"));
        Set<String> secondIds = idsFor("guide.md");
        secondIds.retainAll(firstIds);
        assertTrue(secondIds.isEmpty());
        assertEquals(second.chunksIngested(), registry.row("guide.md").chunkCount());
    }

    @Test
    void shouldKeepPreviousVersionWhenUpsertFails() {
        coordinator.ingest(document("guide.md", paragraphs(3)));
        Set<String> before = idsFor("guide.md");
        store.upsertUnreachable = true;

        IngestionResult result = coordinator.ingest(document("guide.md", paragraphs(6)));

        assertFalse(result.success());
        assertEquals(FailureCategory.STORE_UNREACHABLE, result.failure());
        assertEquals(before, idsFor("guide.md"));
    }

    @Test
    void shouldRejectEmptyDocuments() {
        IngestionResult blank = coordinator.ingest(document("empty.txt", "   \n  "));
        IngestionResult tooShort = coordinator.ingest(document("short.txt", "tiny"));

        assertEquals(FailureCategory.INVALID_DOCUMENT, blank.failure());
        assertEquals(FailureCategory.INVALID_DOCUMENT, tooShort.failure());
        assertEquals(0, store.size(COLLECTION));
        assertEquals("Document not added (invalid document)", blank.describe());
    }

    @Test
    void shouldSucceedWhenRegistryIsDown() {
        registry.unavailable = true;

        IngestionResult result = coordinator.ingest(document("guide.md", paragraphs(2)));

        assertTrue(result.success());
        assertFalse(result.registered());
        assertEquals(FailureCategory.REGISTRY_UNAVAILABLE, result.failure());
        assertEquals(result.chunksIngested(), store.countBySource(COLLECTION, "guide.md"));
    }

    @Test
    void shouldDeleteEveryChunkAndRegistryRow() {
        coordinator.ingest(document("a.md", paragraphs(12)));
        coordinator.ingest(document("b.md", paragraphs(4)));
        long remaining = store.countBySource(COLLECTION, "b.md");

        DeletionResult result = coordinator.delete("a.md");

        assertTrue(result.success());
        assertTrue(result.unregistered());
        assertEquals(0, store.countBySource(COLLECTION, "a.md"));
        assertEquals(remaining, store.countBySource(COLLECTION, "b.md"));
        assertNull(registry.row("a.md"));
    }

    @Test
    void shouldKeepRegistryRowWhenDeletionIsPartial() {
        coordinator.ingest(document("a.md", paragraphs(12)));
        int total = (int) store.countBySource(COLLECTION, "a.md");
        store.failDeletesAfter = store.deleteCalls.get() + 1;

        DeletionResult result = coordinator.delete("a.md");

        assertFalse(result.success());
        assertEquals(FailureCategory.PARTIAL_DELETION, result.failure());
        assertEquals(5, result.deletedCount());
        assertEquals(total, result.requestedCount());
        assertEquals(total - 5, store.countBySource(COLLECTION, "a.md"));
        assertTrue(registry.row("a.md") != null);
    }

    @Test
    void shouldReportCancelledDeletion() {
        coordinator.ingest(document("a.md", paragraphs(12)));
        CancellationToken token = CancellationToken.create();
        token.requestStop();

        DeletionResult result = coordinator.delete("a.md", token);

        assertEquals(FailureCategory.CANCELLED, result.failure());
        assertEquals(-1, result.requestedCount());
        assertTrue(store.countBySource(COLLECTION, "a.md") > 0);
    }

    @Test
    void shouldReportRemovedOfRequestedWhenStoppedDuringBatches() {
        coordinator.ingest(document("a.md", paragraphs(12)));
        int total = (int) store.countBySource(COLLECTION, "a.md");
        CancellationToken token = CancellationToken.create();
        store.onDelete = call -> token.requestStop();

        DeletionResult result = coordinator.delete("a.md", token);

        assertEquals(FailureCategory.CANCELLED, result.failure());
        assertEquals(5, result.deletedCount());
        assertEquals(total, result.requestedCount());
        assertEquals("Removed 5 of " + total + " chunks", result.describe());
        assertEquals(total - 5, store.countBySource(COLLECTION, "a.md"));
        assertTrue(registry.row("a.md") != null);
    }

    @Test
    void shouldListFromVectorStoreWhenRegistryIsDown() {
        coordinator.ingest(document("a.md", paragraphs(2)));
        coordinator.storeMemory(memory());
        registry.unavailable = true;

        List<KnowledgeDocument> documents = coordinator.listDocuments();

        assertEquals(1, documents.size());
        assertEquals("a.md", documents.get(0).source());
        assertNull(documents.get(0).id());
        assertEquals(store.countBySource(COLLECTION, "a.md"), documents.get(0).chunkCount());
        assertEquals(store.size(COLLECTION), coordinator.listChunks(CancellationToken.none()).size());
    }

    @Test
    void shouldStoreMemoryWithoutRegistering() {
        MemoryEntry entry = memory();

        IngestionResult result = coordinator.storeMemory(entry);

        assertTrue(result.success());
        assertFalse(result.registered());
        assertNull(result.failure());
        KnowledgeItem stored = store.points(COLLECTION).get(0);
        assertEquals(entry.id(), stored.id());
        assertEquals("memory:" + entry.id(), stored.metadata().source());
        assertEquals("memory_preference", stored.metadata().filename());
        assertEquals(DocumentType.MEMORY, stored.metadata().type());
        assertEquals(0.8, stored.metadata().extras().get("importance"));
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void shouldRejectMemoryWithoutUuid() {
        MemoryEntry entry = new MemoryEntry("not-a-uuid", "likes tea", "preference", 0.5, "chat", null);

        assertEquals(FailureCategory.INVALID_DOCUMENT, coordinator.storeMemory(entry).failure());
    }

    @Test
    void shouldDetectAndRepairRegistryDrift() {
        coordinator.ingest(document("a.md", paragraphs(3)));
        coordinator.ingest(document("b.md", paragraphs(3)));
        coordinator.ingest(document("c.md", paragraphs(3)));
        registry.unregister("a.md");
        registry.updateChunkCount("b.md", 99);
        registry.register("gone.md", "gone.md", DocumentType.MARKDOWN, 4);

        ReconciliationReport audit = coordinator.audit();

        assertEquals(3, audit.documentsFound());
        assertEquals(Set.of(RegistryDrift.Kind.MISSING_ROW, RegistryDrift.Kind.COUNT_MISMATCH, RegistryDrift.Kind.ORPHAN_ROW),
                kinds(audit));
        assertThrows(RegistryDriftException.class, coordinator::requireConsistent);

        ReconciliationReport repaired = coordinator.reconcile();

        assertEquals(3, repaired.repaired());
        assertEquals(0, repaired.failed());
        assertTrue(coordinator.audit().consistent());
        coordinator.requireConsistent();
    }

    @Test
    void shouldMigrateEveryStoredDocument() {
        coordinator(null).ingest(document("a.md", paragraphs(2)));
        coordinator(null).ingest(document("b.md", paragraphs(2)));
        coordinator(null).storeMemory(memory());

        ReconciliationReport report = coordinator.migrate();

        assertEquals(2, report.documentsFound());
        assertEquals(2, report.repaired());
        assertEquals(2, registry.list().size());
    }

    @Test
    void shouldDropStaleRowsWhenMigratingWithReset() {
        coordinator.ingest(document("a.md", paragraphs(2)));
        registry.register("stale.md", "stale.md", DocumentType.MARKDOWN, 7);

        ReconciliationReport report = coordinator.migrate(true);

        assertEquals(1, report.repaired());
        assertNull(registry.row("stale.md"));
        assertTrue(coordinator.audit().consistent());
    }

    @Test
    void shouldRequireRegistryForMaintenance() {
        IngestionCoordinator withoutRegistry = coordinator(null);

        assertThrows(IllegalStateException.class, withoutRegistry::audit);
        assertTrue(withoutRegistry.ingest(document("a.md", paragraphs(2))).success());
        assertEquals(1, withoutRegistry.listDocuments().size());
    }

    @Test
    void shouldSerializeConcurrentIngestsOfSameSource() throws Exception {
        List<CompletableFuture<IngestionResult>> futures = List.of(
                coordinator.ingestAsync(document("same.md", paragraphs(4)), CancellationToken.none()),
                coordinator.ingestAsync(document("same.md", paragraphs(6)), CancellationToken.none()),
                coordinator.ingestAsync(document("same.md", paragraphs(5)), CancellationToken.none()));
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        int stored = (int) store.countBySource(COLLECTION, "same.md");
        Set<Integer> counts = new HashSet<>();
        for (CompletableFuture<IngestionResult> future : futures) {
            assertTrue(future.get().success());
            counts.add(future.get().chunksIngested());
        }
        assertTrue(counts.contains(stored));
        assertEquals(stored, registry.row("same.md").chunkCount());

        DeletionResult deleted = coordinator.deleteAsync("same.md", CancellationToken.none()).get(30, TimeUnit.SECONDS);
        assertEquals(stored, deleted.deletedCount());
    }

    private IngestionCoordinator coordinator(InMemoryMetadataRegistry withRegistry) {
        EmbeddingGenerator generator = new EmbeddingGenerator(
                () -> new HashingEmbeddingService(DIMENSION), RetryPolicy.none(), DIMENSION);
        return new IngestionCoordinator(store, withRegistry, generator, new Chunker(400, 50, 20), COLLECTION, executor,
                Clock.fixed(Instant.parse("2026-04-02T09:00:00Z"), ZoneOffset.UTC));
    }

    private Set<String> idsFor(String source) {
        Set<String> ids = new HashSet<>();
        for (KnowledgeItem item : store.points(COLLECTION)) {
            if (source.equals(item.metadata().source())) {
                ids.add(item.id());
            }
        }
        return ids;
    }

    private static Set<RegistryDrift.Kind> kinds(ReconciliationReport report) {
        Set<RegistryDrift.Kind> kinds = new HashSet<>();
        report.drifts().forEach(drift -> kinds.add(drift.kind()));
        return kinds;
    }

    private static ParsedDocument document(String source, String content) {
        return new ParsedDocument(content, source, source, DocumentType.fromCode(source.substring(source.lastIndexOf('.') + 1)));
    }

    private static MemoryEntry memory() {
        return new MemoryEntry(UUID.randomUUID().toString(), "The user prefers green tea in the morning.",
                "preference", 0.8, "conversation", Instant.parse("2026-04-01T08:00:00Z"));
    }

    private static String paragraphs(int count) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < count; i++) {
            builder.append("Paragraph ").append(i)
                    .append(" explains how documents are split into chunks, embedded, and stored for retrieval. ")
                    .append("Each chunk keeps its source, position, and the time it was added so listings stay accurate.")
                    .append("\n\n");
        }
        return builder.toString();
    }
}
