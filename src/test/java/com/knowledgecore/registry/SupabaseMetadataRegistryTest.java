package com.knowledgecore.registry;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgecore.ingest.DocumentType;
import com.knowledgecore.runtime.RetryPolicy;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SupabaseMetadataRegistryTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private SupabaseMetadataRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        registry = new SupabaseMetadataRegistry(new OkHttpClient(),
                server.url("/").toString(),
                "anon-key",
                "knowledge_documents",
                RetryPolicy.exponential(3, 1, 2, delay -> { }),
                Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldUpsertRowOnSource() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201));

        registry.register("/docs/guide.md", "guide.md", DocumentType.MARKDOWN, 12);

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/rest/v1/knowledge_documents?on_conflict=source", request.getPath());
        assertEquals("anon-key", request.getHeader("apikey"));
        assertEquals("Bearer anon-key", request.getHeader("Authorization"));
        assertEquals("resolution=merge-duplicates,return=minimal", request.getHeader("Prefer"));
        JsonNode row = mapper.readTree(request.getBody().readUtf8()).get(0);
        assertEquals("/docs/guide.md", row.path("source").asText());
        assertEquals("md", row.path("type").asText());
        assertEquals(12, row.path("chunk_count").asInt());
        assertEquals("2026-03-01T10:15:30Z", row.path("date_added").asText());
    }

    @Test
    void shouldRefuseToRegisterMemories() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.register("memory:1", "memory_general", DocumentType.MEMORY, 1));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void shouldListRowsNewestFirst() throws Exception {
        server.enqueue(new MockResponse().setBody("[{\"id\":\"r1\",\"source\":\"https://example.com\",\"title\":\"Example\","
                + "\"type\":\"url\",\"chunk_count\":3,\"date_added\":\"2026-02-01T08:00:00+00:00\",\"updated_at\":null}]"));

        List<KnowledgeDocument> documents = registry.list();

        RecordedRequest request = server.takeRequest();
        assertEquals("/rest/v1/knowledge_documents", request.getRequestUrl().encodedPath());
        assertEquals("*", request.getRequestUrl().queryParameter("select"));
        assertEquals("date_added.desc", request.getRequestUrl().queryParameter("order"));
        assertEquals(1, documents.size());
        KnowledgeDocument document = documents.get(0);
        assertEquals(DocumentType.URL, document.type());
        assertEquals(3, document.chunkCount());
        assertEquals(2026, document.dateAdded().getYear());
        assertNull(document.updatedAt());
    }

    @Test
    void shouldDeleteAndPatchBySource() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        server.enqueue(new MockResponse().setResponseCode(204));

        registry.unregister("a.txt");
        registry.updateChunkCount("b.txt", 4);

        RecordedRequest delete = server.takeRequest();
        assertEquals("DELETE", delete.getMethod());
        assertEquals("eq.a.txt", delete.getRequestUrl().queryParameter("source"));
        RecordedRequest patch = server.takeRequest();
        assertEquals("PATCH", patch.getMethod());
        assertEquals(4, mapper.readTree(patch.getBody().readUtf8()).path("chunk_count").asInt());
    }

    @Test
    void shouldClearEveryRow() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        registry.clearAll();

        RecordedRequest request = server.takeRequest();
        assertEquals("DELETE", request.getMethod());
        assertEquals("not.is.null", request.getRequestUrl().queryParameter("id"));
    }

    @Test
    void shouldRetryServerErrorsThenGiveUp() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(502));
        server.enqueue(new MockResponse().setResponseCode(500));

        RegistryUnavailableException failure = assertThrows(RegistryUnavailableException.class, registry::testTable);

        assertEquals(500, failure.statusCode());
        assertEquals(3, server.getRequestCount());
    }

    @Test
    void shouldNotRetryMissingTable() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"relation does not exist\"}"));

        RegistryUnavailableException failure = assertThrows(RegistryUnavailableException.class, registry::testTable);

        assertEquals(404, failure.statusCode());
        assertEquals(1, server.getRequestCount());
    }
}
