package com.knowledgecore.registry;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledgecore.ingest.DocumentType;
import com.knowledgecore.runtime.AppConfig;
import com.knowledgecore.runtime.RetryPolicy;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Registry backed by a Supabase table, accessed through its PostgREST endpoint. The table is unique on
 * {@code source}; {@code updated_at} is maintained by a database trigger.
 */
public class SupabaseMetadataRegistry implements MetadataRegistry {
    private static final Logger log = LoggerFactory.getLogger(SupabaseMetadataRegistry.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl tableUrl;
    private final String apiKey;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public SupabaseMetadataRegistry(OkHttpClient httpClient,
            String baseUrl,
            String apiKey,
            String table,
            RetryPolicy retryPolicy,
            Clock clock) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Supabase URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.tableUrl = parsed.newBuilder().addPathSegments("rest/v1").addPathSegment(table).build();
        this.apiKey = apiKey;
        this.retryPolicy = retryPolicy.retryingOn(SupabaseMetadataRegistry::isTransient);
        this.clock = clock;
    }

    public static SupabaseMetadataRegistry fromConfig(OkHttpClient httpClient,
            AppConfig.RegistryConfig config,
            RetryPolicy retryPolicy) {
        return new SupabaseMetadataRegistry(httpClient,
                config.getUrl(),
                config.getApiKey(),
                config.getTable(),
                retryPolicy,
                Clock.systemUTC());
    }

    @Override
    public void register(String source, String title, DocumentType type, int chunkCount) {
        if (!type.registrable()) {
            throw new IllegalArgumentException("Documents of type " + type.code() + " are not registered");
        }
        ObjectNode row = mapper.createObjectNode();
        row.put("source", source);
        row.put("title", title);
        row.put("type", type.code());
        row.put("chunk_count", chunkCount);
        row.put("date_added", OffsetDateTime.now(clock).toString());
        ArrayNode body = mapper.createArrayNode().add(row);

        HttpUrl url = tableUrl.newBuilder().addQueryParameter("on_conflict", "source").build();
        execute("register", request(url)
                .header("Prefer", "resolution=merge-duplicates,return=minimal")
                .post(json(body))
                .build());
        log.info("registry.register source={} title={} chunks={}", source, title, chunkCount);
    }

    @Override
    public void unregister(String source) {
        HttpUrl url = tableUrl.newBuilder().addQueryParameter("source", "eq." + source).build();
        execute("unregister", request(url).delete().build());
        log.info("registry.unregister source={}", source);
    }

    @Override
    public List<KnowledgeDocument> list() {
        HttpUrl url = tableUrl.newBuilder()
                .addQueryParameter("select", "*")
                .addQueryParameter("order", "date_added.desc")
                .build();
        JsonNode rows = execute("list", request(url).get().build());
        List<KnowledgeDocument> documents = new ArrayList<>();
        for (JsonNode row : rows) {
            documents.add(new KnowledgeDocument(
                    row.path("id").asText(null),
                    row.path("source").asText(""),
                    row.path("title").asText(""),
                    DocumentType.fromCode(row.path("type").asText("")),
                    row.path("chunk_count").asInt(0),
                    timestamp(row.path("date_added")),
                    timestamp(row.path("updated_at"))));
        }
        log.debug("registry.list rows={}", documents.size());
        return documents;
    }

    @Override
    public void updateChunkCount(String source, int chunkCount) {
        ObjectNode body = mapper.createObjectNode();
        body.put("chunk_count", chunkCount);
        HttpUrl url = tableUrl.newBuilder().addQueryParameter("source", "eq." + source).build();
        execute("update chunk count", request(url)
                .header("Prefer", "return=minimal")
                .patch(json(body))
                .build());
        log.info("registry.updateChunkCount source={} chunks={}", source, chunkCount);
    }

    @Override
    public void testTable() {
        HttpUrl url = tableUrl.newBuilder()
                .addQueryParameter("select", "id")
                .addQueryParameter("limit", "1")
                .build();
        execute("test table", request(url).get().build());
    }

    @Override
    public void clearAll() {
        HttpUrl url = tableUrl.newBuilder().addQueryParameter("id", "not.is.null").build();
        execute("clear all", request(url).delete().build());
        log.warn("registry.clearAll table={}", tableUrl.pathSegments().get(tableUrl.pathSize() - 1));
    }

    private JsonNode execute(String operation, Request request) {
        return retryPolicy.call("registry " + operation, () -> send(operation, request));
    }

    private JsonNode send(String operation, Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw new RegistryUnavailableException(
                        "Registry " + operation + " HTTP " + response.code() + ": " + body, response.code());
            }
            return body.isBlank() ? mapper.createArrayNode() : mapper.readTree(body);
        } catch (IOException e) {
            throw new RegistryUnavailableException("Registry " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private Request.Builder request(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("apikey", apiKey);
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private RequestBody json(JsonNode body) {
        try {
            return RequestBody.create(mapper.writeValueAsString(body), JSON);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize registry request", e);
        }
    }

    private static OffsetDateTime timestamp(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(node.asText());
        } catch (DateTimeParseException e) {
            log.debug("registry.timestamp unparseable value={}", node.asText());
            return null;
        }
    }

    private static boolean isTransient(Exception e) {
        if (!(e instanceof RegistryUnavailableException unavailable)) {
            return false;
        }
        int status = unavailable.statusCode();
        return status == -1 || status == 429 || status >= 500;
    }
}
