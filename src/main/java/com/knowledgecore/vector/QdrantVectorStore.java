package com.knowledgecore.vector;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledgecore.ingest.DocumentType;
import com.knowledgecore.ingest.KnowledgeItem;
import com.knowledgecore.ingest.KnowledgeMetadata;
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
 * Qdrant REST client. Collections use a single unnamed vector with cosine distance; points carry the chunk
 * text and metadata as a flat payload.
 */
public class QdrantVectorStore extends PaginatedVectorStore {
    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStore.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String DISTANCE = "Cosine";
    private static final Set<String> KNOWN_FIELDS = Set.of(
            "content", "source", "filename", "type", "chunkIndex", "totalChunks", "dateAdded");
    private static final Pattern NUMERIC_ID = Pattern.compile("\\d{1,20}");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final int vectorSize;
    private final int upsertBatchSize;

    public QdrantVectorStore(OkHttpClient httpClient,
            String baseUrl,
            String apiKey,
            int vectorSize,
            int upsertBatchSize,
            int scrollPageSize,
            int deleteBatchSize,
            Duration scanTimeout,
            RetryPolicy retryPolicy,
            Clock clock) {
        super(scrollPageSize, deleteBatchSize, scanTimeout,
                retryPolicy.retryingOn(StoreUnreachableException.class::isInstance), clock);
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Qdrant URL: " + baseUrl);
        }
        if (vectorSize <= 0) {
            throw new IllegalArgumentException("vectorSize must be positive");
        }
        this.httpClient = httpClient;
        this.baseUrl = parsed;
        this.apiKey = apiKey;
        this.vectorSize = vectorSize;
        this.upsertBatchSize = Math.max(1, upsertBatchSize);
    }

    public static QdrantVectorStore fromConfig(OkHttpClient httpClient,
            AppConfig.VectorStoreConfig config,
            int vectorSize,
            RetryPolicy retryPolicy) {
        return new QdrantVectorStore(httpClient,
                config.getUrl(),
                config.getApiKey(),
                vectorSize,
                config.getUpsertBatchSize(),
                config.getScrollPageSize(),
                config.getDeleteBatchSize(),
                Duration.ofMillis(config.getScanTimeoutMs()),
                retryPolicy,
                Clock.systemUTC());
    }

    @Override
    public int vectorSize() {
        return vectorSize;
    }

    @Override
    public void ensureCollection(String collection) {
        JsonNode listing = retryPolicy().call("list collections",
                () -> send("list collections", request(url("collections")).get().build()));
        boolean exists = false;
        for (JsonNode entry : listing.path("result").path("collections")) {
            if (collection.equals(entry.path("name").asText())) {
                exists = true;
                break;
            }
        }

        if (!exists) {
            ObjectNode vectors = mapper.createObjectNode();
            vectors.put("size", vectorSize);
            vectors.put("distance", DISTANCE);
            ObjectNode body = mapper.createObjectNode();
            body.set("vectors", vectors);
            try {
                retryPolicy().call("create collection " + collection,
                        () -> send("create collection", request(url("collections", collection)).put(json(body)).build()));
                log.info("vector.collection created name={} size={} distance={}", collection, vectorSize, DISTANCE);
                return;
            } catch (VectorStoreException e) {
                if (e.statusCode() != 409) {
                    throw e;
                }
                log.info("vector.collection name={} created concurrently, verifying schema", collection);
            }
        }

        JsonNode info = retryPolicy().call("describe collection " + collection,
                () -> send("describe collection", request(url("collections", collection)).get().build()));
        JsonNode size = info.path("result").path("config").path("params").path("vectors").path("size");
        if (size.isNumber() && size.asInt() != vectorSize) {
            throw new SchemaMismatchException("Collection " + collection + " vector size", vectorSize, size.asInt());
        }
        log.debug("vector.collection verified name={} size={}", collection, vectorSize);
    }

    @Override
    public void upsert(String collection, List<KnowledgeItem> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        for (KnowledgeItem item : items) {
            checkDimension("Point " + item.id(), item.vector());
        }
        int batches = (items.size() + upsertBatchSize - 1) / upsertBatchSize;
        for (int start = 0, batch = 1; start < items.size(); start += upsertBatchSize, batch++) {
            List<KnowledgeItem> slice = items.subList(start, Math.min(items.size(), start + upsertBatchSize));
            ObjectNode body = mapper.createObjectNode();
            ArrayNode points = body.putArray("points");
            slice.forEach(item -> points.add(toPoint(item)));
            retryPolicy().call("upsert " + collection,
                    () -> send("upsert", request(url("collections", collection, "points"), true).put(json(body)).build()));
            log.debug("vector.upsert collection={} batch={}/{} points={}", collection, batch, batches, slice.size());
        }
        log.info("vector.upsert collection={} points={}", collection, items.size());
    }

    @Override
    public List<SearchResult> search(String collection, float[] queryVector, int limit) {
        checkDimension("Query vector", queryVector);
        ObjectNode body = mapper.createObjectNode();
        body.set("vector", vectorNode(queryVector));
        body.put("limit", Math.max(1, limit));
        body.put("with_payload", true);

        JsonNode root = retryPolicy().call("search " + collection,
                () -> send("search", request(url("collections", collection, "points", "search")).post(json(body)).build()));
        List<SearchResult> results = new ArrayList<>();
        for (JsonNode hit : root.path("result")) {
            KnowledgeItem item = toItem(hit);
            results.add(new SearchResult(item.id(), item.content(), item.metadata(), hit.path("score").asDouble(0.0)));
        }
        log.debug("vector.search collection={} limit={} hits={}", collection, limit, results.size());
        return results;
    }

    @Override
    protected ScrollPage scrollPage(String collection, int limit, Object offset) {
        ObjectNode body = mapper.createObjectNode();
        body.put("limit", limit);
        body.put("with_payload", true);
        body.put("with_vector", false);
        if (offset != null) {
            body.set("offset", offset instanceof JsonNode node ? node : mapper.valueToTree(offset));
        }

        JsonNode result = send("scroll", request(url("collections", collection, "points", "scroll")).post(json(body)).build())
                .path("result");
        List<KnowledgeItem> points = new ArrayList<>();
        for (JsonNode point : result.path("points")) {
            points.add(toItem(point));
        }
        JsonNode next = result.path("next_page_offset");
        return new ScrollPage(points, next.isMissingNode() || next.isNull() ? null : next);
    }

    @Override
    protected void deletePoints(String collection, List<String> ids) {
        ObjectNode body = mapper.createObjectNode();
        ArrayNode points = body.putArray("points");
        ids.forEach(id -> points.add(idNode(id)));
        send("delete", request(url("collections", collection, "points", "delete"), true).post(json(body)).build());
    }

    KnowledgeItem toItem(JsonNode point) {
        JsonNode payload = point.path("payload");
        Map<String, Object> extras = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_FIELDS.contains(field.getKey()) && !field.getValue().isNull()) {
                extras.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
            }
        }
        KnowledgeMetadata metadata = new KnowledgeMetadata(
                payload.path("source").asText(""),
                payload.path("filename").asText(""),
                DocumentType.fromCode(payload.path("type").asText("")),
                payload.path("chunkIndex").asInt(0),
                payload.path("totalChunks").asInt(1),
                payload.path("dateAdded").asText(""),
                extras);
        return new KnowledgeItem(point.path("id").asText(), payload.path("content").asText(""), metadata, null);
    }

    private ObjectNode toPoint(KnowledgeItem item) {
        KnowledgeMetadata metadata = item.metadata();
        ObjectNode payload = mapper.createObjectNode();
        metadata.extras().forEach((key, value) -> {
            if (!KNOWN_FIELDS.contains(key)) {
                payload.set(key, mapper.valueToTree(value));
            }
        });
        payload.put("content", item.content());
        payload.put("source", metadata.source());
        payload.put("filename", metadata.filename());
        payload.put("type", metadata.type().code());
        payload.put("chunkIndex", metadata.chunkIndex());
        payload.put("totalChunks", metadata.totalChunks());
        payload.put("dateAdded", metadata.dateAdded());

        ObjectNode point = mapper.createObjectNode();
        point.set("id", idNode(item.id()));
        point.set("vector", vectorNode(item.vector()));
        point.set("payload", payload);
        return point;
    }

    /** Qdrant ids are UUIDs or unsigned integers; integer ids must go back on the wire as numbers. */
    private JsonNode idNode(String id) {
        if (NUMERIC_ID.matcher(id).matches()) {
            return mapper.getNodeFactory().numberNode(new BigInteger(id));
        }
        return mapper.getNodeFactory().textNode(id);
    }

    private ArrayNode vectorNode(float[] vector) {
        ArrayNode node = mapper.createArrayNode();
        for (float value : vector) {
            node.add(value);
        }
        return node;
    }

    private void checkDimension(String what, float[] vector) {
        int actual = vector == null ? 0 : vector.length;
        if (actual != vectorSize) {
            throw new SchemaMismatchException(what + " dimension", vectorSize, actual);
        }
    }

    private JsonNode send(String operation, Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody == null ? "" : responseBody.string();
            int status = response.code();
            if (status == 429 || status >= 500) {
                throw new StoreUnreachableException("Qdrant " + operation + " HTTP " + status + ": " + body, status);
            }
            if (!response.isSuccessful()) {
                if (status == 400 && body.toLowerCase(Locale.ROOT).contains("dimension")) {
                    throw new SchemaMismatchException("Qdrant rejected " + operation + ": " + body, vectorSize, -1);
                }
                throw new VectorStoreException("Qdrant " + operation + " HTTP " + status + ": " + body, status, null);
            }
            return body.isBlank() ? mapper.createObjectNode() : mapper.readTree(body);
        } catch (IOException e) {
            throw new StoreUnreachableException("Qdrant " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private Request.Builder request(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
        return builder;
    }

    private Request.Builder request(HttpUrl url, boolean waitForCommit) {
        HttpUrl target = waitForCommit ? url.newBuilder().addQueryParameter("wait", "true").build() : url;
        return request(target);
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private RequestBody json(JsonNode body) {
        try {
            return RequestBody.create(mapper.writeValueAsString(body), JSON);
        } catch (IOException e) {
            throw new VectorStoreException("Unable to serialize Qdrant request", e);
        }
    }
}
