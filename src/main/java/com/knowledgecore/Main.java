package com.knowledgecore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.knowledgecore.ingest.DeletionResult;
import com.knowledgecore.ingest.IngestionCoordinator;
import com.knowledgecore.ingest.IngestionResult;
import com.knowledgecore.ingest.ParsedDocument;
import com.knowledgecore.ingest.ReconciliationReport;
import com.knowledgecore.ingest.TextFileParser;
import com.knowledgecore.registry.KnowledgeDocument;
import com.knowledgecore.registry.MetadataRegistry;
import com.knowledgecore.registry.RegistryDrift;
import com.knowledgecore.registry.RegistryUnavailableException;
import com.knowledgecore.runtime.AppConfig;
import com.knowledgecore.runtime.KnowledgeRuntime;
import com.knowledgecore.vector.SearchResult;
import com.knowledgecore.vector.VectorStoreException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "knowledge-core",
        mixinStandardHelpOptions = true,
        version = "knowledge-core 0.1.0",
        description = "Ingest documents into the knowledge base and query it.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "test-connection",
            converter = ModeConverter.class)
    Mode mode;

    @Option(names = "--file", description = "Text or Markdown file to ingest")
    Path file;

    @Option(names = "--source", description = "Source identifier to delete")
    String source;

    @Option(names = "--query", description = "Query text used in search mode")
    String query;

    @Option(names = "--reset-registry", description = "Delete all registry rows before migrating", defaultValue = "false")
    boolean resetRegistry;

    @Option(names = "--top-k", description = "Results to return in search mode (defaults to retrieval.defaultLimit)")
    Integer topK;

    enum Mode {
        TEST_CONNECTION,
        INGEST,
        SEARCH,
        LIST,
        DELETE,
        MIGRATE,
        AUDIT,
        RECONCILE;

        String label() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }

        @Override
        public String toString() {
            return label();
        }
    }

    public static final class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            return Mode.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        String invalid = validateArguments();
        if (invalid != null) {
            log.error(invalid);
            return 2;
        }

        AppConfig config = AppConfig.load(Path.of(configPath)).withEnvironment(System.getenv());
        log.info("Starting knowledge-core in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try (KnowledgeRuntime runtime = KnowledgeRuntime.start(config)) {
            IngestionCoordinator coordinator = runtime.coordinator();
            switch (mode) {
                case TEST_CONNECTION:
                    return testConnection(runtime);
                case INGEST:
                    return ingest(coordinator);
                case SEARCH:
                    return search(runtime);
                case LIST:
                    printDocuments(coordinator.listDocuments());
                    return 0;
                case DELETE:
                    DeletionResult deletion = coordinator.delete(source);
                    System.out.println(source + ": " + deletion.describe());
                    return deletion.success() ? 0 : 1;
                case MIGRATE:
                    if (!coordinator.hasRegistry()) {
                        log.error("migrate requires registry.enabled=true");
                        return 2;
                    }
                    ReconciliationReport migrated = coordinator.migrate(resetRegistry);
                    System.out.printf("Registered %d of %d documents (%d failed)%n",
                            migrated.repaired(), migrated.documentsFound(), migrated.failed());
                    return migrated.failed() == 0 ? 0 : 1;
                case AUDIT:
                case RECONCILE:
                    if (!coordinator.hasRegistry()) {
                        log.error("{} requires registry.enabled=true", mode);
                        return 2;
                    }
                    return printReport(mode == Mode.AUDIT ? coordinator.audit() : coordinator.reconcile());
                default:
                    throw new IllegalStateException("Unhandled mode " + mode);
            }
        }
    }

    String validateArguments() {
        if (mode == Mode.INGEST && file == null) {
            return "--file is required in ingest mode";
        }
        if (mode == Mode.INGEST && !new TextFileParser().supports(file)) {
            return "Unsupported file type: " + file;
        }
        if (mode == Mode.SEARCH && (query == null || query.isBlank())) {
            return "--query is required in search mode";
        }
        if (mode == Mode.SEARCH && topK != null && topK <= 0) {
            return "--top-k must be positive";
        }
        if (mode == Mode.DELETE && (source == null || source.isBlank())) {
            return "--source is required in delete mode";
        }
        return null;
    }

    private int testConnection(KnowledgeRuntime runtime) {
        try {
            runtime.vectorStore().ensureCollection(runtime.coordinator().collection());
            System.out.println("Vector store: OK (collection " + runtime.coordinator().collection() + ")");
        } catch (VectorStoreException e) {
            log.error("Vector store check failed", e);
            System.out.println("Vector store: FAILED");
            return 1;
        }
        MetadataRegistry registry = runtime.registry();
        if (registry == null) {
            System.out.println("Registry: disabled");
            return 0;
        }
        try {
            registry.testTable();
            System.out.println("Registry: OK");
            return 0;
        } catch (RegistryUnavailableException e) {
            log.error("Registry check failed", e);
            System.out.println("Registry: FAILED");
            return 1;
        }
    }

    private int ingest(IngestionCoordinator coordinator) throws IOException {
        ParsedDocument document = new TextFileParser().parse(file);
        IngestionResult result = coordinator.ingest(document);
        System.out.println(document.filename() + ": " + result.describe());
        return result.success() ? 0 : 1;
    }

    private int search(KnowledgeRuntime runtime) {
        int limit = topK == null ? runtime.retrieval().defaultLimit() : topK;
        List<SearchResult> results = runtime.retrieval().query(query, limit);
        if (results.isEmpty()) {
            System.out.println("No results.");
        }
        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            System.out.printf(Locale.ROOT, "#%d score=%.4f %s%n", i + 1, result.score(), result.citation());
        }
        return 0;
    }

    private static void printDocuments(List<KnowledgeDocument> documents) {
        if (documents.isEmpty()) {
            System.out.println("No documents.");
        }
        for (KnowledgeDocument document : documents) {
            System.out.printf("%s [%s] chunks=%d added=%s source=%s%n",
                    document.title(),
                    document.type().code(),
                    document.chunkCount(),
                    document.dateAdded() == null ? "unknown" : document.dateAdded(),
                    document.source());
        }
    }

    private static int printReport(ReconciliationReport report) {
        for (RegistryDrift drift : report.drifts()) {
            System.out.printf("%s %s registered=%d actual=%d%n",
                    drift.kind(), drift.source(), drift.registeredCount(), drift.actualCount());
        }
        System.out.printf("documents=%d drifts=%d repaired=%d failed=%d%n",
                report.documentsFound(), report.drifts().size(), report.repaired(), report.failed());
        return report.failed() == 0 ? 0 : 1;
    }
}
