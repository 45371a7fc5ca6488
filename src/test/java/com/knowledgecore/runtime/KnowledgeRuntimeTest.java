package com.knowledgecore.runtime;

import org.junit.jupiter.api.Test;

import com.knowledgecore.embedding.EmbeddingGenerator;
import com.knowledgecore.embedding.EmbeddingService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class KnowledgeRuntimeTest {

    @Test
    void shouldBuildHashingModelFromConfig() throws Exception {
        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();
        config.setProvider("Hashing");
        config.setDimension(96);

        EmbeddingService service = KnowledgeRuntime.modelLoader(config).load();

        assertEquals(96, service.dimension());
        assertEquals(96, service.embed("hello").length);
    }

    @Test
    void shouldRejectUnknownProvider() {
        AppConfig.EmbeddingConfig config = new AppConfig.EmbeddingConfig();
        config.setProvider("word2vec");

        assertThrows(IllegalArgumentException.class, () -> KnowledgeRuntime.modelLoader(config));
    }

    @Test
    void shouldWireComponentsWithoutContactingServices() {
        AppConfig config = new AppConfig();
        config.getEmbedding().setProvider("hashing");
        config.getEmbedding().setDimension(32);

        try (KnowledgeRuntime runtime = KnowledgeRuntime.start(config)) {
            assertNotNull(runtime.coordinator());
            assertNull(runtime.registry());
            assertEquals(32, runtime.vectorStore().vectorSize());
            assertEquals(5, runtime.retrieval().defaultLimit());
            assertEquals(EmbeddingGenerator.State.UNINITIALIZED, runtime.embeddingGenerator().state());
        }
    }
}
