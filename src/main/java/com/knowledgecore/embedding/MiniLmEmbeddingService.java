package com.knowledgecore.embedding;

import java.util.ArrayList;
import java.util.List;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;

/**
 * all-MiniLM-L6-v2 running in-process through ONNX Runtime. Produces 384-dimensional mean-pooled
 * sentence embeddings.
 */
public class MiniLmEmbeddingService implements EmbeddingService {
    public static final int DIMENSION = 384;
    private static final String VERSION = "all-minilm-l6-v2";

    private final EmbeddingModel model;

    MiniLmEmbeddingService(EmbeddingModel model) {
        this.model = model;
    }

    /** Loads the bundled ONNX model and tokenizer. Expensive; call once per process. */
    public static ModelLoader loader() {
        return () -> new MiniLmEmbeddingService(new AllMiniLmL6V2EmbeddingModel());
    }

    @Override
    public float[] embed(String text) {
        return model.embed(text).content().vector();
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        List<TextSegment> segments = new ArrayList<>(texts.size());
        for (String text : texts) {
            segments.add(TextSegment.from(text));
        }
        List<Embedding> embeddings = model.embedAll(segments).content();
        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (Embedding embedding : embeddings) {
            vectors.add(embedding.vector());
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return DIMENSION;
    }

    @Override
    public String version() {
        return VERSION;
    }
}
