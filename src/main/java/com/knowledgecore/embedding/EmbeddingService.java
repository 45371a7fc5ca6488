package com.knowledgecore.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * A loaded embedding model.
 */
public interface EmbeddingService {
    float[] embed(String text);

    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    int dimension();

    String version();
}
