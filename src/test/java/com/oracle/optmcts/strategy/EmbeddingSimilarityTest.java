package com.oracle.optmcts.strategy;

import com.oracle.optmcts.service.EmbeddingService;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EmbeddingSimilarityTest {

    private static final Map<String, float[]> VECTORS = Map.of(
            "lp", new float[]{1f, 0f},
            "linear program", new float[]{1f, 0f},
            "milp", new float[]{0f, 1f},
            "opposite", new float[]{-1f, 0f});

    private final EmbeddingService embeddings = new EmbeddingService(null) {
        @Override
        public float[] embed(String text) {
            return VECTORS.getOrDefault(text, new float[0]);
        }
    };

    private final EmbeddingSimilarity similarity = new EmbeddingSimilarity(embeddings);

    @Test
    void cosineOfEmbeddings() {
        assertEquals(1.0, similarity.similarity("lp", "linear program"), 1e-6);
        assertEquals(0.0, similarity.similarity("lp", "milp"), 1e-6);
    }

    @Test
    void negativeCosineIsClampedAndMissingVectorsAreDissimilar() {
        assertEquals(0.0, similarity.similarity("lp", "opposite"), 1e-6);
        assertEquals(0.0, similarity.similarity("lp", "unknown"), 1e-6);
    }
}
