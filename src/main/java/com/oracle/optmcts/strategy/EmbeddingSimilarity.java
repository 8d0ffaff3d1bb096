package com.oracle.optmcts.strategy;

import com.oracle.optmcts.service.EmbeddingService;
import lombok.RequiredArgsConstructor;

/**
 * Cosine similarity of model embeddings, clamped to [0, 1].
 */
@RequiredArgsConstructor
public class EmbeddingSimilarity implements SimilarityStrategy {

    private final EmbeddingService embeddingService;

    @Override
    public double similarity(String a, String b) {
        float[] va = embeddingService.embed(a == null ? "" : a);
        float[] vb = embeddingService.embed(b == null ? "" : b);
        if (va.length == 0 || va.length != vb.length) {
            return 0.0;
        }
        double dot = 0.0;
        double na = 0.0;
        double nb = 0.0;
        for (int i = 0; i < va.length; i++) {
            dot += va[i] * vb[i];
            na += va[i] * va[i];
            nb += vb[i] * vb[i];
        }
        if (na == 0.0 || nb == 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, dot / Math.sqrt(na * nb)));
    }
}
