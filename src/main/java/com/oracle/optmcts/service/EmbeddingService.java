package com.oracle.optmcts.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

    private final ObjectProvider<EmbeddingModel> embeddingModels;

    /**
     * Embedding of a formulation fragment. Fragments recur across sibling comparisons, so
     * vectors are cached by text.
     */
    @Cacheable(value = "embeddings", key = "#text")
    public float[] embed(String text) {
        EmbeddingModel model = embeddingModels.orderedStream()
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "No EmbeddingModel bean available. Configure an embedding provider "
                        + "(e.g. spring.ai.openai.api-key) or set optmcts.similarity=lexical."));
        log.debug("Embedding {} chars", text.length());
        return model.embed(text);
    }
}
