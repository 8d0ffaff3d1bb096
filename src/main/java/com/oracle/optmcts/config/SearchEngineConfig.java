package com.oracle.optmcts.config;

import com.oracle.optmcts.service.EmbeddingService;
import com.oracle.optmcts.strategy.EmbeddingSimilarity;
import com.oracle.optmcts.strategy.LexicalSimilarity;
import com.oracle.optmcts.strategy.SimilarityStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class SearchEngineConfig {

    @Bean
    public SimilarityStrategy similarityStrategy(OptMctsConfig config, EmbeddingService embeddingService) {
        String kind = config.getSimilarity() == null ? "lexical" : config.getSimilarity().toLowerCase(Locale.ROOT);
        log.info("Using {} similarity for candidate pruning (threshold {})", kind, config.getSimilarityThreshold());
        return switch (kind) {
            case "lexical" -> new LexicalSimilarity();
            case "embedding" -> new EmbeddingSimilarity(embeddingService);
            default -> throw new IllegalStateException(
                    "Unknown optmcts.similarity '" + config.getSimilarity() + "' (expected lexical or embedding)");
        };
    }

    /**
     * Shared pool for concurrent expansion candidates and repeated judgments.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService modelCallExecutor(OptMctsConfig config) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread t = new Thread(runnable, "optmcts-model-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, config.getModelCallThreads()), threadFactory);
    }
}
