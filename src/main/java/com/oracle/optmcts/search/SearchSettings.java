package com.oracle.optmcts.search;

import com.oracle.optmcts.config.OptMctsConfig;
import com.oracle.optmcts.core.RetryPolicy;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable tuning for one search, resolved from configuration and per-request overrides.
 */
@Value
@Builder(toBuilder = true)
public class SearchSettings {

    @Builder.Default
    int iterationBudget = 20;

    @Builder.Default
    double reexpansionThreshold = 0.3;

    @Builder.Default
    double explorationConstant = 2.0;

    @Builder.Default
    int candidatesPerExpansion = 3;

    @Builder.Default
    int maxChildrenPerNode = 5;

    @Builder.Default
    double similarityThreshold = 0.8;

    @Builder.Default
    int judgmentSamples = 3;

    @Builder.Default
    int guidanceWindow = 3;

    @Builder.Default
    double answerTolerance = 0.10;

    @Builder.Default
    double expansionTemperature = 0.7;

    @Builder.Default
    double scoringTemperature = 0.5;

    @Builder.Default
    long modelCallTimeoutSeconds = 120;

    @Builder.Default
    boolean parallelModelCalls = true;

    @Builder.Default
    RetryPolicy modelRetry = RetryPolicy.builder().build();

    @Builder.Default
    RetryPolicy executionRetry = RetryPolicy.immediate(12);

    public static SearchSettings from(OptMctsConfig config) {
        return SearchSettings.builder()
                .iterationBudget(config.getIterationBudget())
                .reexpansionThreshold(config.getReexpansionThreshold())
                .explorationConstant(config.getExplorationConstant())
                .candidatesPerExpansion(config.getCandidatesPerExpansion())
                .maxChildrenPerNode(config.getMaxChildrenPerNode())
                .similarityThreshold(config.getSimilarityThreshold())
                .judgmentSamples(config.getJudgmentSamples())
                .guidanceWindow(config.getGuidanceWindow())
                .answerTolerance(config.getAnswerTolerance())
                .expansionTemperature(config.getExpansionTemperature())
                .scoringTemperature(config.getScoringTemperature())
                .modelCallTimeoutSeconds(config.getModelCallTimeoutSeconds())
                .parallelModelCalls(config.isParallelModelCalls())
                .modelRetry(config.getModelRetry())
                .executionRetry(config.getExecutionRetry())
                .build();
    }
}
