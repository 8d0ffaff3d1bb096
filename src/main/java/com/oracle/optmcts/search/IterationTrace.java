package com.oracle.optmcts.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What happened in one search iteration, for logs and the verbose API response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IterationTrace {

    private int iteration;

    private IterationOutcome outcome;

    /** Layer that received new alternatives, or null when no expansion happened. */
    private FormulationLayer expansionLayer;

    private boolean reexpansion;

    private int childrenAdded;

    private int childrenPruned;

    @Builder.Default
    private Map<String, String> path = new LinkedHashMap<>();

    private Double reward;

    private Double confidence;

    private Double extractedAnswer;

    @Builder.Default
    private Map<String, Boolean> triggers = new LinkedHashMap<>();

    private long durationMs;

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Iteration ").append(iteration).append(": ").append(outcome);
        if (expansionLayer != null) {
            sb.append(reexpansion ? ", re-expanded " : ", expanded ").append(expansionLayer.getKey())
              .append(" (+").append(childrenAdded).append(", pruned ").append(childrenPruned).append(")");
        }
        if (reward != null) {
            sb.append(String.format(", R=%.3f", reward));
        }
        if (confidence != null) {
            sb.append(String.format(", rho=%.3f", confidence));
        }
        if (extractedAnswer != null) {
            sb.append(", answer=").append(extractedAnswer);
        }
        sb.append(", ").append(durationMs).append("ms");
        return sb.toString();
    }
}
