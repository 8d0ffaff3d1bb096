package com.oracle.optmcts.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationResult {

    static final double FEASIBLE_WEIGHT = 0.1;
    static final double SCORE_WEIGHT = 0.8;
    static final double ERROR_PENALTY = 0.1;
    static final double VERIFIED_REWARD = 1.0;

    private String code;

    private String output;

    private String errorMessage;

    /** The program ran to completion. */
    private boolean feasible;

    /** The program crashed or timed out. */
    private boolean error;

    private boolean timedOut;

    /** Model-judged quality in [0, 1]. */
    private double score;

    private Double extractedAnswer;

    private boolean answerMatches;

    private int attempts;

    /**
     * {@code 0.1·feasible + 0.8·score − 0.1·error}, or 1.0 whenever the answer matched ground truth.
     */
    public double getReward() {
        if (answerMatches) {
            return VERIFIED_REWARD;
        }
        return FEASIBLE_WEIGHT * (feasible ? 1 : 0)
                + SCORE_WEIGHT * score
                - ERROR_PENALTY * (error ? 1 : 0);
    }
}
