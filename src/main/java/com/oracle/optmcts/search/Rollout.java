package com.oracle.optmcts.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of simulating one complete formulation: the scored result and the judgments behind it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Rollout {

    private SimulationResult result;

    /** Absent when a verified answer made judging unnecessary. */
    private Evaluation evaluation;

    private double confidence;

    public double getReward() {
        return result.getReward();
    }
}
