package com.oracle.optmcts.search;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SimulationResultTest {

    @Test
    void matchingAnswerOverridesEverythingElse() {
        SimulationResult result = SimulationResult.builder()
                .score(0.0)
                .feasible(false)
                .error(true)
                .answerMatches(true)
                .build();

        assertEquals(1.0, result.getReward(), 1e-12);
    }

    @Test
    void rewardCombinesFeasibilityScoreAndErrorPenalty() {
        SimulationResult ran = SimulationResult.builder().feasible(true).score(0.5).build();
        SimulationResult crashed = SimulationResult.builder().error(true).score(0.25).build();

        assertEquals(0.1 + 0.8 * 0.5, ran.getReward(), 1e-12);
        assertEquals(0.8 * 0.25 - 0.1, crashed.getReward(), 1e-12);
    }

    @Test
    void rewardIsNotClamped() {
        SimulationResult worst = SimulationResult.builder().error(true).score(0.0).build();
        SimulationResult best = SimulationResult.builder().feasible(true).score(1.0).build();

        assertEquals(-0.1, worst.getReward(), 1e-12);
        assertEquals(0.9, best.getReward(), 1e-12);
    }
}
