package com.oracle.optmcts.strategy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LexicalSimilarityTest {

    private final LexicalSimilarity similarity = new LexicalSimilarity();

    @Test
    void identicalTextIsFullySimilar() {
        assertEquals(1.0, similarity.similarity("Minimize total cost", "minimize TOTAL cost."), 1e-12);
    }

    @Test
    void disjointTextIsDissimilar() {
        assertEquals(0.0, similarity.similarity("binary assignment", "continuous flow"), 1e-12);
    }

    @Test
    void partialOverlapIsInBetween() {
        double s = similarity.similarity("x_ij binary for job i on machine j", "y_j continuous for machine j");

        assertTrue(s > 0.0);
        assertTrue(s < 0.8);
    }

    @Test
    void onlyTheLeadingCharactersAreCompared() {
        LexicalSimilarity shortPrefix = new LexicalSimilarity(10);

        assertEquals(1.0, shortPrefix.similarity("same start then apples", "same start then oranges"), 1e-12);
    }

    @Test
    void emptyInputs() {
        assertEquals(1.0, similarity.similarity("", "  "), 1e-12);
        assertEquals(0.0, similarity.similarity("", "linear"), 1e-12);
        assertEquals(0.0, similarity.similarity("---", "+++"), 1e-12);
    }
}
