package com.oracle.optmcts.core.impl;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelativeToleranceOracleTest {

    private final RelativeToleranceOracle oracle = new RelativeToleranceOracle();

    @Test
    void acceptsAnswersWithinRelativeTolerance() {
        assertTrue(oracle.compare(105.0, 100.0, 0.10));
        assertTrue(oracle.compare(-95.0, -100.0, 0.10));
        assertFalse(oracle.compare(110.0, 100.0, 0.10));
        assertFalse(oracle.compare(50.0, 100.0, 0.10));
    }

    @Test
    void usesAbsoluteToleranceAroundZero() {
        assertTrue(oracle.compare(0.00005, 0.0, 0.10));
        assertFalse(oracle.compare(0.001, 0.0, 0.10));
    }

    @Test
    void nonFiniteAnswersNeverMatch() {
        assertFalse(oracle.compare(Double.NaN, 1.0, 0.10));
        assertFalse(oracle.compare(Double.POSITIVE_INFINITY, 1.0, 0.10));
    }
}
