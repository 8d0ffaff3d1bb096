package com.oracle.optmcts.core;

public interface GroundTruthOracle {

    /**
     * @param tolerance  relative tolerance, e.g. 0.10 for 10%
     */
    boolean compare(double extractedAnswer, double groundTruth, double tolerance);
}
