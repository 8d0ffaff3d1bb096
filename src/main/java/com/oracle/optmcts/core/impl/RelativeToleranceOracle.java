package com.oracle.optmcts.core.impl;

import com.oracle.optmcts.core.GroundTruthOracle;
import org.springframework.stereotype.Component;

@Component
public class RelativeToleranceOracle implements GroundTruthOracle {

    private static final double ZERO_TRUTH = 1e-8;
    private static final double ZERO_TOLERANCE = 1e-4;

    @Override
    public boolean compare(double extractedAnswer, double groundTruth, double tolerance) {
        if (!Double.isFinite(extractedAnswer) || !Double.isFinite(groundTruth)) {
            return false;
        }
        // relative error is meaningless around zero
        if (Math.abs(groundTruth) <= ZERO_TRUTH) {
            return Math.abs(extractedAnswer - groundTruth) < ZERO_TOLERANCE;
        }
        return Math.abs(extractedAnswer - groundTruth) / Math.abs(groundTruth) < tolerance;
    }
}
