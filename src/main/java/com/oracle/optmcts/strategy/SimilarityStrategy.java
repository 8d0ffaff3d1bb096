package com.oracle.optmcts.strategy;

/**
 * Semantic closeness of two formulation fragments, used to prune redundant alternatives.
 */
public interface SimilarityStrategy {

    /**
     * @return a value in [0, 1]; 1 means interchangeable
     */
    double similarity(String a, String b);
}
