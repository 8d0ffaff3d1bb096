package com.oracle.optmcts.search;

import lombok.Getter;

import java.util.Optional;

/**
 * Everything owned by one {@code solve()} call: the tree, its knowledge base and settings.
 * Never shared between problems.
 */
@Getter
public class SearchContext {

    private final String problem;
    private final Double groundTruth;
    private final SearchSettings settings;
    private final FormulationNode root = FormulationNode.root();
    private final KnowledgeBase knowledgeBase = new KnowledgeBase();

    public SearchContext(String problem, Double groundTruth, SearchSettings settings) {
        if (problem == null || problem.isBlank()) {
            throw new IllegalArgumentException("Problem statement cannot be blank");
        }
        this.problem = problem;
        this.groundTruth = groundTruth;
        this.settings = settings;
    }

    public Optional<Double> groundTruth() {
        return Optional.ofNullable(groundTruth);
    }
}
