package com.oracle.optmcts.search;

public enum SolveStatus {
    SOLVED,
    BEST_EFFORT,
    NO_COMPLETE_FORMULATION
}
