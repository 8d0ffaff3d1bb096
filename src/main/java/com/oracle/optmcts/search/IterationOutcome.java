package com.oracle.optmcts.search;

public enum IterationOutcome {
    /** A complete formulation was simulated and backpropagated. */
    SIMULATED,
    /** Expansion left a node without children; nothing was simulated. */
    NO_OP,
    /** The simulated answer matched ground truth and the search stopped. */
    SOLVED
}
