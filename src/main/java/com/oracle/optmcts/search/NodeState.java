package com.oracle.optmcts.search;

public enum NodeState {
    UNEXPANDED,
    EXPANDED,
    // evaluator flagged the node; selection stops here once uncertainty exceeds the threshold
    PENDING_REEXPANSION
}
