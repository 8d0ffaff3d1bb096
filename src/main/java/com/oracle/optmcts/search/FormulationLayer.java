package com.oracle.optmcts.search;

import java.util.Arrays;
import java.util.List;

/**
 * The fixed stages of a mathematical formulation, in tree order.
 * ROOT is the empty layer above the first real element.
 */
public enum FormulationLayer {

    ROOT(0, "root", "Root"),
    TYPE(1, "type", "Type"),
    SETS(2, "sets", "Sets"),
    PARAMETERS(3, "parameters", "Parameters"),
    VARIABLES(4, "variables", "Variables"),
    OBJECTIVE(5, "objective", "Objective"),
    CONSTRAINTS(6, "constraints", "Constraints");

    public static final int DEPTH = 6;

    private final int depth;
    private final String key;
    private final String displayName;

    FormulationLayer(int depth, String key, String displayName) {
        this.depth = depth;
        this.key = key;
        this.displayName = displayName;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Lower-case key used in model prompts and JSON payloads.
     */
    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == CONSTRAINTS;
    }

    public FormulationLayer next() {
        if (isTerminal()) {
            throw new IllegalStateException("No layer below " + this);
        }
        return values()[ordinal() + 1];
    }

    /**
     * The six element layers, excluding ROOT.
     */
    public static List<FormulationLayer> elements() {
        return Arrays.asList(values()).subList(1, values().length);
    }

    public static FormulationLayer ofDepth(int depth) {
        if (depth < 0 || depth > DEPTH) {
            throw new IllegalArgumentException("Layer depth out of range: " + depth);
        }
        return values()[depth];
    }
}
