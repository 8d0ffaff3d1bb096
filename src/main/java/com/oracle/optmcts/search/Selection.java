package com.oracle.optmcts.search;

import lombok.Value;

import java.util.List;

/**
 * A path from the root and, when descent stopped early, the node that must grow new children.
 */
@Value
public class Selection {

    List<FormulationNode> path;

    FormulationNode expansionPoint;

    public Selection(List<FormulationNode> path, FormulationNode expansionPoint) {
        this.path = List.copyOf(path);
        this.expansionPoint = expansionPoint;
    }

    public boolean needsExpansion() {
        return expansionPoint != null;
    }

    public FormulationNode last() {
        return path.get(path.size() - 1);
    }

    public boolean reachesTerminal() {
        return !needsExpansion() && last().isComplete();
    }
}
