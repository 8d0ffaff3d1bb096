package com.oracle.optmcts.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * UCB tree walk that may stop at an internal node flagged for re-expansion.
 */
@Component
@Slf4j
public class Selector {

    public Selection select(SearchContext context) {
        List<FormulationNode> path = new ArrayList<>();
        path.add(context.getRoot());
        return descend(context.getRoot(), path, context.getSettings());
    }

    /**
     * Resume descent from the expansion point of an earlier selection, once it has been expanded.
     */
    public Selection selectFrom(Selection previous, SearchSettings settings) {
        if (!previous.needsExpansion()) {
            return previous;
        }
        List<FormulationNode> path = new ArrayList<>(previous.getPath());
        return descend(previous.getExpansionPoint(), path, settings);
    }

    private Selection descend(FormulationNode node, List<FormulationNode> path, SearchSettings settings) {
        while (!node.isComplete()) {
            if (isReexpansionDue(node, settings.getReexpansionThreshold())) {
                log.debug("Re-expansion at {} (uncertainty {})", node.getLayer(), node.getLocalUncertainty());
                return new Selection(path, node);
            }
            if (!node.hasChildren()) {
                return new Selection(path, node);
            }
            node = bestChild(node, settings.getExplorationConstant());
            path.add(node);
        }
        return new Selection(path, null);
    }

    static boolean isReexpansionDue(FormulationNode node, double threshold) {
        return node.getState() == NodeState.PENDING_REEXPANSION
                && node.getLocalUncertainty() > threshold;
    }

    /**
     * First never-visited child in order, otherwise the highest UCB; ties keep the earlier child.
     */
    static FormulationNode bestChild(FormulationNode parent, double explorationConstant) {
        List<FormulationNode> children = parent.getChildren();
        for (FormulationNode child : children) {
            if (child.getVisitCount() == 0) {
                return child;
            }
        }
        FormulationNode best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (FormulationNode child : children) {
            double score = ucb(child, parent.getVisitCount(), explorationConstant);
            if (best == null || score > bestScore) {
                best = child;
                bestScore = score;
            }
        }
        return best;
    }

    static double ucb(FormulationNode child, int parentVisits, double explorationConstant) {
        if (child.getVisitCount() == 0) {
            return Double.POSITIVE_INFINITY;
        }
        double logParent = Math.log(Math.max(1, parentVisits));
        return child.getValueEstimate()
                + explorationConstant * Math.sqrt(2.0 * logParent / child.getVisitCount());
    }
}
