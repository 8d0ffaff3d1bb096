package com.oracle.optmcts.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pushes a rollout back up its path: visit statistics on every node, evaluator signals on the
 * formulation elements, and guidance into the knowledge base.
 */
@Component
@Slf4j
public class Backpropagator {

    /**
     * @return number of guidance entries appended to the knowledge base
     */
    public int backpropagate(SearchContext context, List<FormulationNode> path, Rollout rollout) {
        double reward = rollout.getReward();
        double confidence = rollout.getConfidence();
        Evaluation evaluation = rollout.getEvaluation();

        int appended = 0;
        for (FormulationNode node : path) {
            node.recordVisit(reward, confidence);
            if (node.isRoot() || evaluation == null) {
                continue;
            }
            LayerSignal signal = evaluation.signalFor(node.getLayer());
            if (signal == null) {
                continue;
            }
            node.applySignal(signal);
            if (signal.isTrigger() && context.getKnowledgeBase().append(node.getLayer(), signal.getGuidance())) {
                appended++;
            }
        }

        FormulationNode leaf = path.get(path.size() - 1);
        if (leaf.isComplete()) {
            leaf.recordSimulation(rollout.getResult());
        }
        log.debug("Backpropagated R={} rho={} over {} nodes, {} guidance entries added",
                String.format("%.3f", reward), String.format("%.3f", confidence), path.size(), appended);
        return appended;
    }
}
