package com.oracle.optmcts.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
 * One choice of formulation element in the search tree.
 *
 * <p>A node at layer {@code L} holds the content chosen for layer {@code L}; its children are the
 * alternatives for layer {@code L + 1}. Children may be added after the node has already been
 * visited, so being a leaf is a transient property.</p>
 */
public class FormulationNode {

    private final FormulationLayer layer;
    private final String content;
    private final FormulationNode parent;
    private final List<FormulationNode> children = new ArrayList<>();

    private int visitCount;
    private double valueEstimate;
    private boolean triggerFlag;
    private double localUncertainty;
    private String triggerExplanation = "";
    private NodeState state = NodeState.UNEXPANDED;

    // layer-6 bookkeeping
    private SimulationResult lastResult;
    private double bestReward = Double.NEGATIVE_INFINITY;

    private FormulationNode(FormulationLayer layer, String content, FormulationNode parent) {
        this.layer = layer;
        this.content = content == null ? "" : content;
        this.parent = parent;
    }

    public static FormulationNode root() {
        return new FormulationNode(FormulationLayer.ROOT, "", null);
    }

    /**
     * Attach a new alternative for the next layer.
     */
    public synchronized FormulationNode addChild(String childContent) {
        if (layer.isTerminal()) {
            throw new IllegalStateException("Constraints nodes cannot have children");
        }
        FormulationNode child = new FormulationNode(layer.next(), childContent, this);
        children.add(child);
        if (state == NodeState.UNEXPANDED) {
            state = NodeState.EXPANDED;
        }
        return child;
    }

    /**
     * Incremental confidence-weighted mean update.
     */
    public synchronized void recordVisit(double reward, double confidence) {
        visitCount++;
        valueEstimate += confidence * (reward - valueEstimate) / visitCount;
    }

    public synchronized void applySignal(LayerSignal signal) {
        triggerFlag = signal.isTrigger();
        localUncertainty = Math.max(0.0, signal.getLocalUncertainty());
        triggerExplanation = signal.getExplanation() == null ? "" : signal.getExplanation();
        if (triggerFlag && !layer.isTerminal() && !isRoot()) {
            state = NodeState.PENDING_REEXPANSION;
        } else if (state == NodeState.PENDING_REEXPANSION) {
            state = children.isEmpty() ? NodeState.UNEXPANDED : NodeState.EXPANDED;
        }
    }

    /**
     * Consume a pending re-expansion once new alternatives have been requested.
     */
    public synchronized void markExpansionAttempted() {
        state = children.isEmpty() ? NodeState.UNEXPANDED : NodeState.EXPANDED;
    }

    public synchronized void recordSimulation(SimulationResult result) {
        lastResult = result;
        bestReward = Math.max(bestReward, result.getReward());
    }

    synchronized void setStatistics(int visits, double value) {
        this.visitCount = visits;
        this.valueEstimate = value;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isComplete() {
        return layer.isTerminal();
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Nodes from the root down to this node, inclusive.
     */
    public List<FormulationNode> pathFromRoot() {
        LinkedList<FormulationNode> path = new LinkedList<>();
        for (FormulationNode n = this; n != null; n = n.parent) {
            path.addFirst(n);
        }
        return path;
    }

    public int subtreeSize() {
        int size = 1;
        for (FormulationNode child : getChildren()) {
            size += child.subtreeSize();
        }
        return size;
    }

    public FormulationLayer getLayer() {
        return layer;
    }

    public String getContent() {
        return content;
    }

    public FormulationNode getParent() {
        return parent;
    }

    public synchronized List<FormulationNode> getChildren() {
        return Collections.unmodifiableList(new ArrayList<>(children));
    }

    public synchronized int getVisitCount() {
        return visitCount;
    }

    public synchronized double getValueEstimate() {
        return valueEstimate;
    }

    public synchronized boolean isTriggerFlag() {
        return triggerFlag;
    }

    public synchronized double getLocalUncertainty() {
        return localUncertainty;
    }

    public synchronized String getTriggerExplanation() {
        return triggerExplanation;
    }

    public synchronized NodeState getState() {
        return state;
    }

    public synchronized SimulationResult getLastResult() {
        return lastResult;
    }

    public synchronized double getBestReward() {
        return bestReward;
    }

    @Override
    public String toString() {
        return String.format("FormulationNode[%s N=%d Q=%.3f %s]", layer, visitCount, valueEstimate, state);
    }
}
