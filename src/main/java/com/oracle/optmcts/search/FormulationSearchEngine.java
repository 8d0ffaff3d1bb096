package com.oracle.optmcts.search;

import com.oracle.optmcts.core.StructuredOutputParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Drives the search for one problem: select, expand until a complete formulation is reached,
 * simulate, evaluate, backpropagate.
 *
 * <p>Every call builds its own tree and knowledge base, so concurrent calls are independent.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FormulationSearchEngine {

    private final Selector selector;
    private final Expander expander;
    private final Simulator simulator;
    private final Evaluator evaluator;
    private final Backpropagator backpropagator;

    public SolveResult solve(String problem, Double groundTruth, SearchSettings settings) {
        SearchContext context = new SearchContext(problem, groundTruth, settings);
        log.info("Starting formulation search: budget={}, eta={}, groundTruth={}",
                settings.getIterationBudget(), settings.getReexpansionThreshold(), groundTruth);

        List<IterationTrace> trace = new ArrayList<>();
        FormulationNode solvedLeaf = null;

        for (int i = 1; i <= settings.getIterationBudget(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Search interrupted before iteration {}", i);
                break;
            }
            IterationResult iteration;
            try {
                iteration = iterate(context, i);
            } catch (CancellationException e) {
                Thread.currentThread().interrupt();
                log.warn("Search cancelled during iteration {}: {}", i, e.getMessage());
                break;
            }
            trace.add(iteration.trace);
            log.info("{}, nodes={}", iteration.trace.summary(), context.getRoot().subtreeSize() - 1);

            if (iteration.trace.getOutcome() == IterationOutcome.SOLVED) {
                solvedLeaf = iteration.leaf;
                break;
            }
        }

        return buildResult(context, solvedLeaf, trace);
    }

    IterationResult iterate(SearchContext context, int number) {
        long start = System.currentTimeMillis();
        SearchSettings settings = context.getSettings();
        IterationTrace.IterationTraceBuilder trace = IterationTrace.builder().iteration(number);

        Selection selection = selector.select(context);
        boolean firstExpansion = true;
        int added = 0;
        int pruned = 0;
        while (selection.needsExpansion()) {
            FormulationNode point = selection.getExpansionPoint();
            ExpansionOutcome expansion = expander.expand(context, point);
            if (firstExpansion) {
                trace.expansionLayer(expansion.getTargetLayer()).reexpansion(expansion.isReexpansion());
                firstExpansion = false;
            }
            added += expansion.getAdded().size();
            pruned += expansion.getPruned();
            if (!point.hasChildren()) {
                return new IterationResult(trace
                        .outcome(IterationOutcome.NO_OP)
                        .childrenAdded(added)
                        .childrenPruned(pruned)
                        .path(abbreviatedPath(point.pathFromRoot()))
                        .durationMs(System.currentTimeMillis() - start)
                        .build(), null);
            }
            selection = selector.selectFrom(selection, settings);
        }
        trace.childrenAdded(added).childrenPruned(pruned);

        List<FormulationNode> path = selection.getPath();
        FormulationNode leaf = selection.last();
        SimulationResult result = simulator.simulate(context, path);

        Rollout rollout;
        if (result.isAnswerMatches()) {
            rollout = Rollout.builder().result(result).confidence(1.0).build();
        } else {
            Evaluation evaluation = evaluator.evaluate(context, path, result);
            result.setScore(evaluation.getMeanScore());
            rollout = Rollout.builder()
                    .result(result)
                    .evaluation(evaluation)
                    .confidence(evaluation.getConfidence())
                    .build();
        }
        backpropagator.backpropagate(context, path, rollout);

        return new IterationResult(trace
                .outcome(result.isAnswerMatches() ? IterationOutcome.SOLVED : IterationOutcome.SIMULATED)
                .path(abbreviatedPath(path))
                .reward(rollout.getReward())
                .confidence(rollout.getConfidence())
                .extractedAnswer(result.getExtractedAnswer())
                .triggers(triggers(rollout.getEvaluation()))
                .durationMs(System.currentTimeMillis() - start)
                .build(), leaf);
    }

    private SolveResult buildResult(SearchContext context, FormulationNode solvedLeaf, List<IterationTrace> trace) {
        FormulationNode best = solvedLeaf != null ? solvedLeaf : bestVisitedLeaf(context.getRoot());
        SolveResult.SolveResultBuilder result = SolveResult.builder()
                .iterationsRun(trace.size())
                .nodesCreated(context.getRoot().subtreeSize() - 1)
                .guidanceEntries(context.getKnowledgeBase().totalSize())
                .trace(trace);

        if (best == null) {
            log.warn("No complete formulation was simulated in {} iterations", trace.size());
            return result.status(SolveStatus.NO_COMPLETE_FORMULATION).build();
        }

        List<FormulationNode> path = best.pathFromRoot();
        SimulationResult last = best.getLastResult();
        SolveStatus status = solvedLeaf != null ? SolveStatus.SOLVED : SolveStatus.BEST_EFFORT;
        log.info("Search finished: status={}, Q={}, bestReward={}, iterations={}",
                status, String.format("%.3f", best.getValueEstimate()),
                String.format("%.3f", best.getBestReward()), trace.size());
        return result
                .status(status)
                .bestFormulation(Formulations.byLayer(path))
                .bestFormulationText(Formulations.render(path))
                .bestReward(best.getBestReward())
                .bestValueEstimate(best.getValueEstimate())
                .extractedAnswer(last == null ? null : last.getExtractedAnswer())
                .code(last == null ? null : last.getCode())
                .build();
    }

    /**
     * Highest Q among visited complete formulations; ties go to the higher best reward, then the first found.
     */
    static FormulationNode bestVisitedLeaf(FormulationNode root) {
        FormulationNode best = null;
        Deque<FormulationNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            FormulationNode node = stack.pop();
            if (node.isComplete()) {
                if (node.getVisitCount() > 0 && isBetter(node, best)) {
                    best = node;
                }
                continue;
            }
            List<FormulationNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return best;
    }

    private static boolean isBetter(FormulationNode candidate, FormulationNode best) {
        if (best == null) {
            return true;
        }
        int byValue = Double.compare(candidate.getValueEstimate(), best.getValueEstimate());
        if (byValue != 0) {
            return byValue > 0;
        }
        return Double.compare(candidate.getBestReward(), best.getBestReward()) > 0;
    }

    private static Map<String, String> abbreviatedPath(List<FormulationNode> path) {
        Map<String, String> abbreviated = new LinkedHashMap<>();
        Formulations.byLayer(path).forEach((layer, content) ->
                abbreviated.put(layer, StructuredOutputParser.abbreviate(content, 80)));
        return abbreviated;
    }

    private static Map<String, Boolean> triggers(Evaluation evaluation) {
        Map<String, Boolean> triggers = new LinkedHashMap<>();
        if (evaluation == null) {
            return triggers;
        }
        evaluation.getSignals().forEach((layer, signal) -> triggers.put(layer.getKey(), signal.isTrigger()));
        return triggers;
    }

    static final class IterationResult {
        final IterationTrace trace;
        final FormulationNode leaf;

        IterationResult(IterationTrace trace, FormulationNode leaf) {
            this.trace = trace;
            this.leaf = leaf;
        }
    }
}
