package com.oracle.optmcts.search;

import com.oracle.optmcts.core.LanguageModelClient;
import com.oracle.optmcts.core.Retries;
import com.oracle.optmcts.core.StructuredOutputParser;
import com.oracle.optmcts.service.PromptTemplateService;
import com.oracle.optmcts.strategy.SimilarityStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Grows alternatives for the layer below an expansion point.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Expander {

    private final LanguageModelClient languageModel;
    private final PromptTemplateService promptTemplateService;
    private final StructuredOutputParser outputParser;
    private final SimilarityStrategy similarity;
    private final ModelCallFanOut fanOut;

    public ExpansionOutcome expand(SearchContext context, FormulationNode node) {
        if (node.isComplete()) {
            throw new IllegalArgumentException("Cannot expand a complete formulation");
        }
        SearchSettings settings = context.getSettings();
        FormulationLayer target = node.getLayer().next();
        boolean reexpansion = node.getState() == NodeState.PENDING_REEXPANSION;

        if (node.getChildren().size() >= settings.getMaxChildrenPerNode()) {
            log.info("Node at {} already holds {} alternatives, skipping expansion",
                    node.getLayer(), node.getChildren().size());
            node.markExpansionAttempted();
            return ExpansionOutcome.builder()
                    .targetLayer(target)
                    .reexpansion(reexpansion)
                    .build();
        }

        String prompt = promptTemplateService.createElementPrompt(
                context.getProblem(),
                Formulations.render(node.pathFromRoot()),
                target,
                context.getKnowledgeBase().recent(target, settings.getGuidanceWindow()),
                reexpansion ? node.getTriggerExplanation() : null);
        log.debug("Expansion prompt for {}:\n{}", target, prompt);

        List<Callable<String>> calls = new ArrayList<>();
        for (int i = 0; i < settings.getCandidatesPerExpansion(); i++) {
            calls.add(() -> Retries.withRetry(settings.getModelRetry(), "Generate " + target.getKey(),
                    () -> outputParser.parseText(languageModel.complete(prompt, settings.getExpansionTemperature()))));
        }
        List<String> candidates = fanOut.invokeAll("Generate " + target.getKey(), calls, settings).stream()
                .flatMap(Optional::stream)
                .toList();

        List<FormulationNode> added = attachDistinct(node, candidates, settings);
        node.markExpansionAttempted();

        ExpansionOutcome outcome = ExpansionOutcome.builder()
                .targetLayer(target)
                .reexpansion(reexpansion)
                .generated(candidates.size())
                .pruned(candidates.size() - added.size())
                .added(added)
                .build();

        if (outcome.isNoOp()) {
            log.info("Expansion at {} produced no new {} alternatives ({} generated)",
                    node.getLayer(), target.getKey(), candidates.size());
        }
        return outcome;
    }

    /**
     * Add candidates in order, skipping any too similar to a sibling (including ones added here).
     */
    List<FormulationNode> attachDistinct(FormulationNode node, List<String> candidates, SearchSettings settings) {
        List<String> siblings = new ArrayList<>();
        for (FormulationNode child : node.getChildren()) {
            siblings.add(child.getContent());
        }
        List<FormulationNode> added = new ArrayList<>();
        for (String candidate : candidates) {
            if (siblings.size() >= settings.getMaxChildrenPerNode()) {
                log.debug("Node at {} already holds {} alternatives", node.getLayer(), siblings.size());
                break;
            }
            double maxSimilarity = maxSimilarity(candidate, siblings);
            if (maxSimilarity > settings.getSimilarityThreshold()) {
                log.debug("Pruned {} candidate (similarity {})", node.getLayer().next().getKey(),
                        String.format("%.3f", maxSimilarity));
                continue;
            }
            added.add(node.addChild(candidate));
            siblings.add(candidate);
        }
        return Collections.unmodifiableList(added);
    }

    private double maxSimilarity(String candidate, List<String> siblings) {
        double max = 0.0;
        for (String sibling : siblings) {
            max = Math.max(max, similarity.similarity(candidate, sibling));
        }
        return max;
    }
}
