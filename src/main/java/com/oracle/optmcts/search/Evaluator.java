package com.oracle.optmcts.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.oracle.optmcts.core.LanguageModelClient;
import com.oracle.optmcts.core.ModelOutputException;
import com.oracle.optmcts.core.Retries;
import com.oracle.optmcts.core.StructuredOutputParser;
import com.oracle.optmcts.service.PromptTemplateService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Asks the model to judge an assembled solution K times and folds the judgments into a
 * confidence and per-layer revision signals. Read-only with respect to the tree.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Evaluator {

    static final double MAX_SCORE = 100.0;
    static final double UNCERTAINTY_SCALE = 50.0;

    private final LanguageModelClient languageModel;
    private final PromptTemplateService promptTemplateService;
    private final StructuredOutputParser outputParser;
    private final ModelCallFanOut fanOut;

    public Evaluation evaluate(SearchContext context, List<FormulationNode> path, SimulationResult result) {
        SearchSettings settings = context.getSettings();
        String prompt = promptTemplateService.createJudgmentPrompt(
                context.getProblem(),
                Formulations.render(path),
                result.isFeasible(),
                StructuredOutputParser.abbreviate(result.getOutput(), 2000),
                result.getErrorMessage() == null ? "" : StructuredOutputParser.abbreviate(result.getErrorMessage(), 1000));
        log.debug("Judgment prompt:\n{}", prompt);

        List<Callable<Judgment>> calls = new ArrayList<>();
        for (int i = 0; i < settings.getJudgmentSamples(); i++) {
            calls.add(() -> Retries.withRetry(settings.getModelRetry(), "Judge solution",
                    () -> parseJudgment(outputParser.parseObject(
                            languageModel.complete(prompt, settings.getScoringTemperature())))));
        }
        List<Optional<Judgment>> outcomes = fanOut.invokeAll("Judge solution", calls, settings);

        List<Judgment> judgments = outcomes.stream().flatMap(Optional::stream).toList();
        boolean degraded = judgments.size() < outcomes.size();
        Evaluation evaluation = aggregate(judgments, degraded);
        if (degraded) {
            log.warn("Degraded evaluation: {}/{} judgments obtained, confidence forced to 0",
                    judgments.size(), outcomes.size());
        }
        return evaluation;
    }

    Evaluation aggregate(List<Judgment> judgments, boolean degraded) {
        double[] overall = judgments.stream().mapToDouble(Judgment::getScore).toArray();
        double globalUncertainty = uncertainty(overall);
        double meanScore = overall.length == 0 ? 0.0 : StatUtils.mean(overall) / MAX_SCORE;

        Map<FormulationLayer, LayerSignal> signals = new EnumMap<>(FormulationLayer.class);
        if (!judgments.isEmpty()) {
            for (FormulationLayer layer : FormulationLayer.elements()) {
                signals.put(layer, signalFor(layer, judgments));
            }
        }

        List<Double> scores = new ArrayList<>();
        for (double s : overall) {
            scores.add(s);
        }
        return Evaluation.builder()
                .scores(scores)
                .meanScore(meanScore)
                .globalUncertainty(globalUncertainty)
                .confidence(degraded || judgments.isEmpty() ? 0.0 : Math.exp(-globalUncertainty))
                .degraded(degraded)
                .signals(signals)
                .build();
    }

    private static LayerSignal signalFor(FormulationLayer layer, List<Judgment> judgments) {
        double[] layerScores = new double[judgments.size()];
        LayerJudgment firstTriggered = null;
        for (int i = 0; i < judgments.size(); i++) {
            LayerJudgment lj = judgments.get(i).getLayers().get(layer);
            layerScores[i] = lj.getScore();
            if (lj.isTrigger() && firstTriggered == null) {
                firstTriggered = lj;
            }
        }
        LayerJudgment source = firstTriggered != null ? firstTriggered : judgments.get(0).getLayers().get(layer);
        return LayerSignal.builder()
                .trigger(firstTriggered != null)
                .explanation(source.getExplanation())
                .guidance(firstTriggered != null ? firstTriggered.getGuidance() : "")
                .localUncertainty(uncertainty(layerScores))
                .build();
    }

    /**
     * Population standard deviation of 0-100 scores, scaled to [0, 1].
     */
    static double uncertainty(double[] scores) {
        if (scores.length == 0) {
            return 1.0;
        }
        double std = new StandardDeviation(false).evaluate(scores);
        return Math.min(1.0, std / UNCERTAINTY_SCALE);
    }

    Judgment parseJudgment(JsonNode json) {
        double score = requireScore(json.get("score"), "score");
        JsonNode layersNode = json.get("layers");
        if (layersNode == null || !layersNode.isObject()) {
            throw new ModelOutputException("Judgment is missing the 'layers' object");
        }
        Map<FormulationLayer, LayerJudgment> layers = new EnumMap<>(FormulationLayer.class);
        for (FormulationLayer layer : FormulationLayer.elements()) {
            JsonNode node = layersNode.get(layer.getKey());
            if (node == null || !node.isObject()) {
                throw new ModelOutputException("Judgment is missing layer '" + layer.getKey() + "'");
            }
            layers.put(layer, new LayerJudgment(
                    requireScore(node.get("score"), layer.getKey() + ".score"),
                    node.path("trigger").asBoolean(false),
                    node.path("explanation").asText(""),
                    node.path("guidance").asText("")));
        }
        return new Judgment(score, layers);
    }

    private static double requireScore(JsonNode node, String field) {
        if (node == null || !(node.isNumber() || node.isTextual())) {
            throw new ModelOutputException("Judgment field '" + field + "' is missing");
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new ModelOutputException("Judgment field '" + field + "' is not a number: " + node.asText());
            }
        }
        if (Double.isNaN(value)) {
            throw new ModelOutputException("Judgment field '" + field + "' is not a number");
        }
        return Math.max(0.0, Math.min(MAX_SCORE, value));
    }

    @Value
    static class Judgment {
        double score;
        Map<FormulationLayer, LayerJudgment> layers;
    }

    @Value
    static class LayerJudgment {
        double score;
        boolean trigger;
        String explanation;
        String guidance;
    }
}
