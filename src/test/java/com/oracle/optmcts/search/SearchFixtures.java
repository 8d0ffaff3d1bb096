package com.oracle.optmcts.search;

import com.oracle.optmcts.core.LanguageModelClient;
import com.oracle.optmcts.core.RetryPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Shared fakes for search tests. Model calls run sequentially on the test thread.
 */
final class SearchFixtures {

    static final String JUDGMENT_MARKER = "Score the overall solution quality";

    private SearchFixtures() {
    }

    static SearchSettings.SearchSettingsBuilder settings() {
        return SearchSettings.builder()
                .parallelModelCalls(false)
                .modelRetry(RetryPolicy.immediate(1))
                .executionRetry(RetryPolicy.immediate(2));
    }

    static ModelCallFanOut sequentialFanOut() {
        return new ModelCallFanOut(null);
    }

    static boolean isJudgment(String prompt) {
        return prompt.contains(JUDGMENT_MARKER);
    }

    /**
     * Judgment JSON with the same score, trigger and guidance on every layer.
     */
    static String judgment(int overall, int layerScore, boolean trigger, String guidance) {
        StringBuilder json = new StringBuilder("{\"score\": ").append(overall).append(", \"layers\": {");
        List<FormulationLayer> layers = FormulationLayer.elements();
        for (int i = 0; i < layers.size(); i++) {
            if (i > 0) {
                json.append(", ");
            }
            json.append('"').append(layers.get(i).getKey()).append("\": {\"score\": ").append(layerScore)
                .append(", \"trigger\": ").append(trigger)
                .append(", \"explanation\": \"looks ").append(trigger ? "wrong" : "fine").append('"')
                .append(", \"guidance\": \"").append(guidance).append("\"}");
        }
        return json.append("}}").toString();
    }

    /**
     * A complete path of fresh nodes below {@code root}, one child per layer.
     */
    static List<FormulationNode> completePath(FormulationNode root, String prefix) {
        List<FormulationNode> path = new ArrayList<>();
        path.add(root);
        FormulationNode node = root;
        while (!node.isComplete()) {
            node = node.addChild(prefix + " " + node.getLayer().next().getKey());
            path.add(node);
        }
        return path;
    }

    static class ScriptedModel implements LanguageModelClient {

        private final Function<String, String> responder;
        final List<String> prompts = Collections.synchronizedList(new ArrayList<>());

        ScriptedModel(Function<String, String> responder) {
            this.responder = responder;
        }

        @Override
        public String complete(String prompt, double temperature) {
            prompts.add(prompt);
            return responder.apply(prompt);
        }
    }
}
