package com.oracle.optmcts.service;

import com.oracle.optmcts.search.FormulationLayer;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class PromptTemplateService {

    public String createElementPrompt(String problem, String partialFormulation, FormulationLayer target,
                                      List<String> guidance, String reexpansionFeedback) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an expert in mathematical optimization.\n\n");
        prompt.append("Problem:\n").append(problem).append("\n\n");
        prompt.append("Formulation so far:\n")
              .append(partialFormulation == null || partialFormulation.isBlank() ? "(none yet)" : partialFormulation)
              .append("\n\n");

        if (guidance != null && !guidance.isEmpty()) {
            prompt.append("Guidance from previous attempts for '").append(target.getKey()).append("':\n");
            for (String g : guidance) {
                prompt.append("- ").append(g).append("\n");
            }
            prompt.append("\n");
        }

        if (reexpansionFeedback != null && !reexpansionFeedback.isBlank()) {
            prompt.append("A reviewer flagged the current choices at this point: ")
                  .append(reexpansionFeedback).append("\n");
            prompt.append("Propose an alternative that addresses this feedback.\n\n");
        }

        prompt.append("Generate ONLY the \"").append(target.getKey())
              .append("\" component of the mathematical formulation.\n");
        prompt.append("Be concise and precise. Do not write code.\n");

        return prompt.toString();
    }

    public String createCodePrompt(String problem, String formulation) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Based on the problem and mathematical formulation below, write Python code to solve it.\n\n");
        prompt.append("Original problem:\n").append(problem).append("\n\n");
        prompt.append("Mathematical formulation:\n").append(formulation).append("\n\n");
        prompt.append("Requirements:\n");
        prompt.append("- Use scipy.optimize or PuLP (for integer programs)\n");
        appendCodeRequirements(prompt);
        return prompt.toString();
    }

    public String createRepairPrompt(String problem, String code, String error) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("The following Python code failed. Please fix it.\n\n");
        prompt.append("Problem:\n").append(problem).append("\n\n");
        prompt.append("Error:\n").append(error == null || error.isBlank() ? "(no error output)" : error).append("\n\n");
        prompt.append("Original code:\n").append(code).append("\n\n");
        prompt.append("Requirements:\n");
        appendCodeRequirements(prompt);
        return prompt.toString();
    }

    /**
     * One judgment: an overall score plus a per-layer review, as a single JSON object.
     */
    public String createJudgmentPrompt(String problem, String formulation, boolean success,
                                       String output, String error) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are reviewing a mathematical optimization formulation and its solution.\n\n");
        prompt.append("Problem:\n").append(problem).append("\n\n");
        prompt.append("Complete formulation:\n").append(formulation).append("\n\n");
        prompt.append("Execution result: success=").append(success)
              .append(", output=").append(output == null ? "" : output)
              .append(", error=").append(error == null ? "" : error).append("\n\n");
        prompt.append("Score the overall solution quality from 0 to 100:\n");
        prompt.append("- 0-25:   Poor (crashes, infeasible, or completely wrong answer)\n");
        prompt.append("- 26-50:  Fair (runs but answer is significantly wrong)\n");
        prompt.append("- 51-75:  Good (reasonable formulation, answer is close)\n");
        prompt.append("- 76-100: Excellent (correct formulation, correct answer)\n\n");
        prompt.append("Then evaluate EACH formulation element: ");
        prompt.append(String.join(", ", FormulationLayer.elements().stream().map(FormulationLayer::getKey).toList()));
        prompt.append(".\nFor each element give:\n");
        prompt.append("  \"score\":       integer 0-100 for the quality of this element\n");
        prompt.append("  \"trigger\":     true if this element has issues needing revision, else false\n");
        prompt.append("  \"explanation\": one sentence on quality\n");
        prompt.append("  \"guidance\":    specific improvement advice if trigger=true, else \"\"\n\n");
        prompt.append("Respond ONLY with JSON in the following format:\n");
        prompt.append("{\n");
        prompt.append("  \"score\": 0-100,\n");
        prompt.append("  \"layers\": {\n");
        prompt.append("    \"type\": {\"score\": 0-100, \"trigger\": true/false, \"explanation\": \"...\", \"guidance\": \"...\"},\n");
        prompt.append("    ...\n");
        prompt.append("  }\n");
        prompt.append("}\n");
        return prompt.toString();
    }

    private void appendCodeRequirements(StringBuilder prompt) {
        prompt.append("- Output ONLY executable Python code, no markdown, no explanation\n");
        prompt.append("- Print the optimal objective value as the LAST line of output\n");
        prompt.append("- If infeasible or unbounded, print 0\n");
    }
}
