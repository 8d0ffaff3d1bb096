package com.oracle.optmcts.core.impl;

import com.oracle.optmcts.config.OptMctsConfig;
import com.oracle.optmcts.core.LanguageModelClient;
import com.oracle.optmcts.core.StructuredOutputParser;
import com.oracle.optmcts.service.PromptTemplateService;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LlmCodeGeneratorTest {

    private final List<String> prompts = new ArrayList<>();
    private final List<Double> temperatures = new ArrayList<>();

    private final LanguageModelClient model = (prompt, temperature) -> {
        prompts.add(prompt);
        temperatures.add(temperature);
        return "```python\nprint(7)\n```";
    };

    private final LlmCodeGenerator generator = new LlmCodeGenerator(
            model, new PromptTemplateService(), new StructuredOutputParser(), new OptMctsConfig());

    @Test
    void generatedCodeHasFencesRemoved() {
        String code = generator.generate("maximize profit", "**Type**: LP");

        assertEquals("print(7)", code);
        assertTrue(prompts.get(0).contains("**Type**: LP"));
        assertEquals(0.0, temperatures.get(0));
    }

    @Test
    void repairPromptCarriesTruncatedError() {
        String longError = "Traceback\n" + "x".repeat(2_000);

        generator.repair("maximize profit", "print(x)", longError);

        String prompt = prompts.get(0);
        assertTrue(prompt.contains("print(x)"));
        assertTrue(prompt.contains("Traceback"));
        assertFalse(prompt.contains("x".repeat(600)));
    }
}
