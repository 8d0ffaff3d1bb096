package com.oracle.optmcts.core.impl;

import com.oracle.optmcts.config.OptMctsConfig;
import com.oracle.optmcts.core.CodeGenerator;
import com.oracle.optmcts.core.LanguageModelClient;
import com.oracle.optmcts.core.StructuredOutputParser;
import com.oracle.optmcts.service.PromptTemplateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class LlmCodeGenerator implements CodeGenerator {

    private static final int MAX_ERROR_CHARS = 500;
    private static final int MAX_CODE_CHARS = 1500;

    private final LanguageModelClient languageModel;
    private final PromptTemplateService promptTemplateService;
    private final StructuredOutputParser outputParser;
    private final OptMctsConfig config;

    @Override
    public String generate(String problem, String formulation) {
        String prompt = promptTemplateService.createCodePrompt(problem, formulation);
        return outputParser.parseText(languageModel.complete(prompt, config.getCodeTemperature()));
    }

    @Override
    public String repair(String problem, String code, String error) {
        log.debug("Requesting code repair for error: {}", StructuredOutputParser.abbreviate(error, 200));
        String prompt = promptTemplateService.createRepairPrompt(
                problem,
                StringUtils.left(code, MAX_CODE_CHARS),
                StringUtils.left(error, MAX_ERROR_CHARS));
        return outputParser.parseText(languageModel.complete(prompt, config.getCodeTemperature()));
    }
}
