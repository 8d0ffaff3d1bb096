package com.oracle.optmcts.service;

import com.oracle.optmcts.config.OptMctsConfig;
import com.oracle.optmcts.core.StructuredOutputParser;
import com.oracle.optmcts.model.SolveRequest;
import com.oracle.optmcts.model.SolveResponse;
import com.oracle.optmcts.search.FormulationSearchEngine;
import com.oracle.optmcts.search.SearchSettings;
import com.oracle.optmcts.search.SolveResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class OptMctsService {

    private final FormulationSearchEngine searchEngine;
    private final OptMctsConfig config;

    public SolveResponse solve(SolveRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Processing solve request: {}", StructuredOutputParser.abbreviate(request.getProblem(), 120));

        SearchSettings settings = resolveSettings(request);
        SolveResult result = searchEngine.solve(request.getProblem(), request.getGroundTruth(), settings);

        return SolveResponse.builder()
                .problem(request.getProblem())
                .status(result.getStatus())
                .solved(result.isSolved())
                .bestFormulation(result.getBestFormulation())
                .bestFormulationText(result.getBestFormulationText())
                .bestReward(result.getBestReward())
                .extractedAnswer(result.getExtractedAnswer())
                .code(result.getCode())
                .iterationsRun(result.getIterationsRun())
                .nodesCreated(result.getNodesCreated())
                .guidanceEntries(result.getGuidanceEntries())
                .trace(Boolean.TRUE.equals(request.getVerbose()) ? result.getTrace() : null)
                .processingTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    /**
     * Configuration defaults with the request's overrides applied.
     */
    SearchSettings resolveSettings(SolveRequest request) {
        SearchSettings.SearchSettingsBuilder settings = SearchSettings.from(config).toBuilder();
        if (request.getIterationBudget() != null) {
            settings.iterationBudget(request.getIterationBudget());
        }
        if (request.getReexpansionThreshold() != null) {
            settings.reexpansionThreshold(request.getReexpansionThreshold());
        }
        return settings.build();
    }
}
