package com.oracle.optmcts.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SolveResult {

    private SolveStatus status;

    /** Layer key to element content, in layer order. Empty when no formulation was completed. */
    @Builder.Default
    private Map<String, String> bestFormulation = new LinkedHashMap<>();

    private String bestFormulationText;

    private Double bestReward;

    private Double bestValueEstimate;

    private Double extractedAnswer;

    private String code;

    private int iterationsRun;

    private int nodesCreated;

    private int guidanceEntries;

    @Builder.Default
    private List<IterationTrace> trace = new ArrayList<>();

    public boolean isSolved() {
        return status == SolveStatus.SOLVED;
    }
}
