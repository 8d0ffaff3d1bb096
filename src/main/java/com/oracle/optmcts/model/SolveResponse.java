package com.oracle.optmcts.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.oracle.optmcts.search.IterationTrace;
import com.oracle.optmcts.search.SolveStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SolveResponse {

    private String problem;

    private SolveStatus status;

    private boolean solved;

    @Builder.Default
    private Map<String, String> bestFormulation = new LinkedHashMap<>();

    private String bestFormulationText;

    private Double bestReward;

    private Double extractedAnswer;

    private String code;

    private Integer iterationsRun;

    private Integer nodesCreated;

    private Integer guidanceEntries;

    /** Only populated for verbose requests. */
    private List<IterationTrace> trace;

    private Long processingTimeMs;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();
}
