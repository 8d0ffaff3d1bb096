package com.oracle.optmcts.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpansionOutcome {

    private FormulationLayer targetLayer;

    private boolean reexpansion;

    /** Candidates the model actually returned. */
    private int generated;

    private int pruned;

    @Builder.Default
    private List<FormulationNode> added = new ArrayList<>();

    public boolean isNoOp() {
        return added.isEmpty();
    }
}
