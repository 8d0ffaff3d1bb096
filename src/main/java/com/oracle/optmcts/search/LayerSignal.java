package com.oracle.optmcts.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayerSignal {

    private boolean trigger;

    private String explanation;

    private String guidance;

    private double localUncertainty;
}
