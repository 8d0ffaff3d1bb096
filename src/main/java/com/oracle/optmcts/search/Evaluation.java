package com.oracle.optmcts.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of the K repeated judgments of one assembled solution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Evaluation {

    /** Overall scores (0-100) of the judgments that succeeded. */
    @Builder.Default
    private List<Double> scores = new ArrayList<>();

    /** Mean overall score normalized to [0, 1]. */
    private double meanScore;

    private double globalUncertainty;

    /** exp(-globalUncertainty), or 0 when a judgment could not be obtained. */
    private double confidence;

    private boolean degraded;

    @Builder.Default
    private Map<FormulationLayer, LayerSignal> signals = new EnumMap<>(FormulationLayer.class);

    public LayerSignal signalFor(FormulationLayer layer) {
        return signals.get(layer);
    }
}
