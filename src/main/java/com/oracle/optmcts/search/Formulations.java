package com.oracle.optmcts.search;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class Formulations {

    private Formulations() {
    }

    /**
     * One {@code **Layer**: content} line per element on the path; the root is skipped.
     */
    public static String render(List<FormulationNode> path) {
        return path.stream()
                .filter(n -> !n.isRoot())
                .map(n -> "**" + n.getLayer().getDisplayName() + "**: " + n.getContent())
                .collect(Collectors.joining("\n"));
    }

    public static Map<String, String> byLayer(List<FormulationNode> path) {
        Map<String, String> elements = new LinkedHashMap<>();
        for (FormulationNode n : path) {
            if (!n.isRoot()) {
                elements.put(n.getLayer().getKey(), n.getContent());
            }
        }
        return elements;
    }
}
