package com.oracle.optmcts.search;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-layer guidance ledger for a single search. Append-only.
 */
public class KnowledgeBase {

    private final Map<FormulationLayer, List<String>> guidanceByLayer = new EnumMap<>(FormulationLayer.class);

    public KnowledgeBase() {
        for (FormulationLayer layer : FormulationLayer.elements()) {
            guidanceByLayer.put(layer, new ArrayList<>());
        }
    }

    /**
     * @return true if the guidance was recorded; blank guidance is ignored
     */
    public synchronized boolean append(FormulationLayer layer, String guidance) {
        if (guidance == null || guidance.isBlank()) {
            return false;
        }
        return ledger(layer).add(guidance.trim());
    }

    public synchronized List<String> guidance(FormulationLayer layer) {
        return List.copyOf(ledger(layer));
    }

    /**
     * The most recent {@code limit} entries for the layer, oldest first.
     */
    public synchronized List<String> recent(FormulationLayer layer, int limit) {
        List<String> entries = ledger(layer);
        int from = Math.max(0, entries.size() - Math.max(0, limit));
        return List.copyOf(entries.subList(from, entries.size()));
    }

    public synchronized int size(FormulationLayer layer) {
        return ledger(layer).size();
    }

    public synchronized int totalSize() {
        return guidanceByLayer.values().stream().mapToInt(List::size).sum();
    }

    private List<String> ledger(FormulationLayer layer) {
        List<String> entries = guidanceByLayer.get(layer);
        if (entries == null) {
            throw new IllegalArgumentException("No knowledge base for layer " + layer);
        }
        return entries;
    }
}
