package com.oracle.optmcts.core;

public interface LanguageModelClient {

    /**
     * Blocking single-turn completion.
     *
     * @param prompt       the full user prompt
     * @param temperature  sampling temperature for this call
     * @return             the raw model text, never validated
     */
    String complete(String prompt, double temperature);
}
