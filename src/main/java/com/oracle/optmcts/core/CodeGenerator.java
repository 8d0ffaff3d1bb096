package com.oracle.optmcts.core;

/**
 * Turns a formulation into an executable program that prints its optimal objective value last.
 */
public interface CodeGenerator {

    String generate(String problem, String formulation);

    /**
     * Produce a corrected program after {@code code} failed with {@code error}.
     */
    String repair(String problem, String code, String error);
}
