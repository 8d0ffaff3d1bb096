package com.oracle.optmcts.core;

/**
 * Runs generated programs in isolation. Implementations must enforce their own timeout and
 * report crashes and timeouts through the result instead of throwing.
 */
public interface ExecutionSandbox {

    ExecutionReport execute(String code);
}
