package io.github.eutro.exprgen.trace;

/**
 * How a {@link TracedFunction} is being run.
 */
public enum ExecutionMode {
    /**
     * Values are numbers, and only the taken branch of a conditional runs.
     */
    EVALUATE,
    /**
     * Values are expressions in a graph, and both branches of every conditional run.
     */
    TRACE,
}
