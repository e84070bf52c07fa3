package io.github.eutro.exprgen.core.ir;

/**
 * Where a {@link BranchTracker} is within one level of if/else nesting.
 */
public enum BranchState {
    /**
     * The {@link ExpressionType#IF} was just seen.
     */
    OPEN,
    IN_TRUE_BRANCH,
    IN_FALSE_BRANCH,
    /**
     * The matching {@link ExpressionType#END_IF} was seen.
     */
    CLOSED,
}
