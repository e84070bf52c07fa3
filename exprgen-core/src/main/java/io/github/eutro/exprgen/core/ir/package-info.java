/**
 * This package defines the intermediate representation (IR) that traced functions
 * are recorded into, and that code is generated from.
 * <p>
 * The IR is a flat list of {@link io.github.eutro.exprgen.core.ir.Expression expressions}
 * in an {@link io.github.eutro.exprgen.core.ir.ExpressionGraph}. There are no basic blocks
 * and no jumps: conditionals are recorded as {@code IF}, {@code ELSE} and {@code END_IF}
 * expressions in between the expressions of their branches, and both branches are
 * always present. The structure can be recovered with a
 * {@link io.github.eutro.exprgen.core.ir.BranchTracker}.
 * <p>
 * Expressions name each other by {@link io.github.eutro.exprgen.core.ir.ExpressionId},
 * and an operand must always name an expression earlier in the graph.
 * Unlike SSA, a variable may be assigned more than once, by
 * {@code ASSIGNMENT} expressions to an existing variable.
 */
package io.github.eutro.exprgen.core.ir;
