package io.github.eutro.exprgen.core.passes;

import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.passes.misc.ChainedPass;

/**
 * A pass to run on some IR, usually an {@link ExpressionGraph}, which may modify it,
 * compute something from it, or convert it to a different form.
 * <p>
 * A pass may be <i>in-place</i>, in which case it must have the same
 * input and result types, and should return true for {@link #isInPlace()}.
 * In-place passes may only change expressions through the mutators of
 * {@link io.github.eutro.exprgen.core.ir.Expression}, and never reorder a graph.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Get whether this pass is in-place.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Get a name for this pass, used when logging and reporting failures.
     *
     * @return The name.
     */
    default String getName() {
        String name = getClass().getSimpleName();
        return name.isEmpty() ? getClass().getName() : name;
    }

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
