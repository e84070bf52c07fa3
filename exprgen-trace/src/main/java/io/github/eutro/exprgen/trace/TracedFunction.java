package io.github.eutro.exprgen.trace;

/**
 * A numeric function that can either be run or traced.
 * <p>
 * Implementations must do all their arithmetic, comparisons and branching
 * through the {@link Scalars} they are given, and must not otherwise depend on the
 * values they compute, since while tracing there are no values.
 */
public interface TracedFunction {
    /**
     * Run the function.
     *
     * @param s   The operations to compute with.
     * @param <S> The scalar type.
     * @param <B> The boolean type.
     */
    <S, B> void apply(Scalars<S, B> s);
}
