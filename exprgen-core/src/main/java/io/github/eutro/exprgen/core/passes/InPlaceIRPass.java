package io.github.eutro.exprgen.core.passes;

/**
 * An IR pass which mutates its input and returns it, such as the graph optimisations.
 *
 * @param <T> The type of the IR this pass operates on, usually an
 *            {@link io.github.eutro.exprgen.core.ir.ExpressionGraph}.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Run the pass, mutating the IR.
     *
     * @param t The IR to run this pass on.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    /**
     * {@inheritDoc}
     *
     * @return {@code true}
     */
    @Override
    default boolean isInPlace() {
        return true;
    }

    /**
     * Give an in-place pass, typically a lambda, a {@link #getName() name}.
     *
     * @param name The name.
     * @param pass The pass.
     * @param <T>  The type of the IR.
     * @return A pass that runs {@code pass}, with the given name.
     */
    static <T> InPlaceIRPass<T> named(String name, InPlaceIRPass<T> pass) {
        return new InPlaceIRPass<T>() {
            @Override
            public void runInPlace(T t) {
                pass.runInPlace(t);
            }

            @Override
            public String getName() {
                return name;
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
