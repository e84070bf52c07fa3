package io.github.eutro.exprgen.core.runtime;

/**
 * A function compiled to JVM bytecode from an expression graph,
 * see {@link io.github.eutro.exprgen.core.passes.convert.GraphToJava}.
 */
public interface CompiledFunction {
    /**
     * Run the function.
     *
     * @param inputs  The values of the inputs, in the order they were given when compiling.
     * @param outputs The array to store outputs into, in the order they were given when compiling.
     *                Outputs that are not assigned on the path taken are left untouched.
     */
    void evaluate(double[] inputs, double[] outputs);
}
