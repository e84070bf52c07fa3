package io.github.eutro.exprgen.trace;

import io.github.eutro.exprgen.core.conf.FunctionTable;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.passes.Passes;
import io.github.eutro.exprgen.core.passes.meta.VerifyIntegrity;
import org.jetbrains.annotations.Contract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Entry points for running {@link TracedFunction traced functions} in either {@link ExecutionMode}.
 */
public final class Tracer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Tracer.class);

    private Tracer() {
    }

    /**
     * Trace a function into a new graph.
     * <p>
     * The graph is {@link VerifyIntegrity verified} if {@link Passes#VERIFY_PASSES} is set.
     *
     * @param function The function.
     * @return The graph.
     */
    @Contract("_ -> new")
    public static ExpressionGraph trace(TracedFunction function) {
        TracingScalars scalars = new TracingScalars();
        function.apply(scalars);
        ExpressionGraph graph = scalars.getGraph();
        LOGGER.debug("traced {} expressions", graph.size());
        if (Passes.VERIFY_PASSES) {
            VerifyIntegrity.INSTANCE.runInPlace(graph);
        }
        return graph;
    }

    /**
     * Run a function on numbers.
     *
     * @param function  The function.
     * @param inputs    The values of its inputs, by name.
     * @param functions The functions it may call.
     * @return The outputs it wrote, by name.
     */
    public static Map<String, Double> evaluate(
            TracedFunction function,
            Map<String, Double> inputs,
            FunctionTable functions
    ) {
        EvaluatingScalars scalars = new EvaluatingScalars(inputs, functions);
        function.apply(scalars);
        return scalars.getOutputs();
    }

    public static Map<String, Double> evaluate(TracedFunction function, Map<String, Double> inputs) {
        return evaluate(function, inputs, FunctionTable.DEFAULT);
    }
}
