package io.github.eutro.exprgen.core.passes.misc;

import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.passes.IRPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A pass which composes two others, executing the first, and giving its result to the second.
 * <p>
 * Nested chains are flattened, so a pipeline like {@link io.github.eutro.exprgen.core.passes.Passes#OPTIMIZE}
 * logs and reports failures by the index of each step in the whole pipeline.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChainedPass.class);

    private final List<IRPass<Object, Object>> steps;
    private final boolean isInPlace;

    /**
     * Construct a chained pass.
     *
     * @param firstPass The first pass to run.
     * @param nextPass  The next pass to run.
     */
    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        List<IRPass<Object, Object>> steps = new ArrayList<>();
        flattenInto(firstPass, steps);
        flattenInto(nextPass, steps);
        this.steps = Collections.unmodifiableList(steps);
        isInPlace = firstPass.isInPlace() && nextPass.isInPlace();
    }

    @SuppressWarnings("unchecked")
    private static void flattenInto(IRPass<?, ?> pass, List<IRPass<Object, Object>> steps) {
        if (pass instanceof ChainedPass) {
            steps.addAll(((ChainedPass<?, ?, ?>) pass).steps);
        } else {
            steps.add((IRPass<Object, Object>) pass);
        }
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @Override
    public String getName() {
        return steps.stream()
                .map(IRPass::getName)
                .collect(Collectors.joining(" -> "));
    }

    private static String describe(Object ir) {
        if (ir instanceof ExpressionGraph) {
            return "graph of " + ((ExpressionGraph) ir).size() + " expressions";
        }
        return ir == null ? "null" : ir.getClass().getSimpleName();
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < steps.size(); i++) {
            IRPass<Object, Object> step = steps.get(i);
            LOGGER.debug("running pass {}/{} ({}) on {}", i + 1, steps.size(), step.getName(), describe(acc));
            try {
                acc = step.run(acc);
            } catch (Throwable t) {
                t.addSuppressed(new RuntimeException(String.format(
                        "running pass %d/%d (%s) in chain on %s",
                        i + 1,
                        steps.size(),
                        step.getName(),
                        describe(acc))));
                throw t;
            }
        }
        return (C) acc;
    }
}
