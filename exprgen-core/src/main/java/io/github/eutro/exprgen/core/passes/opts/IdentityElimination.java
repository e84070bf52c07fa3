package io.github.eutro.exprgen.core.passes.opts;

import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.ir.ExpressionType;
import io.github.eutro.exprgen.core.passes.InPlaceIRPass;
import io.github.eutro.exprgen.core.passes.meta.ComputeWrites;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A pass which turns arithmetic with an identity element into plain assignments:
 * <pre>
 * b = a + 0;    -&gt;    b = a;
 * b = 1 * a;    -&gt;    b = a;
 * </pre>
 * This holds for {@code +}, {@code -}, {@code *} and {@code /} on the appropriate side,
 * and for unary {@code +}. Signed zeros are not preserved.
 */
public class IdentityElimination implements InPlaceIRPass<ExpressionGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(IdentityElimination.class);

    /**
     * An instance of this pass.
     */
    public static final IdentityElimination INSTANCE = new IdentityElimination();

    @Override
    public void runInPlace(ExpressionGraph graph) {
        ComputeWrites.Writes writes = ComputeWrites.INSTANCE.run(graph);
        int eliminated = 0;
        for (ExpressionId id : graph.ids()) {
            Expression expr = graph.get(id);
            ExpressionId source = identitySource(graph, writes, id, expr);
            if (source != null) {
                expr.replace(Expression.createAssignment(ExpressionId.INVALID, source));
                eliminated++;
            }
        }
        LOGGER.debug("eliminated {} identity operations", eliminated);
    }

    @Nullable
    private static ExpressionId identitySource(
            ExpressionGraph graph,
            ComputeWrites.Writes writes,
            ExpressionId id,
            Expression expr
    ) {
        if (expr.getType() == ExpressionType.UNARY_ARITHMETIC) {
            return "+".equals(expr.getName()) ? expr.getOperands().get(0) : null;
        }
        if (expr.getType() != ExpressionType.BINARY_ARITHMETIC) return null;
        ExpressionId l = expr.getOperands().get(0);
        ExpressionId r = expr.getOperands().get(1);
        switch (expr.getName()) {
            case "+":
                if (isConstant(graph, writes, r, id, 0)) return l;
                if (isConstant(graph, writes, l, id, 0)) return r;
                return null;
            case "-":
                return isConstant(graph, writes, r, id, 0) ? l : null;
            case "*":
                if (isConstant(graph, writes, r, id, 1)) return l;
                if (isConstant(graph, writes, l, id, 1)) return r;
                return null;
            case "/":
                return isConstant(graph, writes, r, id, 1) ? l : null;
            default:
                return null;
        }
    }

    private static boolean isConstant(
            ExpressionGraph graph,
            ComputeWrites.Writes writes,
            ExpressionId var,
            ExpressionId readAt,
            double constant
    ) {
        return graph.get(var).isCompileTimeConstantAndEqualTo(constant)
                && !writes.isWrittenBetween(var, var, readAt);
    }
}
