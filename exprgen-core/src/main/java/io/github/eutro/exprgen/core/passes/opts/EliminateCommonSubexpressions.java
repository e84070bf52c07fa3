package io.github.eutro.exprgen.core.passes.opts;

import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.ir.ReturnType;
import io.github.eutro.exprgen.core.passes.InPlaceIRPass;
import io.github.eutro.exprgen.core.passes.meta.ComputeRegions;
import io.github.eutro.exprgen.core.passes.meta.ComputeWrites;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;

/**
 * A pass which replaces expressions that recompute the value of an earlier one
 * with an assignment from the earlier one's variable:
 * <pre>
 * v_2 = v_0 + v_1;             v_2 = v_0 + v_1;
 * v_3 = v_0 + v_1;      -&gt;     v_3 = v_2;
 * </pre>
 * An expression is only replaced by another if it {@link Expression#isReplaceableBy(Expression) is replaceable by}
 * it, the other is available on every path to it (not in a branch it is not also in), and neither
 * the operands nor the other's variable are reassigned in between. Semantic equivalence
 * alone is never enough.
 * <p>
 * Only scalar expressions without side effects are considered; function calls are assumed
 * to be pure.
 */
public class EliminateCommonSubexpressions implements InPlaceIRPass<ExpressionGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EliminateCommonSubexpressions.class);

    /**
     * An instance of this pass.
     */
    public static final EliminateCommonSubexpressions INSTANCE = new EliminateCommonSubexpressions();

    @Override
    public void runInPlace(ExpressionGraph graph) {
        ComputeRegions.Regions regions = ComputeRegions.INSTANCE.run(graph);
        ComputeWrites.Writes writes = ComputeWrites.INSTANCE.run(graph);
        Map<List<Object>, List<ExpressionId>> available = new HashMap<>();
        int eliminated = 0;
        for (ExpressionId id : graph.ids()) {
            Expression expr = graph.get(id);
            if (!isCandidate(id, expr)) continue;
            List<ExpressionId> sameKey = available.computeIfAbsent(keyOf(expr), $ -> new ArrayList<>());
            ExpressionId replacement = findReplacement(graph, regions, writes, id, expr, sameKey);
            if (replacement == null) {
                sameKey.add(id);
            } else {
                expr.replace(Expression.createAssignment(ExpressionId.INVALID, replacement));
                eliminated++;
            }
        }
        LOGGER.debug("eliminated {} common subexpressions", eliminated);
    }

    private static ExpressionId findReplacement(
            ExpressionGraph graph,
            ComputeRegions.Regions regions,
            ComputeWrites.Writes writes,
            ExpressionId id,
            Expression expr,
            List<ExpressionId> candidates
    ) {
        ListIterator<ExpressionId> it = candidates.listIterator(candidates.size());
        outer:
        while (it.hasPrevious()) {
            ExpressionId candidate = it.previous();
            if (!expr.isReplaceableBy(graph.get(candidate))) continue;
            if (!regions.isAvailableAt(candidate, id)) continue;
            if (writes.isWrittenBetween(candidate, candidate, id)) continue;
            for (ExpressionId operand : expr.getOperands()) {
                if (writes.isWrittenBetween(operand, candidate, id)) continue outer;
            }
            return candidate;
        }
        return null;
    }

    private static boolean isCandidate(ExpressionId id, Expression expr) {
        if (expr.getReturnType() != ReturnType.SCALAR || !id.equals(expr.getLhsId())) return false;
        switch (expr.getType()) {
            case COMPILE_TIME_CONSTANT:
            case INPUT_ASSIGNMENT:
            case BINARY_ARITHMETIC:
            case UNARY_ARITHMETIC:
            case FUNCTION_CALL:
                return true;
            default:
                return false;
        }
    }

    private static List<Object> keyOf(Expression expr) {
        return Arrays.asList(
                expr.getType(),
                expr.getName(),
                Double.doubleToLongBits(expr.getValue()),
                new ArrayList<>(expr.getOperands())
        );
    }
}
