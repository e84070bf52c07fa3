package io.github.eutro.exprgen.core.passes.opts;

import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.ir.ExpressionType;
import io.github.eutro.exprgen.core.passes.InPlaceIRPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A pass which turns every assignment to a variable that is never read into a
 * {@link ExpressionType#NOP}, repeating until no more variables become unread.
 * <p>
 * Outputs are never removed, and neither are control expressions or comments.
 */
public class EliminateDeadVars implements InPlaceIRPass<ExpressionGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EliminateDeadVars.class);

    /**
     * An instance of this pass.
     */
    public static final EliminateDeadVars INSTANCE = new EliminateDeadVars();

    @Override
    public void runInPlace(ExpressionGraph graph) {
        Map<ExpressionId, Integer> usageCount = new HashMap<>();
        Map<ExpressionId, List<ExpressionId>> writers = new HashMap<>();
        for (ExpressionId id : graph.ids()) {
            Expression expr = graph.get(id);
            for (ExpressionId arg : expr.getOperands()) {
                usageCount.merge(arg, 1, Integer::sum);
            }
            if (expr.hasValidLhs()) {
                usageCount.putIfAbsent(expr.getLhsId(), 0);
                writers.computeIfAbsent(expr.getLhsId(), $ -> new ArrayList<>()).add(id);
            }
        }

        List<ExpressionId> stack = new ArrayList<>();
        usageCount.forEach((var, count) -> {
            if (count == 0) stack.add(var);
        });

        int eliminated = 0;
        while (!stack.isEmpty()) {
            ExpressionId deadVar = stack.remove(stack.size() - 1);
            List<ExpressionId> varWriters = writers.getOrDefault(deadVar, new ArrayList<>());
            if (!varWriters.stream().allMatch(w -> isRemovable(graph.get(w)))) continue;
            for (ExpressionId writer : varWriters) {
                Expression expr = graph.get(writer);
                for (ExpressionId arg : expr.getOperands()) {
                    int n = usageCount.merge(arg, -1, Integer::sum);
                    if (n == 0) stack.add(arg);
                }
                expr.makeNop();
                eliminated++;
            }
        }
        LOGGER.debug("eliminated {} dead assignments", eliminated);
    }

    private static boolean isRemovable(Expression expr) {
        return expr.definesValue() && expr.getType() != ExpressionType.OUTPUT_ASSIGNMENT;
    }
}
