package io.github.eutro.exprgen.core.passes.meta;

import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A pass which finds every assignment to an already defined variable.
 */
public class ComputeWrites implements IRPass<ExpressionGraph, ComputeWrites.Writes> {
    /**
     * An instance of this pass.
     */
    public static final ComputeWrites INSTANCE = new ComputeWrites();

    @Override
    public Writes run(ExpressionGraph graph) {
        Map<ExpressionId, List<ExpressionId>> writes = new HashMap<>();
        for (ExpressionId id : graph.ids()) {
            Expression expr = graph.get(id);
            if (expr.hasValidLhs() && !expr.getLhsId().equals(id)) {
                writes.computeIfAbsent(expr.getLhsId(), $ -> new ArrayList<>()).add(id);
            }
        }
        return new Writes(writes);
    }

    /**
     * The positions of reassignments of each variable, in order.
     */
    public static final class Writes {
        private final Map<ExpressionId, List<ExpressionId>> writes;

        private Writes(Map<ExpressionId, List<ExpressionId>> writes) {
            this.writes = writes;
        }

        /**
         * Get the expressions that assign to a variable after it is defined.
         *
         * @param var The variable.
         * @return The reassignments, in order.
         */
        public List<ExpressionId> of(ExpressionId var) {
            return writes.getOrDefault(var, Collections.emptyList());
        }

        /**
         * Get whether a variable is reassigned strictly between two positions.
         *
         * @param var  The variable.
         * @param from The start position, exclusive.
         * @param to   The end position, exclusive.
         * @return Whether there is such a reassignment.
         */
        public boolean isWrittenBetween(ExpressionId var, ExpressionId from, ExpressionId to) {
            for (ExpressionId write : of(var)) {
                if (write.compareTo(from) > 0 && write.compareTo(to) < 0) {
                    return true;
                }
            }
            return false;
        }
    }
}
