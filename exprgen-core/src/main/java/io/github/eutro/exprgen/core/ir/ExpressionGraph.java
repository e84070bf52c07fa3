package io.github.eutro.exprgen.core.ir;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered list of {@link Expression expressions}, indexed by {@link ExpressionId}.
 * <p>
 * The order of the expressions is the order they execute in, and also the only
 * encoding of if/else structure, see {@link BranchTracker}.
 * <p>
 * Expressions are only ever added to the back, and never physically removed,
 * instead being turned into {@link ExpressionType#NOP no-ops}, so ids stay valid
 * for the lifetime of the graph.
 * <p>
 * Graphs are not thread safe.
 */
public final class ExpressionGraph implements Iterable<Expression> {
    private final List<Expression> expressions = new ArrayList<>();

    /**
     * Add a copy of an expression to the end of this graph.
     * <p>
     * If the expression defines a value but has no lhs yet, its lhs becomes its own id.
     *
     * @param expression The expression.
     * @return The id of the inserted expression.
     */
    public ExpressionId insertBack(Expression expression) {
        ExpressionId id = ExpressionId.of(expressions.size());
        Expression inserted = expression.copy();
        if (inserted.definesValue() && !inserted.hasValidLhs()) {
            inserted.setLhsId(id);
        }
        expressions.add(inserted);
        return id;
    }

    /**
     * Get the expression with the given id.
     *
     * @param id The id.
     * @return The expression, which may be mutated in place.
     * @throws IllegalArgumentException If the id is not one of this graph's.
     */
    public Expression get(ExpressionId id) {
        if (!isValid(id)) {
            throw new IllegalArgumentException(String.format(
                    "%s is not in this graph (size %d)",
                    id,
                    expressions.size()));
        }
        return expressions.get(id.index());
    }

    /**
     * Get whether an id refers to an expression in this graph.
     *
     * @param id The id.
     * @return Whether the id is valid here.
     */
    public boolean isValid(ExpressionId id) {
        return id.isValid() && id.index() < expressions.size();
    }

    public int size() {
        return expressions.size();
    }

    /**
     * Get all the ids in this graph, in order.
     *
     * @return The ids.
     */
    public List<ExpressionId> ids() {
        int size = expressions.size();
        return new AbstractList<ExpressionId>() {
            @Override
            public ExpressionId get(int index) {
                if (index >= size) throw new IndexOutOfBoundsException(index);
                return ExpressionId.of(index);
            }

            @Override
            public int size() {
                return size;
            }
        };
    }

    @Override
    public Iterator<Expression> iterator() {
        return Collections.unmodifiableList(expressions).iterator();
    }

    /**
     * Find the else of an if.
     *
     * @param ifId The id of the if.
     * @return The id of the matching else, or {@link ExpressionId#INVALID} if the if has none.
     */
    public ExpressionId findMatchingElse(ExpressionId ifId) {
        return findMatching(ifId, true);
    }

    /**
     * Find the end-if of an if.
     *
     * @param ifId The id of the if.
     * @return The id of the matching end-if, or {@link ExpressionId#INVALID} if it is never closed.
     */
    public ExpressionId findMatchingEndIf(ExpressionId ifId) {
        return findMatching(ifId, false);
    }

    private ExpressionId findMatching(ExpressionId ifId, boolean findElse) {
        if (get(ifId).getType() != ExpressionType.IF) {
            throw new IllegalArgumentException(ifId + " is not an if: " + get(ifId));
        }
        int depth = 0;
        for (int i = ifId.index() + 1; i < expressions.size(); i++) {
            switch (expressions.get(i).getType()) {
                case IF:
                    depth++;
                    break;
                case ELSE:
                    if (depth == 0 && findElse) {
                        return ExpressionId.of(i);
                    }
                    break;
                case END_IF:
                    if (depth == 0) {
                        return findElse ? ExpressionId.INVALID : ExpressionId.of(i);
                    }
                    depth--;
                    break;
                default:
                    break;
            }
        }
        return ExpressionId.INVALID;
    }

    /**
     * Get whether {@code a} reads {@code b}, directly or through its operands.
     *
     * @param a The reading expression.
     * @param b The expression that may be read.
     * @return Whether a depends on b.
     */
    public boolean dependsOn(ExpressionId a, ExpressionId b) {
        BitSet seen = new BitSet(expressions.size());
        List<ExpressionId> stack = new ArrayList<>();
        stack.add(a);
        seen.set(a.index());
        while (!stack.isEmpty()) {
            Expression expr = get(stack.remove(stack.size() - 1));
            for (ExpressionId operand : expr.getOperands()) {
                if (operand.equals(b)) return true;
                if (isValid(operand) && !seen.get(operand.index())) {
                    seen.set(operand.index());
                    stack.add(operand);
                }
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return expressions.equals(((ExpressionGraph) o).expressions);
    }

    @Override
    public int hashCode() {
        return expressions.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("graph {\n");
        for (int i = 0; i < expressions.size(); i++) {
            sb.append(' ').append(i).append(": ").append(expressions.get(i)).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
