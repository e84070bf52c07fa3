package io.github.eutro.exprgen.core.ir;

import java.util.List;

/**
 * Thrown when an {@link ExpressionGraph} breaks one of the invariants of the IR.
 * <p>
 * This always indicates a bug in whatever produced or last transformed the graph.
 */
public class InvalidGraphException extends RuntimeException {
    private final ExpressionId id;
    private final ExpressionType type;
    private final List<ExpressionId> operands;

    public InvalidGraphException(String message, ExpressionId id, Expression expression) {
        super(String.format("%s\n  at: %s\n  expression: %s", message, id, expression));
        this.id = id;
        this.type = expression.getType();
        this.operands = List.copyOf(expression.getOperands());
    }

    /**
     * Get the position of the offending expression.
     *
     * @return The id.
     */
    public ExpressionId getId() {
        return id;
    }

    public ExpressionType getType() {
        return type;
    }

    public List<ExpressionId> getOperands() {
        return operands;
    }
}
