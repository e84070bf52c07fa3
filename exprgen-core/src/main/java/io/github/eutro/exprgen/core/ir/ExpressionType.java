package io.github.eutro.exprgen.core.ir;

/**
 * The kind of an {@link Expression}.
 * <p>
 * The set of kinds is closed. Each kind either {@link #definesValue() defines a value},
 * is a {@link #isControl() control marker}, or is one of {@link #COMMENT} and {@link #NOP},
 * which are neither.
 */
public enum ExpressionType {
    /**
     * {@code v_0 = 3.1415;}
     */
    COMPILE_TIME_CONSTANT(true, false),
    /**
     * Assignment from a named input to a generated variable.
     * <p>
     * {@code v_0 = parameters[0][0];}
     */
    INPUT_ASSIGNMENT(true, false),
    /**
     * Assignment from a generated variable to a named output.
     * <p>
     * {@code residuals[0] = v_51;}
     */
    OUTPUT_ASSIGNMENT(true, false),
    /**
     * {@code v_3 = v_1;}
     */
    ASSIGNMENT(true, false),
    /**
     * {@code v_2 = v_0 + v_1;}, the operator is the expression's name.
     */
    BINARY_ARITHMETIC(true, false),
    /**
     * {@code v_1 = -v_0;}, the operator is the expression's name.
     */
    UNARY_ARITHMETIC(true, false),
    /**
     * {@code v_2 = v_0 < v_1;}, the operator ({@code <}, {@code &&}, ...) is the expression's name.
     */
    BINARY_COMPARISON(true, false),
    /**
     * {@code v_3 = !v_2;}
     */
    LOGICAL_NEGATION(true, false),
    /**
     * {@code v_5 = f(v_0, v_1, ...);}, the function is the expression's name.
     */
    FUNCTION_CALL(true, false),
    IF(false, true),
    ELSE(false, true),
    END_IF(false, true),
    /**
     * A single comment line. Comments are never optimised away.
     */
    COMMENT(false, false),
    /**
     * The state of an expression that has been eliminated.
     */
    NOP(false, false),
    ;

    private final boolean definesValue;
    private final boolean isControl;

    ExpressionType(boolean definesValue, boolean isControl) {
        this.definesValue = definesValue;
        this.isControl = isControl;
    }

    /**
     * Get whether expressions of this type assign to a variable, and so must have a valid lhs.
     *
     * @return Whether this type defines a value.
     */
    public boolean definesValue() {
        return definesValue;
    }

    /**
     * Get whether this is one of {@link #IF}, {@link #ELSE} or {@link #END_IF}.
     *
     * @return Whether this type is a control marker.
     */
    public boolean isControl() {
        return isControl;
    }
}
