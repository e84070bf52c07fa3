package io.github.eutro.exprgen.core.ir;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single instruction of the IR, holding everything needed to generate one line of code.
 * <p>
 * Each line has the form {@code lhs = rhs;}, where the left hand side is the variable
 * named by {@link #getLhsId()} and the right hand side depends on the {@link #getType() type}.
 * Control markers, comments and no-ops have no left hand side.
 * <p>
 * Expressions refer to each other only by {@link ExpressionId}, never directly, so
 * they can be copied freely. They should be created through the static {@code create*}
 * factories, which pick the right type and return type, and then handed to
 * {@link ExpressionGraph#insertBack(Expression)}, which assigns the id.
 * <p>
 * There are three distinct ways to compare expressions:
 * <ul>
 *     <li>{@link #equals(Object)}, where everything including the lhs must match;</li>
 *     <li>{@link #isSemanticallyEquivalentTo(Expression)}, which only compares the
 *     shape of the expressions, and must not be used to eliminate anything;</li>
 *     <li>{@link #isReplaceableBy(Expression)}, which also requires identical operands,
 *     and is what common subexpression elimination is gated on.</li>
 * </ul>
 */
public final class Expression {
    private ExpressionType type = ExpressionType.NOP;
    private ReturnType returnType = ReturnType.NONE;
    // lhs of the line; usually the position of this expression,
    // except for assignments to an existing variable
    private ExpressionId lhsId = ExpressionId.INVALID;
    // order matters, e.g. for non-commutative operators
    private final List<ExpressionId> operands = new ArrayList<>();
    // operator symbol, function name, or binding name, depending on the type
    private String name = "";
    // only meaningful for COMPILE_TIME_CONSTANT
    private double value;

    /**
     * Construct a {@link ExpressionType#NOP} expression.
     */
    public Expression() {
    }

    /**
     * Construct an expression from all its fields.
     * <p>
     * Nothing here checks that the fields are consistent with each other,
     * prefer the {@code create*} factories.
     *
     * @param type       The type.
     * @param returnType The return type.
     * @param lhsId      The variable assigned to, or {@link ExpressionId#INVALID}.
     * @param operands   The operands, in order.
     * @param name       The name.
     * @param value      The literal value.
     */
    public Expression(
            ExpressionType type,
            ReturnType returnType,
            ExpressionId lhsId,
            List<ExpressionId> operands,
            String name,
            double value
    ) {
        this.type = type;
        this.returnType = returnType;
        this.lhsId = lhsId;
        this.operands.addAll(operands);
        this.name = name;
        this.value = value;
    }

    private Expression(ExpressionType type, ReturnType returnType, ExpressionId... operands) {
        this(type, returnType, ExpressionId.INVALID, Arrays.asList(operands), "", 0);
    }

    /**
     * Create a copy of this expression, sharing nothing with it.
     *
     * @return The copy.
     */
    @Contract(pure = true)
    public Expression copy() {
        return new Expression(type, returnType, lhsId, operands, name, value);
    }

    // factories

    @Contract(pure = true)
    public static Expression createCompileTimeConstant(double v) {
        Expression expr = new Expression(ExpressionType.COMPILE_TIME_CONSTANT, ReturnType.SCALAR);
        expr.value = v;
        return expr;
    }

    @Contract(pure = true)
    public static Expression createInputAssignment(String name) {
        Expression expr = new Expression(ExpressionType.INPUT_ASSIGNMENT, ReturnType.SCALAR);
        expr.name = name;
        return expr;
    }

    @Contract(pure = true)
    public static Expression createOutputAssignment(ExpressionId v, String name) {
        Expression expr = new Expression(ExpressionType.OUTPUT_ASSIGNMENT, ReturnType.SCALAR, v);
        expr.name = name;
        return expr;
    }

    /**
     * Create an assignment of {@code src} to the variable {@code dst}.
     * <p>
     * With {@code dst} as {@link ExpressionId#INVALID} this declares a new variable,
     * which the graph names after the position of the assignment.
     *
     * @param dst The variable written to.
     * @param src The variable read.
     * @return The assignment.
     */
    @Contract(pure = true)
    public static Expression createAssignment(ExpressionId dst, ExpressionId src) {
        Expression expr = new Expression(ExpressionType.ASSIGNMENT, ReturnType.SCALAR, src);
        expr.lhsId = dst;
        return expr;
    }

    @Contract(pure = true)
    public static Expression createBinaryArithmetic(String op, ExpressionId l, ExpressionId r) {
        Expression expr = new Expression(ExpressionType.BINARY_ARITHMETIC, ReturnType.SCALAR, l, r);
        expr.name = op;
        return expr;
    }

    @Contract(pure = true)
    public static Expression createUnaryArithmetic(String op, ExpressionId v) {
        Expression expr = new Expression(ExpressionType.UNARY_ARITHMETIC, ReturnType.SCALAR, v);
        expr.name = op;
        return expr;
    }

    @Contract(pure = true)
    public static Expression createBinaryComparison(String op, ExpressionId l, ExpressionId r) {
        Expression expr = new Expression(ExpressionType.BINARY_COMPARISON, ReturnType.BOOLEAN, l, r);
        expr.name = op;
        return expr;
    }

    @Contract(pure = true)
    public static Expression createLogicalNegation(ExpressionId v) {
        return new Expression(ExpressionType.LOGICAL_NEGATION, ReturnType.BOOLEAN, v);
    }

    @Contract(pure = true)
    public static Expression createScalarFunctionCall(String name, List<ExpressionId> params) {
        return new Expression(ExpressionType.FUNCTION_CALL, ReturnType.SCALAR,
                ExpressionId.INVALID, params, name, 0);
    }

    @Contract(pure = true)
    public static Expression createLogicalFunctionCall(String name, List<ExpressionId> params) {
        return new Expression(ExpressionType.FUNCTION_CALL, ReturnType.BOOLEAN,
                ExpressionId.INVALID, params, name, 0);
    }

    /**
     * Create the start of a conditional. Everything after this, up to the matching
     * {@link #createElse() else} or {@link #createEndIf() end}, is the true branch.
     *
     * @param condition The boolean variable to branch on.
     * @return The expression.
     */
    @Contract(pure = true)
    public static Expression createIf(ExpressionId condition) {
        return new Expression(ExpressionType.IF, ReturnType.NONE, condition);
    }

    @Contract(pure = true)
    public static Expression createElse() {
        return new Expression(ExpressionType.ELSE, ReturnType.NONE);
    }

    @Contract(pure = true)
    public static Expression createEndIf() {
        return new Expression(ExpressionType.END_IF, ReturnType.NONE);
    }

    @Contract(pure = true)
    public static Expression createComment(String comment) {
        Expression expr = new Expression(ExpressionType.COMMENT, ReturnType.NONE);
        expr.name = comment;
        return expr;
    }

    // classification

    /**
     * Get whether this expression assigns to a variable. Such expressions
     * must have a valid lhs once they are in a graph.
     *
     * @return Whether this defines a value.
     */
    public boolean definesValue() {
        return type.definesValue();
    }

    /**
     * Get whether this is an if, else or end-if marker.
     *
     * @return Whether this is a control expression.
     */
    public boolean isControl() {
        return type.isControl();
    }

    public boolean hasValidLhs() {
        return lhsId.isValid();
    }

    /**
     * Get whether this is a compile time constant of exactly the given value.
     * <p>
     * Used to fold away operations like {@code a + 0} and {@code a * 1}.
     *
     * @param constant The value.
     * @return Whether this is that constant.
     */
    public boolean isCompileTimeConstantAndEqualTo(double constant) {
        return type == ExpressionType.COMPILE_TIME_CONSTANT && value == constant;
    }

    /**
     * Get whether {@code id} is one of the operands of this expression.
     *
     * @param id The id.
     * @return Whether this reads it.
     */
    public boolean directlyDependsOn(ExpressionId id) {
        return operands.contains(id);
    }

    // comparisons

    /**
     * Get whether every read of this expression's variable could instead read the variable
     * of {@code other}, as far as the two expressions alone can tell.
     * <p>
     * Everything but the lhs must match, including the identity and order of the operands.
     * This does not account for the operands being written between the two expressions,
     * or for the expressions being in different branches, which are up to the caller.
     *
     * @param other The expression that would be read instead.
     * @return Whether this is replaceable by {@code other}.
     */
    public boolean isReplaceableBy(Expression other) {
        return type == other.type
                && returnType == other.returnType
                && name.equals(other.name)
                && Double.compare(value, other.value) == 0
                && operands.equals(other.operands);
    }

    /**
     * Get whether this has the same shape as {@code other}: the same type, return type,
     * name, value and number of operands. The lhs and operand ids may differ.
     * <p>
     * For example, all of these are semantically equivalent:
     * <pre>
     * v_0 = v_1 + v_2;
     * v_0 = v_1 + v_3;
     * v_1 = v_1 + v_2;
     * </pre>
     * Semantically equivalent expressions do not compute the same value in general,
     * use {@link #isReplaceableBy(Expression)} for that.
     *
     * @param other The other expression.
     * @return Whether the two are semantically equivalent.
     */
    public boolean isSemanticallyEquivalentTo(Expression other) {
        return type == other.type
                && returnType == other.returnType
                && name.equals(other.name)
                && Double.compare(value, other.value) == 0
                && operands.size() == other.operands.size();
    }

    // mutation

    /**
     * Overwrite this expression with the contents of {@code other}, except for the lhs,
     * so that expressions reading this one's variable remain valid.
     *
     * @param other The expression to copy from.
     */
    public void replace(Expression other) {
        if (other == this) return;
        type = other.type;
        returnType = other.returnType;
        operands.clear();
        operands.addAll(other.operands);
        name = other.name;
        value = other.value;
    }

    /**
     * Turn this expression into a {@link ExpressionType#NOP}, in place of removing it
     * from its graph.
     */
    public void makeNop() {
        type = ExpressionType.NOP;
        returnType = ReturnType.NONE;
        lhsId = ExpressionId.INVALID;
        operands.clear();
        name = "";
        value = 0;
    }

    public void setLhsId(ExpressionId lhsId) {
        this.lhsId = lhsId;
    }

    /**
     * Replace the operands of this expression.
     *
     * @param operands The new operands, in order.
     */
    public void setOperands(List<ExpressionId> operands) {
        List<ExpressionId> copy = new ArrayList<>(operands);
        this.operands.clear();
        this.operands.addAll(copy);
    }

    public void setOperand(int index, ExpressionId id) {
        operands.set(index, id);
    }

    // accessors

    public ExpressionType getType() {
        return type;
    }

    public ReturnType getReturnType() {
        return returnType;
    }

    public ExpressionId getLhsId() {
        return lhsId;
    }

    /**
     * Get the operands of this expression.
     *
     * @return An unmodifiable view of the operands.
     */
    public List<ExpressionId> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Expression that = (Expression) o;
        return type == that.type
                && returnType == that.returnType
                && lhsId.equals(that.lhsId)
                && operands.equals(that.operands)
                && name.equals(that.name)
                && Double.compare(value, that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, returnType, lhsId, operands, name, value);
    }

    @Override
    public @NotNull String toString() {
        StringBuilder sb = new StringBuilder();
        if (hasValidLhs()) {
            sb.append(lhsId).append(" = ");
        }
        sb.append(type.name().toLowerCase());
        if (!name.isEmpty()) {
            sb.append(" \"").append(name).append('"');
        }
        if (type == ExpressionType.COMPILE_TIME_CONSTANT) {
            sb.append(' ').append(value);
        }
        if (!operands.isEmpty()) {
            sb.append(operands.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", " ", "")));
        }
        return sb.toString();
    }
}
