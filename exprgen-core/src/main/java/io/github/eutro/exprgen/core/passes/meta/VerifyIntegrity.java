package io.github.eutro.exprgen.core.passes.meta;

import io.github.eutro.exprgen.core.ir.BranchTracker;
import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.ir.ExpressionType;
import io.github.eutro.exprgen.core.ir.InvalidGraphException;
import io.github.eutro.exprgen.core.ir.ReturnType;
import io.github.eutro.exprgen.core.passes.InPlaceIRPass;

import java.util.List;

/**
 * A pass which checks that a graph upholds all the invariants of the IR, throwing
 * an {@link InvalidGraphException} for the first expression that does not.
 * <p>
 * This does not change the graph. It is meant to run after tracing and after
 * every optimisation pass while debugging, see {@link io.github.eutro.exprgen.core.passes.Passes#VERIFY_PASSES}.
 */
public class VerifyIntegrity implements InPlaceIRPass<ExpressionGraph> {
    /**
     * An instance of this pass.
     */
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(ExpressionGraph graph) {
        BranchTracker tracker = new BranchTracker();
        for (ExpressionId id : graph.ids()) {
            Expression expr = graph.get(id);
            checkLhs(graph, id, expr);
            checkShape(id, expr);
            checkOperands(graph, id, expr);
            tracker.visit(id, expr);
        }
        tracker.finish(graph);
    }

    private static void checkLhs(ExpressionGraph graph, ExpressionId id, Expression expr) {
        ExpressionId lhs = expr.getLhsId();
        if (expr.definesValue() != expr.hasValidLhs()) {
            throw new InvalidGraphException(expr.definesValue()
                    ? "value-defining expression has no lhs"
                    : "expression that defines no value has an lhs",
                    id, expr);
        }
        if (!expr.hasValidLhs() || lhs.equals(id)) return;
        if (lhs.compareTo(id) > 0) {
            throw new InvalidGraphException("expression assigns to a later variable", id, expr);
        }
        if (!isVariable(graph, lhs)) {
            throw new InvalidGraphException("expression assigns to " + lhs + ", which is not a variable", id, expr);
        }
        ReturnType varType = graph.get(lhs).getReturnType();
        if (varType != expr.getReturnType()) {
            throw new InvalidGraphException(String.format(
                    "expression of type %s assigns to %s, which is %s",
                    expr.getReturnType(),
                    lhs,
                    varType), id, expr);
        }
    }

    // outputs define a value, but only under their binding name
    private static boolean isVariable(ExpressionGraph graph, ExpressionId id) {
        Expression definition = graph.get(id);
        return definition.definesValue()
                && definition.getType() != ExpressionType.OUTPUT_ASSIGNMENT
                && definition.getLhsId().equals(id);
    }

    private static void checkShape(ExpressionId id, Expression expr) {
        int arity = expr.getOperands().size();
        int expectedArity;
        ReturnType expectedReturn;
        switch (expr.getType()) {
            case COMPILE_TIME_CONSTANT:
            case INPUT_ASSIGNMENT:
                expectedArity = 0;
                expectedReturn = ReturnType.SCALAR;
                break;
            case OUTPUT_ASSIGNMENT:
            case ASSIGNMENT:
            case UNARY_ARITHMETIC:
                expectedArity = 1;
                expectedReturn = ReturnType.SCALAR;
                break;
            case BINARY_ARITHMETIC:
                expectedArity = 2;
                expectedReturn = ReturnType.SCALAR;
                break;
            case BINARY_COMPARISON:
                expectedArity = 2;
                expectedReturn = ReturnType.BOOLEAN;
                break;
            case LOGICAL_NEGATION:
                expectedArity = 1;
                expectedReturn = ReturnType.BOOLEAN;
                break;
            case FUNCTION_CALL:
                expectedArity = arity;
                expectedReturn = expr.getReturnType() == ReturnType.BOOLEAN
                        ? ReturnType.BOOLEAN
                        : ReturnType.SCALAR;
                break;
            case IF:
                expectedArity = 1;
                expectedReturn = ReturnType.NONE;
                break;
            default:
                expectedArity = 0;
                expectedReturn = ReturnType.NONE;
                break;
        }
        if (arity != expectedArity) {
            throw new InvalidGraphException(String.format(
                    "expected %d operands, got %d",
                    expectedArity,
                    arity), id, expr);
        }
        if (expr.getReturnType() != expectedReturn) {
            throw new InvalidGraphException(String.format(
                    "expected return type %s, got %s",
                    expectedReturn,
                    expr.getReturnType()), id, expr);
        }
        if (expr.getType() == ExpressionType.NOP && !expr.getName().isEmpty()) {
            throw new InvalidGraphException("no-op with a name", id, expr);
        }
    }

    private static void checkOperands(ExpressionGraph graph, ExpressionId id, Expression expr) {
        List<ExpressionId> operands = expr.getOperands();
        for (ExpressionId operand : operands) {
            if (!graph.isValid(operand)) {
                throw new InvalidGraphException("operand " + operand + " is not in the graph", id, expr);
            }
            if (operand.compareTo(id) >= 0) {
                throw new InvalidGraphException("forward reference to " + operand, id, expr);
            }
            if (!isVariable(graph, operand)) {
                throw new InvalidGraphException(String.format(
                        "operand %s is not a variable: %s",
                        operand,
                        graph.get(operand)), id, expr);
            }
        }
        ReturnType operandType;
        switch (expr.getType()) {
            case IF:
            case LOGICAL_NEGATION:
                operandType = ReturnType.BOOLEAN;
                break;
            case BINARY_COMPARISON:
                switch (expr.getName()) {
                    case "&&":
                    case "||":
                        operandType = ReturnType.BOOLEAN;
                        break;
                    case "==":
                    case "!=":
                        operandType = graph.get(operands.get(0)).getReturnType();
                        break;
                    default:
                        operandType = ReturnType.SCALAR;
                        break;
                }
                break;
            default:
                operandType = ReturnType.SCALAR;
                break;
        }
        for (ExpressionId operand : operands) {
            ReturnType actual = graph.get(operand).getReturnType();
            if (actual != operandType) {
                throw new InvalidGraphException(String.format(
                        "operand %s is %s, expected %s",
                        operand,
                        actual,
                        operandType), id, expr);
            }
        }
    }
}
