package io.github.eutro.exprgen.core.passes.convert;

import io.github.eutro.exprgen.core.conf.FunctionTable;
import io.github.eutro.exprgen.core.conf.SourceConventions;
import io.github.eutro.exprgen.core.ir.BranchTracker;
import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.ir.ExpressionType;
import io.github.eutro.exprgen.core.passes.IRPass;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A pass which prints a graph as the body of a Java method, one statement per expression:
 * <pre>
 * double v_0;
 * double v_1;
 * boolean v_2;
 *
 * v_0 = a;
 * v_1 = b;
 * v_2 = v_0 &lt; v_1;
 * if (v_2) {
 *   ...
 * } else {
 *   ...
 * }
 * residuals[0] = v_1;
 * </pre>
 * Variables are all declared up front, since they may be assigned in one branch and read after it.
 * {@link ExpressionType#NOP No-ops} print nothing, and comments print one {@code //} line per line of text.
 */
public class GraphToSource implements IRPass<ExpressionGraph, String> {
    /**
     * An instance of this pass, with {@link SourceConventions#DEFAULT default conventions}.
     */
    public static final GraphToSource INSTANCE = new GraphToSource(SourceConventions.DEFAULT);

    private final SourceConventions conventions;

    public GraphToSource(SourceConventions conventions) {
        this.conventions = conventions;
    }

    @Override
    public String run(ExpressionGraph graph) {
        StringBuilder sb = new StringBuilder();
        boolean declared = false;
        for (ExpressionId id : graph.ids()) {
            Expression expr = graph.get(id);
            if (!expr.definesValue()
                    || expr.getType() == ExpressionType.OUTPUT_ASSIGNMENT
                    || !id.equals(expr.getLhsId())) {
                continue;
            }
            sb.append(conventions.typeName(expr.getReturnType()))
                    .append(' ')
                    .append(conventions.variableName(id))
                    .append(";\n");
            declared = true;
        }
        if (declared) sb.append('\n');

        BranchTracker tracker = new BranchTracker();
        for (ExpressionId id : graph.ids()) {
            Expression expr = graph.get(id);
            int depth = tracker.depth();
            tracker.visit(id, expr);
            if (expr.getType() == ExpressionType.NOP) continue;
            if (expr.getType() == ExpressionType.ELSE || expr.getType() == ExpressionType.END_IF) {
                depth--;
            }
            for (String line : statement(expr).split("\n", -1)) {
                for (int i = 0; i < depth; i++) {
                    sb.append(conventions.getIndent());
                }
                sb.append(line).append('\n');
            }
        }
        tracker.finish(graph);
        return sb.toString();
    }

    private String statement(Expression expr) {
        List<ExpressionId> operands = expr.getOperands();
        switch (expr.getType()) {
            case COMPILE_TIME_CONSTANT:
                return assign(expr, conventions.formatConstant(expr.getValue()));
            case INPUT_ASSIGNMENT:
                return assign(expr, expr.getName());
            case OUTPUT_ASSIGNMENT:
                return expr.getName() + " = " + var(operands.get(0)) + ";";
            case ASSIGNMENT:
                return assign(expr, var(operands.get(0)));
            case BINARY_ARITHMETIC:
            case BINARY_COMPARISON:
                return assign(expr, var(operands.get(0)) + " " + expr.getName() + " " + var(operands.get(1)));
            case UNARY_ARITHMETIC:
                return assign(expr, expr.getName() + var(operands.get(0)));
            case LOGICAL_NEGATION:
                return assign(expr, "!" + var(operands.get(0)));
            case FUNCTION_CALL: {
                FunctionTable.Entry function = conventions.getFunctions().lookup(expr.getName());
                String callee = function == null ? expr.getName() : function.getSourceName();
                return assign(expr, operands.stream()
                        .map(this::var)
                        .collect(Collectors.joining(", ", callee + "(", ")")));
            }
            case IF:
                return "if (" + var(operands.get(0)) + ") {";
            case ELSE:
                return "} else {";
            case END_IF:
                return "}";
            case COMMENT:
                return Arrays.stream(expr.getName().split("\\R", -1))
                        .map(line -> "// " + line)
                        .collect(Collectors.joining("\n"));
            default:
                throw new IllegalStateException("cannot print " + expr);
        }
    }

    private String assign(Expression expr, String rhs) {
        return var(expr.getLhsId()) + " = " + rhs + ";";
    }

    private String var(ExpressionId id) {
        return conventions.variableName(id);
    }
}
