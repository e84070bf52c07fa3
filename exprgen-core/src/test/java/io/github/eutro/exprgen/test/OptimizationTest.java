package io.github.eutro.exprgen.test;

import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.ir.ExpressionType;
import io.github.eutro.exprgen.core.passes.Passes;
import io.github.eutro.exprgen.core.passes.meta.ComputeRegions;
import io.github.eutro.exprgen.core.passes.meta.VerifyIntegrity;
import io.github.eutro.exprgen.core.passes.opts.EliminateCommonSubexpressions;
import io.github.eutro.exprgen.core.passes.opts.EliminateDeadVars;
import io.github.eutro.exprgen.core.passes.opts.EliminateEmptyBranches;
import io.github.eutro.exprgen.core.passes.opts.IdentityElimination;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.exprgen.test.Utils.id;
import static org.junit.jupiter.api.Assertions.*;

public class OptimizationTest {
    static void assertCopyOf(ExpressionGraph graph, ExpressionId id, ExpressionId source) {
        Expression expr = graph.get(id);
        assertEquals(ExpressionType.ASSIGNMENT, expr.getType(), expr::toString);
        assertEquals(List.of(source), expr.getOperands());
        assertEquals(id, expr.getLhsId());
    }

    static void assertType(ExpressionGraph graph, ExpressionType type, int... ids) {
        for (int i : ids) {
            assertEquals(type, graph.get(id(i)).getType(), () -> "at " + i + " in " + graph);
        }
    }

    @Test
    void testIdentities() {
        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
        ExpressionId zero = graph.insertBack(Expression.createCompileTimeConstant(0));
        ExpressionId one = graph.insertBack(Expression.createCompileTimeConstant(1));
        ExpressionId a = graph.insertBack(Expression.createBinaryArithmetic("+", x, zero));
        ExpressionId b = graph.insertBack(Expression.createBinaryArithmetic("+", zero, x));
        ExpressionId c = graph.insertBack(Expression.createBinaryArithmetic("*", one, x));
        ExpressionId d = graph.insertBack(Expression.createBinaryArithmetic("/", x, one));
        ExpressionId e = graph.insertBack(Expression.createBinaryArithmetic("-", x, zero));
        ExpressionId f = graph.insertBack(Expression.createUnaryArithmetic("+", x));
        ExpressionId g = graph.insertBack(Expression.createBinaryArithmetic("-", zero, x));
        ExpressionId h = graph.insertBack(Expression.createBinaryArithmetic("/", one, x));

        IdentityElimination.INSTANCE.runInPlace(graph);
        for (ExpressionId copy : List.of(a, b, c, d, e, f)) {
            assertCopyOf(graph, copy, x);
        }
        assertEquals(ExpressionType.BINARY_ARITHMETIC, graph.get(g).getType());
        assertEquals(ExpressionType.BINARY_ARITHMETIC, graph.get(h).getType());
        VerifyIntegrity.INSTANCE.runInPlace(graph);
    }

    @Test
    void testIdentityAfterReassignment() {
        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
        ExpressionId zero = graph.insertBack(Expression.createCompileTimeConstant(0));
        graph.insertBack(Expression.createAssignment(zero, x));
        ExpressionId sum = graph.insertBack(Expression.createBinaryArithmetic("+", x, zero));

        IdentityElimination.INSTANCE.runInPlace(graph);
        assertEquals(ExpressionType.BINARY_ARITHMETIC, graph.get(sum).getType());
    }

    @Test
    void testCommonSubexpressions() {
        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
        ExpressionId y = graph.insertBack(Expression.createInputAssignment("y"));
        ExpressionId sum = graph.insertBack(Expression.createBinaryArithmetic("+", x, y));
        ExpressionId sum2 = graph.insertBack(Expression.createBinaryArithmetic("+", x, y));
        ExpressionId swapped = graph.insertBack(Expression.createBinaryArithmetic("+", y, x));
        ExpressionId x2 = graph.insertBack(Expression.createInputAssignment("x"));
        ExpressionId sin = graph.insertBack(Expression.createScalarFunctionCall("sin", List.of(x)));
        ExpressionId sin2 = graph.insertBack(Expression.createScalarFunctionCall("sin", List.of(x)));
        ExpressionId two = graph.insertBack(Expression.createCompileTimeConstant(2));
        ExpressionId two2 = graph.insertBack(Expression.createCompileTimeConstant(2));
        ExpressionId negZero = graph.insertBack(Expression.createCompileTimeConstant(-0.0));
        ExpressionId zero = graph.insertBack(Expression.createCompileTimeConstant(0.0));

        EliminateCommonSubexpressions.INSTANCE.runInPlace(graph);
        assertCopyOf(graph, sum2, sum);
        assertCopyOf(graph, x2, x);
        assertCopyOf(graph, sin2, sin);
        assertCopyOf(graph, two2, two);
        assertEquals(ExpressionType.BINARY_ARITHMETIC, graph.get(swapped).getType());
        assertEquals(ExpressionType.COMPILE_TIME_CONSTANT, graph.get(negZero).getType());
        assertEquals(ExpressionType.COMPILE_TIME_CONSTANT, graph.get(zero).getType());
        VerifyIntegrity.INSTANCE.runInPlace(graph);
    }

    @Test
    void testCommonSubexpressionsAcrossBranches() {
        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
        ExpressionId y = graph.insertBack(Expression.createInputAssignment("y"));
        ExpressionId before = graph.insertBack(Expression.createBinaryArithmetic("*", x, y));
        ExpressionId cond = graph.insertBack(Expression.createBinaryComparison("<", x, y));
        graph.insertBack(Expression.createIf(cond));
        ExpressionId inThen = graph.insertBack(Expression.createBinaryArithmetic("*", x, y));
        ExpressionId thenOnly = graph.insertBack(Expression.createBinaryArithmetic("-", x, y));
        graph.insertBack(Expression.createElse());
        ExpressionId inElse = graph.insertBack(Expression.createBinaryArithmetic("-", x, y));
        graph.insertBack(Expression.createEndIf());
        ExpressionId after = graph.insertBack(Expression.createBinaryArithmetic("-", x, y));

        ComputeRegions.Regions regions = ComputeRegions.INSTANCE.run(graph);
        assertTrue(regions.isAvailableAt(before, inThen));
        assertFalse(regions.isAvailableAt(thenOnly, inElse));
        assertFalse(regions.isAvailableAt(thenOnly, after));
        assertFalse(regions.isAvailableAt(inThen, before));

        EliminateCommonSubexpressions.INSTANCE.runInPlace(graph);
        // available from before the branch
        assertCopyOf(graph, inThen, before);
        // only assigned on one path
        assertEquals(ExpressionType.BINARY_ARITHMETIC, graph.get(thenOnly).getType());
        assertEquals(ExpressionType.BINARY_ARITHMETIC, graph.get(inElse).getType());
        assertEquals(ExpressionType.BINARY_ARITHMETIC, graph.get(after).getType());
        VerifyIntegrity.INSTANCE.runInPlace(graph);
    }

    @Test
    void testCommonSubexpressionsAfterWrites() {
        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
        ExpressionId y = graph.insertBack(Expression.createInputAssignment("y"));
        ExpressionId sum = graph.insertBack(Expression.createBinaryArithmetic("+", x, y));
        ExpressionId one = graph.insertBack(Expression.createCompileTimeConstant(1));
        // x = 1
        graph.insertBack(Expression.createAssignment(x, one));
        ExpressionId sum2 = graph.insertBack(Expression.createBinaryArithmetic("+", x, y));
        ExpressionId sum3 = graph.insertBack(Expression.createBinaryArithmetic("+", x, y));
        // v_5 = y
        graph.insertBack(Expression.createAssignment(sum2, y));
        ExpressionId sum4 = graph.insertBack(Expression.createBinaryArithmetic("+", x, y));

        EliminateCommonSubexpressions.INSTANCE.runInPlace(graph);
        assertEquals(ExpressionType.BINARY_ARITHMETIC, graph.get(sum).getType());
        assertEquals(ExpressionType.BINARY_ARITHMETIC, graph.get(sum2).getType());
        assertCopyOf(graph, sum3, sum2);
        // v_5 is overwritten, and v_6 is only a copy
        assertEquals(ExpressionType.BINARY_ARITHMETIC, graph.get(sum4).getType());
        VerifyIntegrity.INSTANCE.runInPlace(graph);
    }

    @Test
    void testBooleansNotMerged() {
        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
        graph.insertBack(Expression.createBinaryComparison("<", x, x));
        ExpressionId c2 = graph.insertBack(Expression.createBinaryComparison("<", x, x));

        EliminateCommonSubexpressions.INSTANCE.runInPlace(graph);
        assertEquals(ExpressionType.BINARY_COMPARISON, graph.get(c2).getType());
    }

    @Test
    void testDeadVars() {
        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
        ExpressionId y = graph.insertBack(Expression.createInputAssignment("y"));
        ExpressionId two = graph.insertBack(Expression.createCompileTimeConstant(2));
        ExpressionId unused = graph.insertBack(Expression.createBinaryArithmetic("*", y, two));
        ExpressionId used = graph.insertBack(Expression.createBinaryArithmetic("+", x, x));
        graph.insertBack(Expression.createComment("result"));
        graph.insertBack(Expression.createOutputAssignment(used, "r"));
        // reassigned, but never read
        ExpressionId local = graph.insertBack(Expression.createAssignment(ExpressionId.INVALID, x));
        graph.insertBack(Expression.createAssignment(local, used));

        EliminateDeadVars.INSTANCE.runInPlace(graph);
        assertType(graph, ExpressionType.NOP, 1, 2, 3, 7, 8);
        assertType(graph, ExpressionType.INPUT_ASSIGNMENT, 0);
        assertType(graph, ExpressionType.BINARY_ARITHMETIC, 4);
        assertType(graph, ExpressionType.COMMENT, 5);
        assertType(graph, ExpressionType.OUTPUT_ASSIGNMENT, 6);
        assertFalse(graph.get(unused).hasValidLhs());
        VerifyIntegrity.INSTANCE.runInPlace(graph);
    }

    @Test
    void testReadLocalKept() {
        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
        ExpressionId y = graph.insertBack(Expression.createInputAssignment("y"));
        ExpressionId local = graph.insertBack(Expression.createAssignment(ExpressionId.INVALID, x));
        ExpressionId cond = graph.insertBack(Expression.createBinaryComparison(">", y, x));
        graph.insertBack(Expression.createIf(cond));
        graph.insertBack(Expression.createAssignment(local, y));
        graph.insertBack(Expression.createEndIf());
        graph.insertBack(Expression.createOutputAssignment(local, "max"));

        int size = graph.size();
        EliminateDeadVars.INSTANCE.runInPlace(graph);
        for (ExpressionId id : graph.ids()) {
            assertNotEquals(ExpressionType.NOP, graph.get(id).getType(), id::toString);
        }
        assertEquals(size, graph.size());
    }

    @Test
    void testEmptyBranches() {
        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
        ExpressionId y = graph.insertBack(Expression.createInputAssignment("y"));
        ExpressionId cond = graph.insertBack(Expression.createBinaryComparison("<", x, y));
        graph.insertBack(Expression.createIf(cond));
        graph.insertBack(Expression.createBinaryArithmetic("*", x, y));
        graph.insertBack(Expression.createIf(cond));
        graph.insertBack(Expression.createElse());
        graph.insertBack(Expression.createEndIf());
        graph.insertBack(Expression.createElse());
        graph.insertBack(Expression.createEndIf());
        graph.insertBack(Expression.createOutputAssignment(x, "r"));

        Passes.OPTIMIZE.run(graph);
        assertType(graph, ExpressionType.NOP, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        assertType(graph, ExpressionType.INPUT_ASSIGNMENT, 0);
        assertType(graph, ExpressionType.OUTPUT_ASSIGNMENT, 10);
        VerifyIntegrity.INSTANCE.runInPlace(graph);
    }

    @Test
    void testLiveBranchesKept() {
        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
        ExpressionId cond = graph.insertBack(Expression.createLogicalFunctionCall("isnan", List.of(x)));
        graph.insertBack(Expression.createIf(cond));
        graph.insertBack(Expression.createIf(cond));
        graph.insertBack(Expression.createComment("nan"));
        graph.insertBack(Expression.createEndIf());
        graph.insertBack(Expression.createElse());
        graph.insertBack(Expression.createEndIf());

        EliminateEmptyBranches.INSTANCE.runInPlace(graph);
        assertType(graph, ExpressionType.IF, 2, 3);
        assertType(graph, ExpressionType.END_IF, 5, 7);
        assertType(graph, ExpressionType.ELSE, 6);
    }

    @Test
    void testOptimizeLessThan() {
        ExpressionGraph graph = Utils.lessThanGraph();
        graph.insertBack(Expression.createOutputAssignment(id(1), "r"));

        Passes.OPTIMIZE.run(graph);
        VerifyIntegrity.INSTANCE.runInPlace(graph);
        for (ExpressionId id : graph.ids()) {
            assertNotEquals(ExpressionType.NOP, graph.get(id).getType(), id::toString);
        }
    }
}
