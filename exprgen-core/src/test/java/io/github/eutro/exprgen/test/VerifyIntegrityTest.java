package io.github.eutro.exprgen.test;

import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.ir.ExpressionType;
import io.github.eutro.exprgen.core.ir.InvalidGraphException;
import io.github.eutro.exprgen.core.ir.ReturnType;
import io.github.eutro.exprgen.core.passes.meta.VerifyIntegrity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Consumer;

import static io.github.eutro.exprgen.test.Utils.id;
import static org.junit.jupiter.api.Assertions.*;

public class VerifyIntegrityTest {
    static InvalidGraphException assertInvalid(Consumer<ExpressionGraph> build) {
        ExpressionGraph graph = new ExpressionGraph();
        build.accept(graph);
        return assertThrows(InvalidGraphException.class, () -> VerifyIntegrity.INSTANCE.runInPlace(graph));
    }

    @Test
    void testValid() {
        VerifyIntegrity.INSTANCE.runInPlace(Utils.lessThanGraph());
        VerifyIntegrity.INSTANCE.runInPlace(new ExpressionGraph());
    }

    @Test
    void testTombstonesAreValid() {
        ExpressionGraph graph = Utils.lessThanGraph();
        graph.get(id(7)).makeNop();
        graph.get(id(8)).makeNop();
        VerifyIntegrity.INSTANCE.runInPlace(graph);
    }

    @Test
    void testForwardReference() {
        InvalidGraphException e = assertInvalid(graph -> {
            graph.insertBack(Expression.createUnaryArithmetic("-", id(1)));
            graph.insertBack(Expression.createInputAssignment("x"));
        });
        assertEquals(id(0), e.getId());
        assertEquals(ExpressionType.UNARY_ARITHMETIC, e.getType());
        assertEquals(List.of(id(1)), e.getOperands());
    }

    @Test
    void testMissingOperand() {
        assertInvalid(graph -> graph.insertBack(Expression.createOutputAssignment(id(5), "y")));
        assertInvalid(graph -> graph.insertBack(Expression.createOutputAssignment(ExpressionId.INVALID, "y")));
    }

    @Test
    void testLhs() {
        // lhs removed after insertion
        assertInvalid(graph -> {
            ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
            graph.get(x).setLhsId(ExpressionId.INVALID);
        });
        // control with an lhs
        assertInvalid(graph -> {
            ExpressionId c = graph.insertBack(Expression.createComment("c"));
            graph.get(c).setLhsId(c);
        });
        // assignment to a later variable
        assertInvalid(graph -> {
            ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
            graph.insertBack(Expression.createAssignment(id(2), x));
            graph.insertBack(Expression.createInputAssignment("y"));
        });
        // assignment to something that is not a variable
        assertInvalid(graph -> {
            ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
            ExpressionId out = graph.insertBack(Expression.createComment("not a variable"));
            graph.insertBack(Expression.createAssignment(out, x));
        });
    }

    @Test
    void testReassignmentType() {
        // a scalar copied into a boolean
        InvalidGraphException e = assertInvalid(graph -> {
            ExpressionId a = graph.insertBack(Expression.createInputAssignment("a"));
            ExpressionId b = graph.insertBack(Expression.createInputAssignment("b"));
            ExpressionId c = graph.insertBack(Expression.createBinaryComparison("<", a, b));
            graph.insertBack(Expression.createAssignment(c, a));
        });
        assertEquals(id(3), e.getId());
        assertTrue(e.getMessage().startsWith("expression of type SCALAR assigns to v_2, which is BOOLEAN"),
                e::getMessage);

        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId a = graph.insertBack(Expression.createInputAssignment("a"));
        ExpressionId b = graph.insertBack(Expression.createInputAssignment("b"));
        graph.insertBack(Expression.createAssignment(a, b));
        VerifyIntegrity.INSTANCE.runInPlace(graph);
    }

    @Test
    void testReadingOutput() {
        InvalidGraphException e = assertInvalid(graph -> {
            ExpressionId a = graph.insertBack(Expression.createInputAssignment("a"));
            ExpressionId r = graph.insertBack(Expression.createOutputAssignment(a, "r"));
            graph.insertBack(Expression.createOutputAssignment(r, "s"));
        });
        assertEquals(id(2), e.getId());
        assertEquals(List.of(id(1)), e.getOperands());

        // nor can an output be assigned to
        assertInvalid(graph -> {
            ExpressionId a = graph.insertBack(Expression.createInputAssignment("a"));
            ExpressionId r = graph.insertBack(Expression.createOutputAssignment(a, "r"));
            graph.insertBack(Expression.createAssignment(r, a));
        });
    }

    @Test
    void testReadingReassignment() {
        // a reassignment is not itself a variable
        InvalidGraphException e = assertInvalid(graph -> {
            ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
            ExpressionId y = graph.insertBack(Expression.createInputAssignment("y"));
            ExpressionId write = graph.insertBack(Expression.createAssignment(x, y));
            graph.insertBack(Expression.createUnaryArithmetic("-", write));
        });
        assertEquals(id(3), e.getId());
    }

    @Test
    void testTypes() {
        // arithmetic on a boolean
        assertInvalid(graph -> {
            ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
            ExpressionId c = graph.insertBack(Expression.createBinaryComparison("<", x, x));
            graph.insertBack(Expression.createBinaryArithmetic("+", x, c));
        });
        // branching on a scalar
        assertInvalid(graph -> {
            ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
            graph.insertBack(Expression.createIf(x));
            graph.insertBack(Expression.createEndIf());
        });
        // negating a scalar
        assertInvalid(graph -> {
            ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
            graph.insertBack(Expression.createLogicalNegation(x));
        });
        // && on scalars
        assertInvalid(graph -> {
            ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
            graph.insertBack(Expression.createBinaryComparison("&&", x, x));
        });
        // == on mixed types
        assertInvalid(graph -> {
            ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
            ExpressionId c = graph.insertBack(Expression.createLogicalFunctionCall("isnan", List.of(x)));
            graph.insertBack(Expression.createBinaryComparison("==", c, x));
        });

        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId x = graph.insertBack(Expression.createInputAssignment("x"));
        ExpressionId nan = graph.insertBack(Expression.createLogicalFunctionCall("isnan", List.of(x)));
        ExpressionId inf = graph.insertBack(Expression.createLogicalFunctionCall("isinf", List.of(x)));
        ExpressionId either = graph.insertBack(Expression.createBinaryComparison("||", nan, inf));
        ExpressionId same = graph.insertBack(Expression.createBinaryComparison("==", nan, either));
        graph.insertBack(Expression.createIf(graph.insertBack(Expression.createLogicalNegation(same))));
        graph.insertBack(Expression.createEndIf());
        VerifyIntegrity.INSTANCE.runInPlace(graph);
    }

    @Test
    void testShape() {
        assertInvalid(graph -> graph.insertBack(new Expression(
                ExpressionType.BINARY_ARITHMETIC,
                ReturnType.SCALAR,
                ExpressionId.INVALID,
                List.of(),
                "+",
                0)));
        assertInvalid(graph -> graph.insertBack(new Expression(
                ExpressionType.COMPILE_TIME_CONSTANT,
                ReturnType.BOOLEAN,
                ExpressionId.INVALID,
                List.of(),
                "",
                1)));
        assertInvalid(graph -> graph.insertBack(new Expression(
                ExpressionType.NOP,
                ReturnType.NONE,
                ExpressionId.INVALID,
                List.of(),
                "leftover",
                0)));
    }

    @Test
    void testMessage() {
        InvalidGraphException e = assertInvalid(graph -> graph.insertBack(Expression.createEndIf()));
        assertEquals("end-if without matching if\n  at: v_0\n  expression: end_if", e.getMessage());
    }
}
