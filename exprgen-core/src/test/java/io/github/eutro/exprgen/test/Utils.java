package io.github.eutro.exprgen.test;

import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;

public class Utils {
    /**
     * <pre>
     * 0: a
     * 1: b
     * 2: a &lt; b
     * 3: if (v_2) {
     * 4:   3.0
     * 5:   v_1 = v_4
     * 6: } else {
     * 7:   4.0
     * 8:   v_1 = v_7
     * 9: }
     * </pre>
     */
    public static ExpressionGraph lessThanGraph() {
        ExpressionGraph graph = new ExpressionGraph();
        ExpressionId a = graph.insertBack(Expression.createInputAssignment("a"));
        ExpressionId b = graph.insertBack(Expression.createInputAssignment("b"));
        ExpressionId cond = graph.insertBack(Expression.createBinaryComparison("<", a, b));
        graph.insertBack(Expression.createIf(cond));
        ExpressionId three = graph.insertBack(Expression.createCompileTimeConstant(3.0));
        graph.insertBack(Expression.createAssignment(b, three));
        graph.insertBack(Expression.createElse());
        ExpressionId four = graph.insertBack(Expression.createCompileTimeConstant(4.0));
        graph.insertBack(Expression.createAssignment(b, four));
        graph.insertBack(Expression.createEndIf());
        return graph;
    }

    public static ExpressionId id(int index) {
        return ExpressionId.of(index);
    }
}
