package io.github.eutro.exprgen.trace;

import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * {@link Scalars} that record every operation into an {@link ExpressionGraph},
 * in the order they are called.
 * <p>
 * Both branches of every {@link #branch(ExpressionId, Runnable, Runnable) conditional} are run,
 * between {@code IF}, {@code ELSE} and {@code END_IF} expressions.
 */
public final class TracingScalars implements Scalars<ExpressionId, ExpressionId> {
    private final ExpressionGraph graph;

    public TracingScalars() {
        this(new ExpressionGraph());
    }

    /**
     * Construct tracing scalars that append to an existing graph.
     *
     * @param graph The graph.
     */
    public TracingScalars(@NotNull ExpressionGraph graph) {
        this.graph = graph;
    }

    @Contract(pure = true)
    public ExpressionGraph getGraph() {
        return graph;
    }

    private ExpressionId emit(Expression expr) {
        return graph.insertBack(expr);
    }

    @Override
    public @NotNull ExecutionMode mode() {
        return ExecutionMode.TRACE;
    }

    @Override
    public ExpressionId constant(double value) {
        return emit(Expression.createCompileTimeConstant(value));
    }

    @Override
    public ExpressionId input(String name) {
        return emit(Expression.createInputAssignment(name));
    }

    @Override
    public void output(String name, ExpressionId value) {
        emit(Expression.createOutputAssignment(value, name));
    }

    @Override
    public ExpressionId add(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryArithmetic("+", a, b));
    }

    @Override
    public ExpressionId sub(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryArithmetic("-", a, b));
    }

    @Override
    public ExpressionId mul(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryArithmetic("*", a, b));
    }

    @Override
    public ExpressionId div(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryArithmetic("/", a, b));
    }

    @Override
    public ExpressionId negate(ExpressionId a) {
        return emit(Expression.createUnaryArithmetic("-", a));
    }

    @Override
    public ExpressionId call(String function, List<ExpressionId> args) {
        return emit(Expression.createScalarFunctionCall(function, args));
    }

    @Override
    public ExpressionId predicate(String function, List<ExpressionId> args) {
        return emit(Expression.createLogicalFunctionCall(function, args));
    }

    @Override
    public ExpressionId lt(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryComparison("<", a, b));
    }

    @Override
    public ExpressionId le(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryComparison("<=", a, b));
    }

    @Override
    public ExpressionId gt(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryComparison(">", a, b));
    }

    @Override
    public ExpressionId ge(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryComparison(">=", a, b));
    }

    @Override
    public ExpressionId eq(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryComparison("==", a, b));
    }

    @Override
    public ExpressionId ne(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryComparison("!=", a, b));
    }

    @Override
    public ExpressionId and(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryComparison("&&", a, b));
    }

    @Override
    public ExpressionId or(ExpressionId a, ExpressionId b) {
        return emit(Expression.createBinaryComparison("||", a, b));
    }

    @Override
    public ExpressionId not(ExpressionId a) {
        return emit(Expression.createLogicalNegation(a));
    }

    /**
     * {@inheritDoc}
     * <p>
     * This declares a new variable, initialised by copying {@code initial}.
     * Reads copy the variable again, since it may be reassigned later.
     */
    @Override
    public Local<ExpressionId> local(ExpressionId initial) {
        ExpressionId variable = emit(Expression.createAssignment(ExpressionId.INVALID, initial));
        return new Local<ExpressionId>() {
            @Override
            public ExpressionId get() {
                return emit(Expression.createAssignment(ExpressionId.INVALID, variable));
            }

            @Override
            public void set(ExpressionId value) {
                emit(Expression.createAssignment(variable, value));
            }
        };
    }

    @Override
    public void branch(ExpressionId condition, Runnable ifTrue, Runnable ifFalse) {
        emit(Expression.createIf(condition));
        ifTrue.run();
        emit(Expression.createElse());
        ifFalse.run();
        emit(Expression.createEndIf());
    }

    @Override
    public void branch(ExpressionId condition, Runnable ifTrue) {
        emit(Expression.createIf(condition));
        ifTrue.run();
        emit(Expression.createEndIf());
    }

    @Override
    public void comment(String text) {
        emit(Expression.createComment(text));
    }
}
