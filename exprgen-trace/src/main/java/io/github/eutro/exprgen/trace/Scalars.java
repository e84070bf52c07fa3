package io.github.eutro.exprgen.trace;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The operations available to a {@link TracedFunction}, implemented either by
 * computing on numbers, or by recording expressions into a graph.
 * <p>
 * This replaces language level {@code if}/{@code else} with {@link #branch(Object, Runnable, Runnable)},
 * which either takes one branch or records both, depending on the {@link #mode()}.
 *
 * @param <S> The scalar type.
 * @param <B> The boolean type.
 */
public interface Scalars<S, B> {
    @Contract(pure = true)
    @NotNull ExecutionMode mode();

    S constant(double value);

    /**
     * Read a named input of the function.
     *
     * @param name The name of the input.
     * @return The value of the input.
     */
    S input(String name);

    /**
     * Write a named output of the function.
     *
     * @param name  The name of the output.
     * @param value The value to write.
     */
    void output(String name, S value);

    S add(S a, S b);

    S sub(S a, S b);

    S mul(S a, S b);

    S div(S a, S b);

    S negate(S a);

    /**
     * Call a scalar function, such as {@code sin}.
     *
     * @param function The name of the function.
     * @param args     The arguments.
     * @return The result.
     */
    S call(String function, List<S> args);

    default S call(String function, S arg) {
        return call(function, Collections.singletonList(arg));
    }

    default S call(String function, S arg0, S arg1) {
        return call(function, Arrays.asList(arg0, arg1));
    }

    /**
     * Call a boolean function, such as {@code isfinite}.
     *
     * @param function The name of the function.
     * @param args     The arguments.
     * @return The result.
     */
    B predicate(String function, List<S> args);

    default B predicate(String function, S arg) {
        return predicate(function, Collections.singletonList(arg));
    }

    B lt(S a, S b);

    B le(S a, S b);

    B gt(S a, S b);

    B ge(S a, S b);

    B eq(S a, S b);

    B ne(S a, S b);

    B and(B a, B b);

    B or(B a, B b);

    B not(B a);

    /**
     * Declare a mutable variable.
     *
     * @param initial The initial value.
     * @return The variable.
     */
    Local<S> local(S initial);

    /**
     * Run code conditionally.
     *
     * @param condition The condition.
     * @param ifTrue    What to run if the condition holds.
     * @param ifFalse   What to run otherwise.
     */
    void branch(B condition, Runnable ifTrue, Runnable ifFalse);

    /**
     * Run code conditionally, with no else branch.
     *
     * @param condition The condition.
     * @param ifTrue    What to run if the condition holds.
     */
    void branch(B condition, Runnable ifTrue);

    /**
     * Leave a comment in the generated code. Does nothing when evaluating.
     *
     * @param text The text of the comment.
     */
    void comment(String text);
}
