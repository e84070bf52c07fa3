package io.github.eutro.exprgen.trace;

/**
 * A mutable variable in a {@link TracedFunction}, which may be assigned in a branch
 * and read after it.
 *
 * @param <S> The scalar type.
 */
public interface Local<S> {
    /**
     * Read the current value of this variable.
     * <p>
     * The result is unaffected by later calls to {@link #set(Object)}.
     *
     * @return The value.
     */
    S get();

    /**
     * Assign to this variable.
     *
     * @param value The new value.
     */
    void set(S value);
}
