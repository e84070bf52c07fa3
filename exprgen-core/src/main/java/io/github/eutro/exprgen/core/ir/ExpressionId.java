package io.github.eutro.exprgen.core.ir;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The identity of an {@link Expression} in an {@link ExpressionGraph}.
 * <p>
 * An id is the position of the expression in its graph, and also names the variable
 * (<code>v_<i>n</i></code>) the expression at that position defines. Ids are handed
 * out by the owning graph, and are never reused, so they stay valid for as long as
 * the graph exists.
 * <p>
 * This wraps an {@code int} only so that ids can not be mixed up with unrelated
 * integers; there is no arithmetic on ids.
 */
public final class ExpressionId implements Comparable<ExpressionId> {
    /**
     * The sentinel for an absent id.
     */
    public static final ExpressionId INVALID = new ExpressionId(-1);

    private final int index;

    private ExpressionId(int index) {
        this.index = index;
    }

    /**
     * Get the id at the given position.
     *
     * @param index The position, which must not be negative.
     * @return The id.
     */
    @Contract(pure = true)
    public static ExpressionId of(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("negative expression index: " + index);
        }
        return new ExpressionId(index);
    }

    /**
     * Get the position this id refers to.
     *
     * @return The position, or -1 for {@link #INVALID}.
     */
    public int index() {
        return index;
    }

    /**
     * Get whether this is a real id, rather than {@link #INVALID}.
     *
     * @return Whether this id is valid.
     */
    public boolean isValid() {
        return index >= 0;
    }

    @Override
    public int compareTo(@NotNull ExpressionId o) {
        return Integer.compare(index, o.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return index == ((ExpressionId) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return isValid() ? "v_" + index : "<invalid>";
    }
}
