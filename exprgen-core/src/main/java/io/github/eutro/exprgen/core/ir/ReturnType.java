package io.github.eutro.exprgen.core.ir;

/**
 * The kind of value an {@link Expression} produces.
 */
public enum ReturnType {
    /**
     * A floating point value. Most arithmetic and function calls return this.
     */
    SCALAR,
    /**
     * A truth value, from comparisons, negations, and predicate function calls,
     * such as {@code v_3 = v_1 < v_2} or {@code v_3 = isfinite(v_1)}.
     */
    BOOLEAN,
    /**
     * No value. Only for control markers, comments and no-ops.
     */
    NONE,
}
