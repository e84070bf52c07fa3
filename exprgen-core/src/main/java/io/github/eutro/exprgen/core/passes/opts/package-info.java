/**
 * {@link io.github.eutro.exprgen.core.passes.IRPass IR passes} that perform optimisations.
 * <p>
 * They are not <i>always</i> strictly necessary, but result in better and smaller code.
 * None of them ever remove an expression from a graph, eliminated expressions are
 * turned into no-ops so that ids stay stable.
 */
package io.github.eutro.exprgen.core.passes.opts;
