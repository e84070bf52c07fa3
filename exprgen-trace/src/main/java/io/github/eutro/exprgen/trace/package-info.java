/**
 * Recording numeric functions as expression graphs.
 * <p>
 * A {@link io.github.eutro.exprgen.trace.TracedFunction} is written once against
 * {@link io.github.eutro.exprgen.trace.Scalars}, and can then be
 * {@link io.github.eutro.exprgen.trace.Tracer#evaluate evaluated} on numbers, or
 * {@link io.github.eutro.exprgen.trace.Tracer#trace traced} into an
 * {@link io.github.eutro.exprgen.core.ir.ExpressionGraph}, one expression per operation.
 */
package io.github.eutro.exprgen.trace;
