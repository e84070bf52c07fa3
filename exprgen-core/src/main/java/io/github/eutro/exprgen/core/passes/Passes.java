package io.github.eutro.exprgen.core.passes;

import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.passes.meta.VerifyIntegrity;
import io.github.eutro.exprgen.core.passes.opts.EliminateCommonSubexpressions;
import io.github.eutro.exprgen.core.passes.opts.EliminateDeadVars;
import io.github.eutro.exprgen.core.passes.opts.EliminateEmptyBranches;
import io.github.eutro.exprgen.core.passes.opts.IdentityElimination;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * Whether graphs should be verified around every pass built with {@link #verifying(IRPass)},
     * and after tracing. Costly, so only on while debugging.
     */
    public static boolean VERIFY_PASSES = System.getenv("EXPRGEN_VERIFY_PASSES") != null;

    /**
     * Wrap an in-place pass so that the graph is {@link VerifyIntegrity verified}
     * before and after it runs, if {@link #VERIFY_PASSES} is set when it runs.
     *
     * @param pass The pass.
     * @return The verifying pass.
     */
    public static InPlaceIRPass<ExpressionGraph> verifying(IRPass<ExpressionGraph, ExpressionGraph> pass) {
        return InPlaceIRPass.named(pass.getName(), graph -> {
            if (VERIFY_PASSES) VerifyIntegrity.INSTANCE.runInPlace(graph);
            pass.run(graph);
            if (VERIFY_PASSES) VerifyIntegrity.INSTANCE.runInPlace(graph);
        });
    }

    /**
     * Simple optimisation passes to run on a traced graph.
     */
    public static final IRPass<ExpressionGraph, ExpressionGraph> OPTIMIZE =
            verifying(IdentityElimination.INSTANCE)
                    .then(verifying(EliminateCommonSubexpressions.INSTANCE))
                    .then(verifying(EliminateDeadVars.INSTANCE))
                    .then(verifying(EliminateEmptyBranches.INSTANCE))
                    .then(verifying(EliminateDeadVars.INSTANCE));
}
