package io.github.eutro.exprgen.core.passes.meta;

import io.github.eutro.exprgen.core.ir.BranchTracker;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.passes.IRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which computes which branch regions each expression of a graph is in.
 */
public class ComputeRegions implements IRPass<ExpressionGraph, ComputeRegions.Regions> {
    /**
     * An instance of this pass.
     */
    public static final ComputeRegions INSTANCE = new ComputeRegions();

    @Override
    public Regions run(ExpressionGraph graph) {
        BranchTracker tracker = new BranchTracker();
        List<List<BranchTracker.Region>> regions = new ArrayList<>(graph.size());
        for (ExpressionId id : graph.ids()) {
            regions.add(tracker.currentRegions());
            tracker.visit(id, graph.get(id));
        }
        tracker.finish(graph);
        return new Regions(regions);
    }

    /**
     * The branch regions of each expression in a graph.
     */
    public static final class Regions {
        private final List<List<BranchTracker.Region>> regions;

        private Regions(List<List<BranchTracker.Region>> regions) {
            this.regions = regions;
        }

        /**
         * Get the regions an expression is in, outermost first.
         *
         * @param id The expression.
         * @return The regions, empty if it is not in any branch.
         */
        public List<BranchTracker.Region> of(ExpressionId id) {
            return regions.get(id.index());
        }

        /**
         * Get whether the variable defined at {@code def} has certainly been
         * assigned by the time {@code use} executes, on every path.
         * <p>
         * This is the case if {@code def} comes first, and every region {@code def}
         * is in also contains {@code use}.
         *
         * @param def The defining expression.
         * @param use The using expression.
         * @return Whether def is available at use.
         */
        public boolean isAvailableAt(ExpressionId def, ExpressionId use) {
            if (def.compareTo(use) >= 0) return false;
            List<BranchTracker.Region> defRegions = of(def);
            List<BranchTracker.Region> useRegions = of(use);
            return defRegions.size() <= useRegions.size()
                    && useRegions.subList(0, defRegions.size()).equals(defRegions);
        }
    }
}
