package io.github.eutro.exprgen.core.passes.opts;

import io.github.eutro.exprgen.core.ir.Expression;
import io.github.eutro.exprgen.core.ir.ExpressionGraph;
import io.github.eutro.exprgen.core.ir.ExpressionId;
import io.github.eutro.exprgen.core.ir.ExpressionType;
import io.github.eutro.exprgen.core.passes.InPlaceIRPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * A pass which turns if/else/end-if groups that contain only {@link ExpressionType#NOP no-ops}
 * into no-ops themselves. Nested groups are removed innermost first, so
 * an if whose branches only contain empty ifs is also removed.
 * <p>
 * The condition is left in place, {@link EliminateDeadVars} may remove it afterwards.
 */
public class EliminateEmptyBranches implements InPlaceIRPass<ExpressionGraph> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EliminateEmptyBranches.class);

    /**
     * An instance of this pass.
     */
    public static final EliminateEmptyBranches INSTANCE = new EliminateEmptyBranches();

    @Override
    public void runInPlace(ExpressionGraph graph) {
        Deque<Frame> frames = new ArrayDeque<>();
        int eliminated = 0;
        for (ExpressionId id : graph.ids()) {
            Expression expr = graph.get(id);
            switch (expr.getType()) {
                case IF:
                    frames.push(new Frame(id));
                    break;
                case ELSE:
                    if (frames.isEmpty()) continue;
                    frames.peek().elseId = id;
                    break;
                case END_IF: {
                    if (frames.isEmpty()) continue;
                    Frame frame = frames.pop();
                    if (frame.live) {
                        markLive(frames);
                    } else {
                        graph.get(frame.ifId).makeNop();
                        if (frame.elseId.isValid()) {
                            graph.get(frame.elseId).makeNop();
                        }
                        expr.makeNop();
                        eliminated++;
                    }
                    break;
                }
                case NOP:
                    break;
                default:
                    markLive(frames);
                    break;
            }
        }
        LOGGER.debug("eliminated {} empty conditionals", eliminated);
    }

    private static void markLive(Deque<Frame> frames) {
        Frame top = frames.peek();
        if (top != null) top.live = true;
    }

    private static class Frame {
        final ExpressionId ifId;
        ExpressionId elseId = ExpressionId.INVALID;
        boolean live;

        Frame(ExpressionId ifId) {
            this.ifId = ifId;
        }
    }
}
