package io.github.eutro.exprgen.core.ir;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Recovers if/else structure from the order of expressions alone.
 * <p>
 * Expressions must be {@link #visit(ExpressionId, Expression) visited} in graph order.
 * The tracker keeps one {@link BranchState} per open {@link ExpressionType#IF}, innermost
 * last, and an else or end-if always applies to the innermost open if.
 */
public final class BranchTracker {
    private final Deque<Frame> frames = new ArrayDeque<>();

    /**
     * Advance the tracker past an expression.
     *
     * @param id   The position of the expression.
     * @param expr The expression.
     * @throws InvalidGraphException If the expression is an else or end-if with no
     *                               open if to apply to, or a second else.
     */
    public void visit(ExpressionId id, Expression expr) {
        Frame top = frames.peekLast();
        if (top != null && top.state == BranchState.OPEN) {
            top.state = BranchState.IN_TRUE_BRANCH;
        }
        switch (expr.getType()) {
            case IF:
                frames.addLast(new Frame(id));
                break;
            case ELSE:
                if (top == null) {
                    throw new InvalidGraphException("else without matching if", id, expr);
                }
                if (top.state == BranchState.IN_FALSE_BRANCH) {
                    throw new InvalidGraphException(
                            "second else for the if at " + top.ifId,
                            id, expr);
                }
                top.state = BranchState.IN_FALSE_BRANCH;
                break;
            case END_IF:
                if (top == null) {
                    throw new InvalidGraphException("end-if without matching if", id, expr);
                }
                top.state = BranchState.CLOSED;
                frames.removeLast();
                break;
            default:
                break;
        }
    }

    /**
     * Check that every if has been closed.
     *
     * @param graph The graph that was visited, for reporting.
     * @throws InvalidGraphException If an if is still open.
     */
    public void finish(ExpressionGraph graph) {
        Frame top = frames.peekLast();
        if (top != null) {
            throw new InvalidGraphException("if is never closed", top.ifId, graph.get(top.ifId));
        }
    }

    /**
     * Get the number of ifs currently open.
     *
     * @return The nesting depth.
     */
    public int depth() {
        return frames.size();
    }

    public boolean isBalanced() {
        return frames.isEmpty();
    }

    /**
     * Get the state of the innermost open if.
     *
     * @return The state, or null if no if is open.
     */
    public @Nullable BranchState currentState() {
        Frame top = frames.peekLast();
        return top == null ? null : top.state;
    }

    /**
     * Get the branch regions the next expression would be in, outermost first.
     *
     * @return The regions.
     */
    public List<Region> currentRegions() {
        if (frames.isEmpty()) return Collections.emptyList();
        List<Region> regions = new ArrayList<>(frames.size());
        Iterator<Frame> it = frames.iterator();
        while (it.hasNext()) {
            Frame frame = it.next();
            regions.add(new Region(frame.ifId, frame.state == BranchState.IN_FALSE_BRANCH));
        }
        return regions;
    }

    private static final class Frame {
        final ExpressionId ifId;
        BranchState state = BranchState.OPEN;

        Frame(ExpressionId ifId) {
            this.ifId = ifId;
        }
    }

    /**
     * One arm of a traced conditional.
     */
    public static final class Region {
        private final ExpressionId ifId;
        private final boolean falseBranch;

        public Region(ExpressionId ifId, boolean falseBranch) {
            this.ifId = ifId;
            this.falseBranch = falseBranch;
        }

        /**
         * Get the id of the {@link ExpressionType#IF} that opened this region.
         *
         * @return The id.
         */
        public ExpressionId getIfId() {
            return ifId;
        }

        public boolean isFalseBranch() {
            return falseBranch;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Region region = (Region) o;
            return falseBranch == region.falseBranch && ifId.equals(region.ifId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ifId, falseBranch);
        }

        @Override
        public String toString() {
            return (falseBranch ? "else@" : "then@") + ifId.index();
        }
    }
}
