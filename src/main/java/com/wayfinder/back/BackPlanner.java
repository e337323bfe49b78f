package com.wayfinder.back;

import com.wayfinder.diagnostics.TreeDiff;
import com.wayfinder.node.NavNode;
import com.wayfinder.node.PaneNode;
import com.wayfinder.node.PaneRole;
import com.wayfinder.node.StackNode;
import com.wayfinder.node.TabNode;
import com.wayfinder.tree.PaneOperations;
import com.wayfinder.tree.PopResult;
import com.wayfinder.tree.TreeOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides what a back press does without building a new tree.
 *
 * Starting from the active stack, an exhausted container hands the decision
 * to its parent. A parent stack with other children drops it and a tab node
 * is itself exhausted. In compact layouts a pane node applies its
 * {@link com.wayfinder.node.PaneBackBehavior}; only an empty or unpoppable
 * result exhausts it, and a scaffold change is left to the host. Expanded
 * pane nodes are always exhausted. Reaching the root delegates to the host.
 */
final class BackPlanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackPlanner.class);

    private BackPlanner() {}

    static BackPlan plan(NavNode root, boolean isCompact) {
        StackNode stack = root.activeStack();
        if (stack == null) {
            LOGGER.debug("No active stack under '{}', back cannot be handled", root.getKey());
            return BackPlan.cannotHandle(root);
        }

        NavNode source = stack.isEmpty() ? stack : stack.activeChild();
        if (stack.canGoBack()) {
            return BackPlan.popScreen(source, stack.getKey(), stack.activeChild());
        }

        BackPlan plan = planExhausted(root, stack, source, 1, isCompact);
        LOGGER.debug("Back from '{}' planned as {}", source.getKey(), plan);
        return plan;
    }

    private static BackPlan planExhausted(NavNode root, NavNode exhausted, NavNode source, int depth,
                                          boolean isCompact) {
        NavNode parent = TreeOperations.findParent(root, exhausted.getKey());
        if (parent == null) {
            return BackPlan.delegate(source, depth);
        }

        if (parent instanceof StackNode) {
            if (((StackNode) parent).size() > 1) {
                return BackPlan.removeNode(source, exhausted, parent.getKey(), depth);
            }
            return planExhausted(root, parent, source, depth + 1, isCompact);
        }

        if (parent instanceof TabNode) {
            // Back never switches tabs, the whole tab node is exhausted
            return planExhausted(root, parent, source, depth + 1, isCompact);
        }

        PaneNode pane = (PaneNode) parent;
        if (!isCompact) {
            return planExhausted(root, pane, source, depth + 1, isCompact);
        }

        PopResult result = PaneOperations.popWithPaneBehavior(root, pane);
        if (result instanceof PopResult.RequiresScaffoldChange) {
            LOGGER.debug("Pane '{}' needs a scaffold change, back cannot be handled", pane.getKey());
            return BackPlan.cannotHandle(source);
        }
        if (result instanceof PopResult.Popped) {
            NavNode newState = ((PopResult.Popped) result).newState();
            if (!bouncesBack(root, pane, newState)) {
                return BackPlan.panePop(source, pane.getKey(), exitingNode(root, newState, source), newState);
            }
            LOGGER.debug("Pane '{}' would only move focus back and forth, treating it as exhausted", pane.getKey());
        }
        return planExhausted(root, pane, source, depth + 1, isCompact);
    }

    /**
     * A focus move away from a secondary pane that the next back press would
     * undo. Two panes that both hold content would otherwise trade focus
     * forever, so the move counts as exhausting the pane node.
     */
    private static boolean bouncesBack(NavNode root, PaneNode pane, NavNode newState) {
        if (pane.getActivePaneRole() == PaneRole.PRIMARY || !TreeDiff.between(root, newState).isEmpty()) {
            return false;
        }
        PaneNode moved = (PaneNode) newState.findByKey(pane.getKey());
        PopResult next = PaneOperations.popWithPaneBehavior(newState, moved);
        return next instanceof PopResult.Popped && ((PopResult.Popped) next).newState().equals(root);
    }

    /**
     * The node a pane back removes: the source if it goes, otherwise the
     * first removed node in tree order. A pure focus move removes nothing
     * and reports the source.
     */
    private static NavNode exitingNode(NavNode root, NavNode newState, NavNode source) {
        Set<String> removed = TreeDiff.between(root, newState).topmostRemovedKeys();
        if (removed.isEmpty() || removed.contains(source.getKey())) {
            return source;
        }
        List<NavNode> found = new ArrayList<>();
        root.forEachNode(node -> {
            if (found.isEmpty() && removed.contains(node.getKey())) {
                found.add(node);
            }
        });
        return found.get(0);
    }
}
