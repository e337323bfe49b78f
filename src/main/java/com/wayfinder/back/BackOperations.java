package com.wayfinder.back;

import com.wayfinder.node.Destination;
import com.wayfinder.node.NavNode;
import com.wayfinder.node.ScreenNode;
import com.wayfinder.node.StackNode;
import com.wayfinder.tree.TreeOperations;

import java.util.List;

/**
 * Back navigation over the whole tree.
 *
 * {@link #popWithTabBehavior(NavNode, boolean)} commits the decision of
 * {@link BackPlanner}; {@link #calculateCascadeBackState(NavNode, boolean)}
 * reports the same decision, so a back gesture preview always matches what
 * releasing the gesture does.
 */
public final class BackOperations {

    private BackOperations() {}

    /**
     * Handles a back press for a compact layout.
     *
     * @see #popWithTabBehavior(NavNode, boolean)
     */
    public static BackResult popWithTabBehavior(NavNode root) {
        return popWithTabBehavior(root, true);
    }

    /**
     * Handles a back press.
     *
     * A stack with history pops. An exhausted stack is removed from a parent
     * stack that has other children; otherwise the cascade climbs. Tab nodes
     * never switch tabs on back. Pane nodes apply their configured back
     * behavior in compact layouts and are removed whole in expanded ones.
     *
     * @param root the tree root
     * @param isCompact whether only one pane is visible
     * @return the outcome
     */
    public static BackResult popWithTabBehavior(NavNode root, boolean isCompact) {
        return commit(root, BackPlanner.plan(root, isCompact));
    }

    /**
     * Checks whether the tree would consume a back press in a compact layout.
     */
    public static boolean canHandleBackNavigation(NavNode root) {
        return canHandleBackNavigation(root, true);
    }

    /**
     * Checks whether the tree would consume a back press, without building
     * the resulting tree.
     *
     * @param root the tree root
     * @param isCompact whether only one pane is visible
     * @return true if {@link #popWithTabBehavior(NavNode, boolean)} would return {@link BackResult.Handled}
     */
    public static boolean canHandleBackNavigation(NavNode root, boolean isCompact) {
        return BackPlanner.plan(root, isCompact).changesTree();
    }

    /**
     * Previews a back press in a compact layout.
     */
    public static CascadeBackState calculateCascadeBackState(NavNode root) {
        return calculateCascadeBackState(root, true);
    }

    /**
     * Previews a back press. The input tree is left untouched; the target
     * node is read from a speculative commit.
     *
     * @param root the tree root
     * @param isCompact whether only one pane is visible
     * @return what back would do
     */
    public static CascadeBackState calculateCascadeBackState(NavNode root, boolean isCompact) {
        BackPlan plan = BackPlanner.plan(root, isCompact);
        if (!plan.changesTree()) {
            return new CascadeBackState(plan.sourceNode(), plan.exitingNode(), null, null,
                plan.cascadeDepth(), true);
        }

        BackResult result = commit(root, plan);
        NavNode newRoot = ((BackResult.Handled) result).newState();
        return new CascadeBackState(plan.sourceNode(), plan.exitingNode(), newRoot.activeLeaf(),
            plan.animatingContainerKey(), plan.cascadeDepth(), false);
    }

    private static BackResult commit(NavNode root, BackPlan plan) {
        switch (plan.action()) {
            case POP_SCREEN: {
                StackNode stack = (StackNode) root.findByKey(plan.targetKey());
                return new BackResult.Handled(TreeOperations.replaceNode(root, stack.getKey(), stack.withoutLast()));
            }
            case REMOVE_NODE:
                return new BackResult.Handled(TreeOperations.removeNode(root, plan.targetKey()));
            case PANE_POP:
                return new BackResult.Handled(plan.paneState());
            case DELEGATE:
                return new BackResult.DelegateToSystem();
            case CANNOT_HANDLE:
            default:
                return new BackResult.CannotHandle();
        }
    }

    /**
     * Checks whether the active stack has history to pop.
     */
    public static boolean canGoBack(NavNode root) {
        StackNode stack = root.activeStack();
        return stack != null && stack.canGoBack();
    }

    /**
     * Gets the destination of the active leaf.
     *
     * @return the destination, or null if the tree shows no screen
     */
    public static Destination currentDestination(NavNode root) {
        ScreenNode leaf = root.activeLeaf();
        return leaf == null ? null : leaf.getDestination();
    }

    /**
     * Gets the destination below the top of the active stack.
     *
     * @return the destination, or null if there is none or it is not a screen
     */
    public static Destination previousDestination(NavNode root) {
        StackNode stack = root.activeStack();
        if (stack == null || stack.size() < 2) {
            return null;
        }
        List<NavNode> children = stack.getChildren();
        NavNode previous = children.get(children.size() - 2);
        return previous instanceof ScreenNode ? ((ScreenNode) previous).getDestination() : null;
    }
}
