package com.wayfinder.tree;

import com.wayfinder.node.Destination;
import com.wayfinder.node.NavNode;
import com.wayfinder.node.ScreenNode;
import com.wayfinder.node.StackNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Predicate;

/**
 * Operations that remove screens from the active stack.
 */
public final class PopOperations {

    private static final Logger LOGGER = LoggerFactory.getLogger(PopOperations.class);

    private PopOperations() {}

    /**
     * Pops the top of the active stack, keeping an emptied stack in place.
     *
     * @see #pop(NavNode, PopBehavior)
     */
    public static NavNode pop(NavNode root) {
        return pop(root, PopBehavior.PRESERVE_EMPTY);
    }

    /**
     * Pops the top of the active stack.
     *
     * When the pop empties the stack, {@link PopBehavior#CASCADE} removes
     * the stack from a parent stack that has other children, climbing
     * through parent stacks that would be emptied in turn. Tab and pane
     * slots keep the empty stack.
     *
     * @param root the tree root
     * @param behavior what to do with an emptied stack
     * @return the new root, or null if there is nothing to pop or the
     *         cascade would empty the root
     */
    public static NavNode pop(NavNode root, PopBehavior behavior) {
        StackNode stack = root.activeStack();
        if (stack == null || stack.isEmpty()) {
            return null;
        }

        StackNode popped = stack.withoutLast();
        if (!popped.isEmpty() || behavior == PopBehavior.PRESERVE_EMPTY) {
            return TreeOperations.replaceNode(root, stack.getKey(), popped);
        }
        return cascadeEmptyStack(root, popped);
    }

    private static NavNode cascadeEmptyStack(NavNode root, StackNode emptied) {
        NavNode current = emptied;
        while (true) {
            NavNode parent = TreeOperations.findParent(root, current.getKey());
            if (parent == null) {
                LOGGER.debug("Cascade from '{}' reached the root, nothing to pop", emptied.getKey());
                return null;
            }
            if (parent instanceof StackNode) {
                StackNode parentStack = (StackNode) parent;
                if (parentStack.size() > 1) {
                    LOGGER.debug("Cascade removes '{}' from '{}'", current.getKey(), parentStack.getKey());
                    return TreeOperations.removeNode(root, current.getKey());
                }
                current = parentStack.withChildren(List.of());
                continue;
            }
            // Tab and pane slots are fixed: keep the emptied node in place
            return TreeOperations.replaceNode(root, current.getKey(), current);
        }
    }

    /**
     * Truncates the active stack after its most recent child matching a
     * predicate.
     *
     * @param root the tree root
     * @param inclusive also remove the matching child
     * @param predicate child matcher
     * @return the new root, or the same root if there is no active stack,
     *         nothing matches or the truncation would empty the stack
     */
    public static NavNode popTo(NavNode root, boolean inclusive, Predicate<NavNode> predicate) {
        StackNode stack = root.activeStack();
        if (stack == null) {
            return root;
        }
        List<NavNode> children = stack.getChildren();

        int index = -1;
        for (int i = children.size() - 1; i >= 0; i--) {
            if (predicate.test(children.get(i))) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            return root;
        }

        int keep = inclusive ? index : index + 1;
        if (keep == 0 || keep == children.size()) {
            return root;
        }
        return TreeOperations.replaceNode(root, stack.getKey(), stack.withChildren(children.subList(0, keep)));
    }

    /**
     * Pops back to the child with the given key.
     */
    public static NavNode popToKey(NavNode root, String key, boolean inclusive) {
        return popTo(root, inclusive, node -> node.getKey().equals(key));
    }

    /**
     * Pops back to the most recent screen showing a route.
     */
    public static NavNode popToRoute(NavNode root, String route, boolean inclusive) {
        return popTo(root, inclusive, node -> node instanceof ScreenNode
            && ((ScreenNode) node).getDestination().getRoute().equals(route));
    }

    /**
     * Pops back to the most recent screen whose destination is of a type.
     */
    public static NavNode popToDestination(NavNode root, Class<? extends Destination> type, boolean inclusive) {
        return popTo(root, inclusive, node -> node instanceof ScreenNode
            && type.isInstance(((ScreenNode) node).getDestination()));
    }
}
