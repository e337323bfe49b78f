package com.wayfinder.tree;

import com.wayfinder.node.NavNode;
import com.wayfinder.node.PaneConfiguration;
import com.wayfinder.node.PaneNode;
import com.wayfinder.node.PaneRole;
import com.wayfinder.node.StackNode;
import com.wayfinder.node.TabNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Key-addressed structural edits of a navigation tree.
 *
 * Both operations rebuild only the nodes on the path from the root to the
 * target; every other subtree of the result is the same instance as in the
 * input tree.
 */
public final class TreeOperations {

    private TreeOperations() {}

    /**
     * Replaces the node with the given key.
     *
     * The replacement is inserted as given; its parent key is not rewritten.
     *
     * @param root the tree root
     * @param targetKey key of the node to replace
     * @param newNode the replacement
     * @return the new root
     * @throws NavigationException NODE_NOT_FOUND if no node has the key,
     *         INVALID_OPERATION if a tab stack would be replaced by a non-stack
     */
    public static NavNode replaceNode(NavNode root, String targetKey, NavNode newNode) {
        NavNode result = tryReplace(root, targetKey, newNode);
        if (result == null) {
            throw NavigationException.nodeNotFound(targetKey);
        }
        return result;
    }

    private static NavNode tryReplace(NavNode node, String targetKey, NavNode newNode) {
        if (node.getKey().equals(targetKey)) {
            return newNode;
        }

        if (node instanceof StackNode) {
            StackNode stack = (StackNode) node;
            List<NavNode> children = stack.getChildren();
            for (int i = 0; i < children.size(); i++) {
                NavNode replaced = tryReplace(children.get(i), targetKey, newNode);
                if (replaced != null) {
                    List<NavNode> newChildren = new ArrayList<>(children);
                    newChildren.set(i, replaced);
                    return stack.withChildren(newChildren);
                }
            }
        } else if (node instanceof TabNode) {
            TabNode tab = (TabNode) node;
            for (int i = 0; i < tab.tabCount(); i++) {
                NavNode replaced = tryReplace(tab.stackAt(i), targetKey, newNode);
                if (replaced != null) {
                    if (!(replaced instanceof StackNode)) {
                        throw NavigationException.invalidOperation(targetKey, String.format(
                            "TabNode '%s' can only hold stacks, cannot replace '%s' with %s",
                            tab.getKey(), targetKey, replaced.getType()));
                    }
                    return tab.withStack(i, (StackNode) replaced);
                }
            }
        } else if (node instanceof PaneNode) {
            PaneNode pane = (PaneNode) node;
            for (Map.Entry<PaneRole, PaneConfiguration> entry : pane.getPaneConfigurations().entrySet()) {
                NavNode replaced = tryReplace(entry.getValue().content(), targetKey, newNode);
                if (replaced != null) {
                    return pane.withPaneContent(entry.getKey(), replaced);
                }
            }
        }
        return null;
    }

    /**
     * Removes the node with the given key from its parent.
     *
     * Only stacks can lose children. Tab stacks and pane contents are fixed
     * slots and have dedicated operations instead.
     *
     * @param root the tree root
     * @param targetKey key of the node to remove
     * @return the new root, or null if the target is the root itself
     * @throws NavigationException NODE_NOT_FOUND if no node has the key,
     *         INVALID_OPERATION if the target is a tab stack or pane content
     */
    public static NavNode removeNode(NavNode root, String targetKey) {
        if (root.getKey().equals(targetKey)) {
            return null;
        }
        NavNode result = tryRemove(root, targetKey);
        if (result == null) {
            throw NavigationException.nodeNotFound(targetKey);
        }
        return result;
    }

    private static NavNode tryRemove(NavNode node, String targetKey) {
        if (node instanceof StackNode) {
            StackNode stack = (StackNode) node;
            List<NavNode> children = stack.getChildren();
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i).getKey().equals(targetKey)) {
                    List<NavNode> newChildren = new ArrayList<>(children);
                    newChildren.remove(i);
                    return stack.withChildren(newChildren);
                }
            }
            for (int i = 0; i < children.size(); i++) {
                NavNode updated = tryRemove(children.get(i), targetKey);
                if (updated != null) {
                    List<NavNode> newChildren = new ArrayList<>(children);
                    newChildren.set(i, updated);
                    return stack.withChildren(newChildren);
                }
            }
        } else if (node instanceof TabNode) {
            TabNode tab = (TabNode) node;
            for (StackNode stack : tab.getStacks()) {
                if (stack.getKey().equals(targetKey)) {
                    throw NavigationException.invalidOperation(targetKey, String.format(
                        "Cannot remove stack '%s' from TabNode '%s' - use switchTab instead",
                        targetKey, tab.getKey()));
                }
            }
            for (int i = 0; i < tab.tabCount(); i++) {
                NavNode updated = tryRemove(tab.stackAt(i), targetKey);
                if (updated != null) {
                    return tab.withStack(i, (StackNode) updated);
                }
            }
        } else if (node instanceof PaneNode) {
            PaneNode pane = (PaneNode) node;
            for (PaneConfiguration config : pane.getPaneConfigurations().values()) {
                if (config.content().getKey().equals(targetKey)) {
                    throw NavigationException.invalidOperation(targetKey, String.format(
                        "Cannot remove pane content '%s' directly - use removePaneConfiguration instead",
                        targetKey));
                }
            }
            for (Map.Entry<PaneRole, PaneConfiguration> entry : pane.getPaneConfigurations().entrySet()) {
                NavNode updated = tryRemove(entry.getValue().content(), targetKey);
                if (updated != null) {
                    return pane.withPaneContent(entry.getKey(), updated);
                }
            }
        }
        return null;
    }

    /**
     * Finds the container that holds a node as a direct child.
     *
     * @param root the tree root
     * @param childKey key of the child
     * @return the parent, or null if the key belongs to the root or is absent
     */
    public static NavNode findParent(NavNode root, String childKey) {
        for (NavNode child : root.children()) {
            if (child.getKey().equals(childKey)) {
                return root;
            }
            NavNode found = findParent(child, childKey);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Looks up a node that must exist and must be of a given variant.
     *
     * @throws NavigationException NODE_NOT_FOUND if absent, INVALID_OPERATION if of another variant
     */
    static <T extends NavNode> T requireNode(NavNode root, String key, Class<T> type) {
        NavNode node = root.findByKey(key);
        if (node == null) {
            throw NavigationException.nodeNotFound(key);
        }
        if (!type.isInstance(node)) {
            throw NavigationException.invalidOperation(key, String.format(
                "Node '%s' is a %s, expected %s", key, node.getType(), type.getSimpleName()));
        }
        return type.cast(node);
    }
}
