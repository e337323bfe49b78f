package com.wayfinder.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Base class of the immutable navigation tree.
 *
 * A tree is made of four node variants: {@link ScreenNode} leaves and the
 * {@link StackNode}, {@link TabNode} and {@link PaneNode} containers. Every
 * node carries a key that is unique within one tree snapshot and the key of
 * its parent container (null only at the root).
 *
 * Nodes never change after construction. Operations that "modify" a tree
 * return a new root that shares every untouched subtree with the old one.
 */
public abstract class NavNode {

    /**
     * Discriminator of the node variants.
     */
    public enum Type {
        SCREEN,
        STACK,
        TAB,
        PANE
    }

    private final String key;
    private final String parentKey;

    protected NavNode(String key, String parentKey) {
        this.key = Objects.requireNonNull(key, "Node key cannot be null");
        this.parentKey = parentKey;
    }

    public String getKey() {
        return key;
    }

    public String getParentKey() {
        return parentKey;
    }

    /**
     * Gets the variant of this node.
     */
    public abstract Type getType();

    /**
     * Gets the direct children in variant order: stack children, tab stacks,
     * or pane contents in {@link PaneRole} order.
     *
     * @return unmodifiable list of children, empty for screens
     */
    public abstract List<NavNode> children();

    /**
     * Gets the child that lies on the active path.
     *
     * @return the last stack child, the selected tab stack, the focused pane
     *         content, or null when there is none
     */
    public abstract NavNode activeChild();

    /**
     * Returns a copy of this node re-parented under another key.
     *
     * @param newParentKey the new parent key, or null for a root
     * @return the re-parented node
     */
    public abstract NavNode withParentKey(String newParentKey);

    /**
     * Finds the deepest {@link StackNode} on the active path.
     *
     * @return the active stack, or null if the active path holds no stack
     */
    public abstract StackNode activeStack();

    /**
     * Follows the active path down to its terminal screen.
     *
     * @return the active leaf, or null if the path ends in an empty stack
     */
    public ScreenNode activeLeaf() {
        NavNode child = activeChild();
        return child == null ? null : child.activeLeaf();
    }

    /**
     * Collects the active path from this node down to the active leaf.
     *
     * @return root-to-leaf list including this node
     */
    public List<NavNode> activePathToLeaf() {
        List<NavNode> path = new ArrayList<>();
        NavNode current = this;
        while (current != null) {
            path.add(current);
            current = current.activeChild();
        }
        return Collections.unmodifiableList(path);
    }

    /**
     * Depth-first search for a node by key.
     *
     * @param targetKey the key to look for
     * @return the node, or null if no node in this subtree has that key
     */
    public NavNode findByKey(String targetKey) {
        if (key.equals(targetKey)) {
            return this;
        }
        for (NavNode child : children()) {
            NavNode found = child.findByKey(targetKey);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Visits every node of this subtree in depth-first pre-order.
     */
    public void forEachNode(Consumer<NavNode> visitor) {
        visitor.accept(this);
        for (NavNode child : children()) {
            child.forEachNode(visitor);
        }
    }

    public List<ScreenNode> allScreens() {
        return collect(ScreenNode.class);
    }

    public List<StackNode> allStackNodes() {
        return collect(StackNode.class);
    }

    public List<TabNode> allTabNodes() {
        return collect(TabNode.class);
    }

    public List<PaneNode> allPaneNodes() {
        return collect(PaneNode.class);
    }

    private <T extends NavNode> List<T> collect(Class<T> type) {
        List<T> result = new ArrayList<>();
        forEachNode(node -> {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        });
        return result;
    }

    /**
     * Counts the nodes of this subtree, this node included.
     */
    public int nodeCount() {
        int count = 1;
        for (NavNode child : children()) {
            count += child.nodeCount();
        }
        return count;
    }

    /**
     * Computes the number of container levels below this node.
     * Screens and empty stacks have depth 0.
     */
    public int depth() {
        int max = -1;
        for (NavNode child : children()) {
            max = Math.max(max, child.depth());
        }
        return max + 1;
    }

    /**
     * Finds the content of the first pane configured for a role.
     *
     * @param role the pane role
     * @return the pane content, or null if no pane in this subtree has the role
     */
    public NavNode paneForRole(PaneRole role) {
        if (this instanceof PaneNode) {
            NavNode content = ((PaneNode) this).paneContent(role);
            if (content != null) {
                return content;
            }
        }
        for (NavNode child : children()) {
            NavNode found = child.paneForRole(role);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Checks whether this container could consume a back press on its own,
     * without giving up its place in the parent.
     */
    public abstract boolean canHandleBackInternally();
}
