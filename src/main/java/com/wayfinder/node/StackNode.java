package com.wayfinder.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Linear history of nodes. The last child is the active one.
 *
 * A stack may be empty only when a pop preserved it, see
 * {@code PopBehavior.PRESERVE_EMPTY}.
 */
public final class StackNode extends NavNode {

    private final List<NavNode> children;
    private final String scopeKey;

    public StackNode(String key, String parentKey, List<? extends NavNode> children) {
        this(key, parentKey, children, null);
    }

    /**
     * Creates a stack node.
     *
     * @param key unique node key
     * @param parentKey key of the parent container, null for a root
     * @param children ordered children, oldest first
     * @param scopeKey scope consulted by scope-aware pushes, may be null
     */
    public StackNode(String key, String parentKey, List<? extends NavNode> children, String scopeKey) {
        super(key, parentKey);
        this.children = List.copyOf(children);
        this.scopeKey = scopeKey;
    }

    public List<NavNode> getChildren() {
        return children;
    }

    public String getScopeKey() {
        return scopeKey;
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    /**
     * A stack can go back when popping leaves at least one child behind.
     */
    public boolean canGoBack() {
        return children.size() > 1;
    }

    @Override
    public Type getType() {
        return Type.STACK;
    }

    @Override
    public List<NavNode> children() {
        return children;
    }

    @Override
    public NavNode activeChild() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    @Override
    public StackNode activeStack() {
        NavNode child = activeChild();
        StackNode deeper = child == null ? null : child.activeStack();
        return deeper != null ? deeper : this;
    }

    /**
     * Returns a copy of this stack with other children.
     */
    public StackNode withChildren(List<? extends NavNode> newChildren) {
        return new StackNode(getKey(), getParentKey(), newChildren, scopeKey);
    }

    /**
     * Returns a copy of this stack with a child appended on top.
     */
    public StackNode withAppended(NavNode child) {
        List<NavNode> newChildren = new ArrayList<>(children.size() + 1);
        newChildren.addAll(children);
        newChildren.add(child);
        return withChildren(newChildren);
    }

    /**
     * Returns a copy of this stack without its top child.
     */
    public StackNode withoutLast() {
        if (children.isEmpty()) {
            return this;
        }
        return withChildren(children.subList(0, children.size() - 1));
    }

    @Override
    public StackNode withParentKey(String newParentKey) {
        return new StackNode(getKey(), newParentKey, children, scopeKey);
    }

    @Override
    public boolean canHandleBackInternally() {
        return canGoBack();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StackNode)) return false;
        StackNode other = (StackNode) obj;
        return getKey().equals(other.getKey())
            && Objects.equals(getParentKey(), other.getParentKey())
            && Objects.equals(scopeKey, other.scopeKey)
            && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKey(), getParentKey(), scopeKey, children);
    }

    @Override
    public String toString() {
        return "Stack(" + getKey() + ", " + children + ")";
    }
}
