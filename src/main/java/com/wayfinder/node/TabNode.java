package com.wayfinder.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fixed set of parallel stacks, one per tab, with exactly one selected.
 *
 * The number of stacks never changes after construction; only the selected
 * index and the contents of the stacks do.
 */
public final class TabNode extends NavNode {

    private final List<StackNode> stacks;
    private final int activeStackIndex;
    private final String scopeKey;

    public TabNode(String key, String parentKey, List<StackNode> stacks, int activeStackIndex) {
        this(key, parentKey, stacks, activeStackIndex, null);
    }

    /**
     * Creates a tab node.
     *
     * @param key unique node key
     * @param parentKey key of the parent container, null for a root
     * @param stacks one stack per tab, at least one
     * @param activeStackIndex index of the selected tab
     * @param scopeKey scope consulted by scope-aware pushes, may be null
     * @throws IllegalArgumentException if there are no stacks or the index is out of range
     */
    public TabNode(String key, String parentKey, List<StackNode> stacks, int activeStackIndex, String scopeKey) {
        super(key, parentKey);
        if (stacks == null || stacks.isEmpty()) {
            throw new IllegalArgumentException(
                String.format("TabNode '%s' must have at least one stack", key)
            );
        }
        if (activeStackIndex < 0 || activeStackIndex >= stacks.size()) {
            throw new IllegalArgumentException(
                String.format("TabNode '%s' active index %d out of bounds for %d stacks",
                    key, activeStackIndex, stacks.size())
            );
        }
        this.stacks = List.copyOf(stacks);
        this.activeStackIndex = activeStackIndex;
        this.scopeKey = scopeKey;
    }

    public List<StackNode> getStacks() {
        return stacks;
    }

    public int getActiveStackIndex() {
        return activeStackIndex;
    }

    public String getScopeKey() {
        return scopeKey;
    }

    public int tabCount() {
        return stacks.size();
    }

    public StackNode stackAt(int index) {
        return stacks.get(index);
    }

    /**
     * Gets the stack of the selected tab.
     */
    public StackNode selectedStack() {
        return stacks.get(activeStackIndex);
    }

    @Override
    public Type getType() {
        return Type.TAB;
    }

    @Override
    public List<NavNode> children() {
        return Collections.unmodifiableList(stacks);
    }

    @Override
    public NavNode activeChild() {
        return selectedStack();
    }

    @Override
    public StackNode activeStack() {
        return selectedStack().activeStack();
    }

    public TabNode withActiveStackIndex(int index) {
        return new TabNode(getKey(), getParentKey(), stacks, index, scopeKey);
    }

    /**
     * Returns a copy of this tab node with one stack replaced.
     */
    public TabNode withStack(int index, StackNode stack) {
        List<StackNode> newStacks = new ArrayList<>(stacks);
        newStacks.set(index, stack);
        return new TabNode(getKey(), getParentKey(), newStacks, activeStackIndex, scopeKey);
    }

    @Override
    public TabNode withParentKey(String newParentKey) {
        return new TabNode(getKey(), newParentKey, stacks, activeStackIndex, scopeKey);
    }

    @Override
    public boolean canHandleBackInternally() {
        return selectedStack().canGoBack() || activeStackIndex != 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TabNode)) return false;
        TabNode other = (TabNode) obj;
        return getKey().equals(other.getKey())
            && Objects.equals(getParentKey(), other.getParentKey())
            && activeStackIndex == other.activeStackIndex
            && Objects.equals(scopeKey, other.scopeKey)
            && stacks.equals(other.stacks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKey(), getParentKey(), activeStackIndex, scopeKey, stacks);
    }

    @Override
    public String toString() {
        return "Tab(" + getKey() + ", active=" + activeStackIndex + ", " + stacks + ")";
    }
}
