package com.wayfinder.node;

import java.util.List;
import java.util.Objects;

/**
 * Leaf of the navigation tree holding a single destination.
 */
public final class ScreenNode extends NavNode {

    private final Destination destination;

    public ScreenNode(String key, String parentKey, Destination destination) {
        super(key, parentKey);
        this.destination = Objects.requireNonNull(destination, "Destination cannot be null");
    }

    public Destination getDestination() {
        return destination;
    }

    @Override
    public Type getType() {
        return Type.SCREEN;
    }

    @Override
    public List<NavNode> children() {
        return List.of();
    }

    @Override
    public NavNode activeChild() {
        return null;
    }

    @Override
    public ScreenNode activeLeaf() {
        return this;
    }

    @Override
    public StackNode activeStack() {
        return null;
    }

    @Override
    public ScreenNode withParentKey(String newParentKey) {
        return new ScreenNode(getKey(), newParentKey, destination);
    }

    @Override
    public boolean canHandleBackInternally() {
        return false;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ScreenNode)) return false;
        ScreenNode other = (ScreenNode) obj;
        return getKey().equals(other.getKey())
            && Objects.equals(getParentKey(), other.getParentKey())
            && destination.equals(other.destination);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getKey(), getParentKey(), destination);
    }

    @Override
    public String toString() {
        return "Screen(" + getKey() + ", " + destination.getRoute() + ")";
    }
}
