package com.wayfinder.back;

import com.wayfinder.node.NavNode;

/**
 * Read-only decision of the back procedure, committed later by
 * {@link BackOperations}.
 */
final class BackPlan {
    
    enum Action {
        /** Drop the top child of a stack. */
        POP_SCREEN,
        /** Remove an exhausted container from its parent stack. */
        REMOVE_NODE,
        /** Apply the back behavior of a pane node. */
        PANE_POP,
        DELEGATE,
        CANNOT_HANDLE
    }
    
    private final Action action;
    private final String targetKey;
    private final NavNode sourceNode;
    private final NavNode exitingNode;
    private final String animatingContainerKey;
    private final int cascadeDepth;
    private final NavNode paneState;
    
    private BackPlan(Action action, String targetKey, NavNode sourceNode, NavNode exitingNode,
                     String animatingContainerKey, int cascadeDepth) {
        this(action, targetKey, sourceNode, exitingNode, animatingContainerKey, cascadeDepth, null);
    }
    
    private BackPlan(Action action, String targetKey, NavNode sourceNode, NavNode exitingNode,
                     String animatingContainerKey, int cascadeDepth, NavNode paneState) {
        this.action = action;
        this.targetKey = targetKey;
        this.sourceNode = sourceNode;
        this.exitingNode = exitingNode;
        this.animatingContainerKey = animatingContainerKey;
        this.cascadeDepth = cascadeDepth;
        this.paneState = paneState;
    }
    
    static BackPlan popScreen(NavNode source, String stackKey, NavNode exiting) {
        return new BackPlan(Action.POP_SCREEN, stackKey, source, exiting, stackKey, 0);
    }
    
    static BackPlan removeNode(NavNode source, NavNode exiting, String parentKey, int depth) {
        return new BackPlan(Action.REMOVE_NODE, exiting.getKey(), source, exiting, parentKey, depth);
    }
    
    static BackPlan panePop(NavNode source, String paneKey, NavNode exiting, NavNode paneState) {
        return new BackPlan(Action.PANE_POP, paneKey, source, exiting, paneKey, 0, paneState);
    }
    
    static BackPlan delegate(NavNode source, int depth) {
        return new BackPlan(Action.DELEGATE, null, source, source, null, depth);
    }
    
    static BackPlan cannotHandle(NavNode source) {
        return new BackPlan(Action.CANNOT_HANDLE, null, source, null, null, 0);
    }
    
    Action action() { return action; }
    String targetKey() { return targetKey; }
    NavNode sourceNode() { return sourceNode; }
    NavNode exitingNode() { return exitingNode; }
    String animatingContainerKey() { return animatingContainerKey; }
    int cascadeDepth() { return cascadeDepth; }
    /** Tree produced by the pane back behavior, set for {@link Action#PANE_POP} only. */
    NavNode paneState() { return paneState; }
    
    boolean changesTree() {
        return action == Action.POP_SCREEN || action == Action.REMOVE_NODE || action == Action.PANE_POP;
    }
    
    @Override
    public String toString() {
        return "BackPlan(" + action + ", target=" + targetKey + ", depth=" + cascadeDepth + ")";
    }
}
