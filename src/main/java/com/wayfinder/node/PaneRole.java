package com.wayfinder.node;

/**
 * Slots of a multi-pane layout.
 * 
 * Declaration order is the iteration order of every pane map in the tree.
 */
public enum PaneRole {
    /**
     * Main content pane. Always configured, cannot be removed.
     */
    PRIMARY,
    
    /**
     * Secondary pane, usually the detail half of a list-detail layout.
     */
    SUPPORTING,
    
    /**
     * Optional third pane.
     */
    EXTRA
}
