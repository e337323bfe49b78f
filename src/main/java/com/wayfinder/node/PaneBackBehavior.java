package com.wayfinder.node;

/**
 * Policy applied by a {@link PaneNode} when back is pressed and the active
 * pane's stack is already at its root.
 */
public enum PaneBackBehavior {
    /**
     * Focus the primary pane; once it is focused, ask the host to change
     * the scaffold layout.
     */
    POP_UNTIL_SCAFFOLD_VALUE_CHANGE,
    
    /**
     * Focus any other pane that still shows content.
     */
    POP_UNTIL_CURRENT_DESTINATION_CHANGE,
    
    /**
     * Pop from whichever pane still has poppable content, preferring the
     * active one.
     */
    POP_UNTIL_CONTENT_CHANGE,
    
    /**
     * Plain stack pop, nothing pane-specific.
     */
    POP_LATEST
}
