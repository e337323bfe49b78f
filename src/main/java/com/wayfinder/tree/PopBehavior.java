package com.wayfinder.tree;

/**
 * What a pop does when it removes the last child of a stack.
 */
public enum PopBehavior {
    /**
     * Remove the emptied stack from its parent stack. Tab and pane slots
     * cannot be removed, so they keep the empty stack.
     */
    CASCADE,
    
    /**
     * Keep the emptied stack in the tree.
     */
    PRESERVE_EMPTY
}
