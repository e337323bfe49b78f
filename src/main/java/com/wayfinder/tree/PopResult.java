package com.wayfinder.tree;

import com.wayfinder.node.NavNode;
import com.wayfinder.node.PaneRole;

import java.util.Objects;

/**
 * Outcome of a pane-aware pop.
 * 
 * Only {@link Popped} carries a new tree; the other outcomes tell the caller
 * why nothing changed.
 */
public interface PopResult {
    
    /**
     * Convenience check for {@link Popped}.
     */
    default boolean isPopped() {
        return this instanceof Popped;
    }
    
    /**
     * The pop changed the tree.
     * 
     * @param newState the new root
     */
    record Popped(NavNode newState) implements PopResult {
        public Popped {
            Objects.requireNonNull(newState, "New state cannot be null");
        }
    }
    
    /**
     * The pane has nothing left to pop.
     * 
     * @param role the pane that is exhausted
     */
    record PaneEmpty(PaneRole role) implements PopResult {}
    
    /**
     * Nothing could be popped at all.
     */
    record CannotPop() implements PopResult {}
    
    /**
     * The pane layout itself has to change, which is the renderer's decision.
     */
    record RequiresScaffoldChange() implements PopResult {}
}
