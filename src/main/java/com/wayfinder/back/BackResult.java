package com.wayfinder.back;

import com.wayfinder.node.NavNode;

import java.util.Objects;

/**
 * Outcome of a back press.
 */
public interface BackResult {
    
    /**
     * Convenience check for {@link Handled}.
     */
    default boolean isHandled() {
        return this instanceof Handled;
    }
    
    /**
     * The tree consumed the back press.
     * 
     * @param newState the new root
     */
    record Handled(NavNode newState) implements BackResult {
        public Handled {
            Objects.requireNonNull(newState, "New state cannot be null");
        }
    }
    
    /**
     * Nothing is left to go back to; the host platform should handle the
     * back press, usually by leaving the app.
     */
    record DelegateToSystem() implements BackResult {}
    
    /**
     * The tree is malformed, for example it has no active stack.
     */
    record CannotHandle() implements BackResult {}
}
