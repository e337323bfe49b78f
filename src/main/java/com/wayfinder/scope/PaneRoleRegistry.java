package com.wayfinder.scope;

import com.wayfinder.node.Destination;
import com.wayfinder.node.PaneRole;

/**
 * Maps destinations to the pane they should open in.
 */
@FunctionalInterface
public interface PaneRoleRegistry {
    
    /**
     * Registry without any pane routing.
     */
    PaneRoleRegistry EMPTY = (scopeKey, destination) -> null;
    
    /**
     * Looks up the pane role for a destination inside a pane scope.
     * 
     * @param scopeKey the pane node's scope key
     * @param destination the destination being pushed
     * @return the target role, or null if the destination is not routed to a pane
     */
    PaneRole getPaneRole(String scopeKey, Destination destination);
    
    /**
     * Checks whether a destination has a pane role in a scope.
     */
    default boolean hasPaneRole(String scopeKey, Destination destination) {
        return getPaneRole(scopeKey, destination) != null;
    }
}
