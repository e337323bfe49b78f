package com.wayfinder.node;

/**
 * A navigation target owned by the caller.
 * 
 * The engine treats destinations as opaque values: it only reads the route
 * (for route-based pops and registry lookups) and the runtime class (for
 * type-based matching). Implementations should be immutable.
 */
public interface Destination {
    
    /**
     * Gets the route string identifying this destination.
     * 
     * @return the route, never null
     */
    String getRoute();
    
    /**
     * Gets the payload carried by this destination.
     * 
     * @return the payload, or null if the destination carries none
     */
    default Object getData() {
        return null;
    }
    
    /**
     * Checks whether another destination is of the same kind as this one.
     * Tab matching uses this to find a tab that already shows such a screen.
     * 
     * @param other the destination to compare with
     * @return true if both destinations have the same runtime class
     */
    default boolean isSameKind(Destination other) {
        return other != null && getClass() == other.getClass();
    }
}
