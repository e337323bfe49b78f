package com.wayfinder.scope;

import com.wayfinder.node.Destination;

/**
 * Decides which destinations belong inside a scoped container.
 * 
 * Containers declare a scope key; a scope-aware push asks the registry
 * whether the pushed destination belongs to that scope and escapes to an
 * ancestor stack when it does not.
 */
@FunctionalInterface
public interface ScopeRegistry {
    
    /**
     * Registry that accepts every destination in every scope.
     * Scope-aware pushes with this registry behave like plain pushes.
     */
    ScopeRegistry EMPTY = (scopeKey, destination) -> true;
    
    /**
     * Checks scope membership.
     * 
     * @param scopeKey the container's scope key
     * @param destination the destination being pushed
     * @return true if the destination may be pushed inside the container
     */
    boolean isInScope(String scopeKey, Destination destination);
}
