package com.wayfinder.scope;

import com.wayfinder.node.Destination;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Scope registry backed by tables of destination classes and routes.
 * 
 * A destination is in a scope when its class or its route is listed for that
 * scope. Unknown scopes contain nothing.
 */
public class MapScopeRegistry implements ScopeRegistry {
    
    private final Map<String, Set<Class<?>>> typesByScope;
    private final Map<String, Set<String>> routesByScope;
    
    private MapScopeRegistry(Builder builder) {
        this.typesByScope = freeze(builder.typesByScope);
        this.routesByScope = freeze(builder.routesByScope);
    }
    
    private static <T> Map<String, Set<T>> freeze(Map<String, Set<T>> source) {
        Map<String, Set<T>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Set<T>> entry : source.entrySet()) {
            copy.put(entry.getKey(), Set.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public boolean isInScope(String scopeKey, Destination destination) {
        Set<Class<?>> types = typesByScope.get(scopeKey);
        if (types != null && types.contains(destination.getClass())) {
            return true;
        }
        Set<String> routes = routesByScope.get(scopeKey);
        return routes != null && routes.contains(destination.getRoute());
    }
    
    /**
     * Finds the first scope that lists a destination.
     * 
     * @return the scope key, or null if no scope lists it
     */
    public String getScopeKey(Destination destination) {
        for (String scopeKey : scopeKeys()) {
            if (isInScope(scopeKey, destination)) {
                return scopeKey;
            }
        }
        return null;
    }
    
    /**
     * Gets every scope key known to this registry, type scopes first, in
     * registration order.
     */
    public Set<String> scopeKeys() {
        Set<String> keys = new LinkedHashSet<>(typesByScope.keySet());
        keys.addAll(routesByScope.keySet());
        return keys;
    }
    
    /**
     * Builder for scope tables.
     */
    public static class Builder {
        private final Map<String, Set<Class<?>>> typesByScope = new LinkedHashMap<>();
        private final Map<String, Set<String>> routesByScope = new LinkedHashMap<>();
        
        public Builder scope(String scopeKey, Class<?>... destinationTypes) {
            Set<Class<?>> types = typesByScope.computeIfAbsent(scopeKey, k -> new HashSet<>());
            Collections.addAll(types, destinationTypes);
            return this;
        }
        
        public Builder scopeRoutes(String scopeKey, String... routes) {
            Set<String> scopeRoutes = routesByScope.computeIfAbsent(scopeKey, k -> new HashSet<>());
            Collections.addAll(scopeRoutes, routes);
            return this;
        }
        
        public MapScopeRegistry build() {
            return new MapScopeRegistry(this);
        }
    }
}
