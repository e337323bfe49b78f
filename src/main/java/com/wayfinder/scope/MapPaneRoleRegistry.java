package com.wayfinder.scope;

import com.wayfinder.node.Destination;
import com.wayfinder.node.PaneRole;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Pane role registry backed by per-scope tables keyed by destination class
 * or route. Class entries win over route entries.
 */
public class MapPaneRoleRegistry implements PaneRoleRegistry {
    
    private final Map<String, Map<Class<?>, PaneRole>> rolesByType;
    private final Map<String, Map<String, PaneRole>> rolesByRoute;
    
    private MapPaneRoleRegistry(Builder builder) {
        this.rolesByType = freeze(builder.rolesByType);
        this.rolesByRoute = freeze(builder.rolesByRoute);
    }
    
    private static <K> Map<String, Map<K, PaneRole>> freeze(Map<String, Map<K, PaneRole>> source) {
        Map<String, Map<K, PaneRole>> copy = new HashMap<>();
        for (Map.Entry<String, Map<K, PaneRole>> entry : source.entrySet()) {
            copy.put(entry.getKey(), Map.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public PaneRole getPaneRole(String scopeKey, Destination destination) {
        Map<Class<?>, PaneRole> byType = rolesByType.get(scopeKey);
        if (byType != null) {
            PaneRole role = byType.get(destination.getClass());
            if (role != null) {
                return role;
            }
        }
        Map<String, PaneRole> byRoute = rolesByRoute.get(scopeKey);
        return byRoute == null ? null : byRoute.get(destination.getRoute());
    }
    
    /**
     * Builder for pane role tables.
     */
    public static class Builder {
        private final Map<String, Map<Class<?>, PaneRole>> rolesByType = new HashMap<>();
        private final Map<String, Map<String, PaneRole>> rolesByRoute = new HashMap<>();
        
        public Builder role(String scopeKey, Class<?> destinationType, PaneRole role) {
            rolesByType.computeIfAbsent(scopeKey, k -> new HashMap<>()).put(destinationType, role);
            return this;
        }
        
        public Builder routeRole(String scopeKey, String route, PaneRole role) {
            rolesByRoute.computeIfAbsent(scopeKey, k -> new HashMap<>()).put(route, role);
            return this;
        }
        
        public MapPaneRoleRegistry build() {
            return new MapPaneRoleRegistry(this);
        }
    }
}
