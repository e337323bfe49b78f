package com.wayfinder.node;

import java.util.Objects;

/**
 * Plain destination made of a route and an optional payload.
 */
public final class RouteDestination implements Destination {
    
    private final String route;
    private final Object data;
    
    public RouteDestination(String route) {
        this(route, null);
    }
    
    public RouteDestination(String route, Object data) {
        this.route = Objects.requireNonNull(route, "Route cannot be null");
        if (route.isBlank()) {
            throw new IllegalArgumentException("Route cannot be blank");
        }
        this.data = data;
    }
    
    /**
     * Creates a destination for a route without payload.
     * 
     * @param route the route
     * @return the destination
     */
    public static RouteDestination of(String route) {
        return new RouteDestination(route);
    }
    
    @Override
    public String getRoute() {
        return route;
    }
    
    @Override
    public Object getData() {
        return data;
    }
    
    /**
     * Route destinations share one class, so their kind is the route.
     */
    @Override
    public boolean isSameKind(Destination other) {
        return other instanceof RouteDestination && route.equals(other.getRoute());
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RouteDestination)) return false;
        RouteDestination other = (RouteDestination) obj;
        return route.equals(other.route) && Objects.equals(data, other.data);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(route, data);
    }
    
    @Override
    public String toString() {
        return route;
    }
}
