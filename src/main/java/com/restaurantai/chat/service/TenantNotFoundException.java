package com.restaurantai.chat.service;

import com.restaurantai.chat.model.TenantRoute;

public class TenantNotFoundException extends RuntimeException {

    private final TenantRoute route;

    /**
     * Creates an exception for a request that could not be routed or whose tenant is unknown or inactive.
     */
    public TenantNotFoundException(TenantRoute route) {
        super(route == null || !route.isResolved()
                ? "Restaurant not specified"
                : "Restaurant not found: " + route.cacheKey());
        this.route = route == null ? TenantRoute.none() : route;
    }

    public TenantRoute getRoute() {
        return route;
    }

    /**
     * @return {@code true} when the request carried no routable identifier at all.
     */
    public boolean isUnrouted() {
        return !route.isResolved();
    }
}
