package com.restaurantai.chat.model;

/**
 * The routing key a request was resolved to.
 */
public record TenantRoute(Scheme scheme, String identifier) {

    private static final TenantRoute NONE = new TenantRoute(Scheme.NONE, null);

    public enum Scheme {
        SUBDOMAIN,
        SLUG,
        NONE
    }

    public static TenantRoute none() {
        return NONE;
    }

    public static TenantRoute subdomain(String subdomain) {
        return new TenantRoute(Scheme.SUBDOMAIN, subdomain);
    }

    public static TenantRoute slug(String slug) {
        return new TenantRoute(Scheme.SLUG, slug);
    }

    public boolean isResolved() {
        return scheme != Scheme.NONE;
    }

    /**
     * Cache key fragment, e.g. {@code subdomain:luigi}.
     */
    public String cacheKey() {
        return scheme.name().toLowerCase() + ":" + identifier;
    }
}
