package com.restaurantai.chat.service;

import com.restaurantai.chat.model.TenantRoute;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives the tenant routing key from request attributes. Pure function: no cache or database access.
 *
 * <p>Precedence, first match wins:
 * <ol>
 *   <li>leftmost host label, unless the host has no dot or the label is reserved ({@code www}, {@code app}, {@code api})</li>
 *   <li>{@code /r/<slug>} path prefix</li>
 *   <li>{@code restaurant_id} query parameter (slug)</li>
 *   <li>{@code restaurant_id} body field (slug)</li>
 * </ol>
 */
@Component
public class TenantRouteResolver {

    public static final String RESTAURANT_ID_PARAM = "restaurant_id";

    private static final Set<String> RESERVED_SUBDOMAINS = Set.of("www", "app", "api");
    private static final String SLUG_PATH_PREFIX = "/r/";

    /**
     * @param host        request host, optionally with a port
     * @param path        request path
     * @param queryParams query parameters (may be {@code null})
     * @param bodyRestaurantId {@code restaurant_id} from the parsed body, if any
     */
    public TenantRoute resolve(String host, String path, Map<String, String> queryParams, String bodyRestaurantId) {
        String subdomain = subdomainOf(host);
        if (subdomain != null) {
            return TenantRoute.subdomain(subdomain);
        }

        String slug = slugOf(path);
        if (slug != null) {
            return TenantRoute.slug(slug);
        }

        String queryId = queryParams == null ? null : queryParams.get(RESTAURANT_ID_PARAM);
        if (StringUtils.hasText(queryId)) {
            return TenantRoute.slug(queryId.trim());
        }

        if (StringUtils.hasText(bodyRestaurantId)) {
            return TenantRoute.slug(bodyRestaurantId.trim());
        }
        return TenantRoute.none();
    }

    private String subdomainOf(String host) {
        if (!StringUtils.hasText(host)) {
            return null;
        }
        String normalized = host.trim().toLowerCase(Locale.ROOT);
        int colon = normalized.indexOf(':');
        if (colon >= 0) {
            normalized = normalized.substring(0, colon);
        }
        int dot = normalized.indexOf('.');
        if (dot <= 0) {
            return null;
        }
        String label = normalized.substring(0, dot);
        return RESERVED_SUBDOMAINS.contains(label) ? null : label;
    }

    private String slugOf(String path) {
        if (path == null || !path.startsWith(SLUG_PATH_PREFIX)) {
            return null;
        }
        String rest = path.substring(SLUG_PATH_PREFIX.length());
        int slash = rest.indexOf('/');
        String segment = slash >= 0 ? rest.substring(0, slash) : rest;
        return segment.isEmpty() ? null : segment;
    }
}
