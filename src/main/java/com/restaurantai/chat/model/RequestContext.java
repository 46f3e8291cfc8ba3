package com.restaurantai.chat.model;

import java.util.Map;

/**
 * Request attributes the tenant resolver reads, detached from the servlet API.
 */
public record RequestContext(
        String host,
        String path,
        Map<String, String> queryParams
) {
    public Map<String, String> queryParams() {
        return queryParams == null ? Map.of() : queryParams;
    }
}
