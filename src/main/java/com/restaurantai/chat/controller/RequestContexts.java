package com.restaurantai.chat.controller;

import com.restaurantai.chat.model.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the routing view of an HTTP request: host, path and first value of each query parameter.
 */
final class RequestContexts {

    private RequestContexts() {
    }

    static RequestContext from(HttpServletRequest request) {
        String host = request.getHeader(HttpHeaders.HOST);
        if (!StringUtils.hasText(host)) {
            host = request.getServerName();
        }
        Map<String, String> query = new LinkedHashMap<>();
        request.getParameterMap().forEach((name, values) -> {
            if (values != null && values.length > 0) {
                query.put(name, values[0]);
            }
        });
        return new RequestContext(host, request.getRequestURI(), query);
    }
}
