package com.restaurantai.chat.service;

import com.restaurantai.chat.dto.HealthResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probes the database and the fast cache. Either one being down makes the service unhealthy.
 */
@Service
public class HealthService {

    private static final Logger logger = LoggerFactory.getLogger(HealthService.class);

    private final JdbcTemplate jdbcTemplate;
    private final FastCache fastCache;
    private final BackendClient backendClient;

    public HealthService(JdbcTemplate jdbcTemplate, FastCache fastCache, BackendClient backendClient) {
        this.jdbcTemplate = jdbcTemplate;
        this.fastCache = fastCache;
        this.backendClient = backendClient;
    }

    public HealthResponse check() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (RuntimeException e) {
            logger.error("Health check failed, database unreachable: {}", e.getMessage());
            return unhealthy("database unavailable");
        }
        try {
            fastCache.ping();
        } catch (RuntimeException e) {
            logger.error("Health check failed, cache unreachable: {}", e.getMessage());
            return unhealthy("cache unavailable");
        }
        Map<String, String> services = new LinkedHashMap<>();
        services.put("database", "connected");
        services.put("cache", "connected");
        services.put("ai", backendClient.isConfigured() ? "configured" : "fallback");
        return new HealthResponse("healthy", services, OffsetDateTime.now(), null);
    }

    private static HealthResponse unhealthy(String error) {
        return new HealthResponse("unhealthy", null, OffsetDateTime.now(), error);
    }
}
