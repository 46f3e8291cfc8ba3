package com.restaurantai.chat.controller;

import com.restaurantai.chat.service.RestaurantStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

@RestController
@Tag(name = "Admin", description = "Cache management for the provisioning tool")
public class CacheAdminController {

    private static final Logger logger = LoggerFactory.getLogger(CacheAdminController.class);

    private final RestaurantStore restaurantStore;

    public CacheAdminController(RestaurantStore restaurantStore) {
        this.restaurantStore = restaurantStore;
    }

    @Operation(summary = "Drop cached profile and menu for a restaurant",
            description = "Idempotent. invalidated=false means the cache could not be reached; " +
                    "entries then expire on their own TTL.")
    @DeleteMapping("/api/admin/cache/{restaurantId}")
    public ResponseEntity<Map<String, Object>> invalidate(
            @Parameter(description = "Restaurant id") @PathVariable UUID restaurantId) {
        boolean invalidated = restaurantStore.invalidate(restaurantId);
        logger.info("Cache invalidation for restaurant {}: {}", restaurantId, invalidated ? "done" : "cache unavailable");
        return ResponseEntity.ok(Map.of("success", true, "invalidated", invalidated));
    }
}
