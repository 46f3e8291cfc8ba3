package com.restaurantai.chat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.restaurantai.chat.model.Restaurant;

import java.util.Map;
import java.util.UUID;

/**
 * Display data the homepage template needs for one restaurant.
 */
public record RestaurantProfileResponse(
        boolean success,
        UUID id,
        String name,
        String slug,
        String description,
        @JsonProperty("ai_name") String aiName,
        @JsonProperty("welcome_message") String welcomeMessage,
        @JsonProperty("logo_url") String logoUrl,
        @JsonProperty("theme_config") Map<String, Object> themeConfig
) {
    public static RestaurantProfileResponse from(Restaurant restaurant) {
        return new RestaurantProfileResponse(
                true,
                restaurant.getId(),
                restaurant.getName(),
                restaurant.getSlug(),
                restaurant.getDescription(),
                restaurant.resolveAiName(),
                restaurant.getWelcomeMessage(),
                restaurant.getLogoUrl(),
                restaurant.getThemeConfig() == null ? Map.of() : restaurant.getThemeConfig());
    }
}
