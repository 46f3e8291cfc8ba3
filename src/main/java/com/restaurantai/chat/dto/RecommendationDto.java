package com.restaurantai.chat.dto;

import com.restaurantai.chat.model.MenuItem;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.util.UUID;

@Schema(description = "Menu item surfaced alongside a reply")
public record RecommendationDto(
        UUID id,
        String name,
        BigDecimal price,
        String description
) {
    public static RecommendationDto from(MenuItem item) {
        return new RecommendationDto(item.getId(), item.getName(), item.getPrice(), item.getDescription());
    }
}
