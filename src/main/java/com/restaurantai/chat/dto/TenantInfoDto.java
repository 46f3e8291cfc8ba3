package com.restaurantai.chat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.restaurantai.chat.model.Restaurant;

import java.util.UUID;

public record TenantInfoDto(
        UUID id,
        String name,
        @JsonProperty("ai_name") String aiName
) {
    public static TenantInfoDto from(Restaurant restaurant) {
        return new TenantInfoDto(restaurant.getId(), restaurant.getName(), restaurant.resolveAiName());
    }
}
