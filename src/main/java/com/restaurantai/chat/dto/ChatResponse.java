package com.restaurantai.chat.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Chat reply envelope; either success with a response or failure with an error")
public record ChatResponse(
        boolean success,
        String response,
        List<RecommendationDto> recommendations,
        TenantInfoDto tenant,
        String error
) {
    public static ChatResponse ok(String response, List<RecommendationDto> recommendations, TenantInfoDto tenant) {
        return new ChatResponse(true, response, recommendations, tenant, null);
    }

    public static ChatResponse failure(String error) {
        return new ChatResponse(false, null, null, null, error);
    }
}
