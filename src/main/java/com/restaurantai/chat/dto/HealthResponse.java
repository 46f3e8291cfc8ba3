package com.restaurantai.chat.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        String status,
        Map<String, String> services,
        OffsetDateTime timestamp,
        String error
) {
}
