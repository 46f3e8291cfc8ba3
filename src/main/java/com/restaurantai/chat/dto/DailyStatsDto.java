package com.restaurantai.chat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record DailyStatsDto(
        LocalDate date,
        @JsonProperty("total_conversations") long totalConversations,
        @JsonProperty("unique_sessions") long uniqueSessions
) {
}
