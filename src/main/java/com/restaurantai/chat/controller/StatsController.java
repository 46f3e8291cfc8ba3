package com.restaurantai.chat.controller;

import com.restaurantai.chat.dto.StatsResponse;
import com.restaurantai.chat.service.ConversationStatsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Tag(name = "Stats", description = "Conversation analytics per restaurant")
public class StatsController {

    private final ConversationStatsService conversationStatsService;

    public StatsController(ConversationStatsService conversationStatsService) {
        this.conversationStatsService = conversationStatsService;
    }

    @Operation(summary = "Daily conversation counts for the last 30 days, newest first")
    @GetMapping("/api/stats/{restaurantId}")
    public ResponseEntity<StatsResponse> stats(
            @Parameter(description = "Restaurant id") @PathVariable UUID restaurantId) {
        return ResponseEntity.ok(new StatsResponse(true, conversationStatsService.dailyStats(restaurantId)));
    }
}
