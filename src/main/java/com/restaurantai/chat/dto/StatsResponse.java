package com.restaurantai.chat.dto;

import java.util.List;

public record StatsResponse(boolean success, List<DailyStatsDto> stats) {
}
