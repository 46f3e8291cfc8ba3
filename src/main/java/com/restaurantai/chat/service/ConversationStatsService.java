package com.restaurantai.chat.service;

import com.restaurantai.chat.dto.DailyStatsDto;
import com.restaurantai.chat.repository.ConversationRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

@Service
public class ConversationStatsService {

    static final int TRAILING_DAYS = 30;

    private final ConversationRepository conversationRepository;

    public ConversationStatsService(ConversationRepository conversationRepository) {
        this.conversationRepository = conversationRepository;
    }

    /**
     * Per-day conversation totals and distinct sessions for the trailing 30 days, newest first.
     *
     * @throws StoreUnavailableException when the database cannot be queried
     */
    public List<DailyStatsDto> dailyStats(UUID restaurantId) {
        try {
            return conversationRepository.aggregateDailyStats(restaurantId, TRAILING_DAYS).stream()
                    .map(row -> new DailyStatsDto(
                            row.getDay() == null ? null : row.getDay().toLocalDate(),
                            row.getTotalConversations() == null ? 0L : row.getTotalConversations(),
                            row.getUniqueSessions() == null ? 0L : row.getUniqueSessions()))
                    .toList();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Database unavailable while loading stats for " + restaurantId, e);
        }
    }
}
