package com.restaurantai.chat.service;

import com.restaurantai.chat.dto.DailyStatsDto;
import com.restaurantai.chat.model.DailyConversationStats;
import com.restaurantai.chat.repository.ConversationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.sql.Date;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConversationStatsServiceTest {

    @Mock
    private ConversationRepository conversationRepository;

    @Test
    void mapsDailyRowsForTrailingThirtyDays() {
        when(conversationRepository.aggregateDailyStats(MenuFixtures.RESTAURANT_ID, 30)).thenReturn(List.of(
                row(LocalDate.of(2024, 5, 2), 12L, 4L),
                row(LocalDate.of(2024, 5, 1), 3L, 1L)));

        List<DailyStatsDto> stats = new ConversationStatsService(conversationRepository).dailyStats(MenuFixtures.RESTAURANT_ID);

        assertThat(stats).containsExactly(
                new DailyStatsDto(LocalDate.of(2024, 5, 2), 12L, 4L),
                new DailyStatsDto(LocalDate.of(2024, 5, 1), 3L, 1L));
    }

    @Test
    void databaseOutageIsStoreUnavailable() {
        when(conversationRepository.aggregateDailyStats(MenuFixtures.RESTAURANT_ID, 30))
                .thenThrow(new DataAccessResourceFailureException("refused"));
        ConversationStatsService service = new ConversationStatsService(conversationRepository);

        assertThatThrownBy(() -> service.dailyStats(MenuFixtures.RESTAURANT_ID)).isInstanceOf(StoreUnavailableException.class);
    }

    private static DailyConversationStats row(LocalDate day, Long total, Long sessions) {
        return new DailyConversationStats() {
            @Override
            public Date getDay() {
                return Date.valueOf(day);
            }

            @Override
            public Long getTotalConversations() {
                return total;
            }

            @Override
            public Long getUniqueSessions() {
                return sessions;
            }
        };
    }
}
