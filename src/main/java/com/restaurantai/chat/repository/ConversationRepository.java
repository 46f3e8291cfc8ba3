package com.restaurantai.chat.repository;

import com.restaurantai.chat.model.Conversation;
import com.restaurantai.chat.model.DailyConversationStats;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

    @Query(value = """
            select cast(c.timestamp as date) as "day",
                   count(*) as "totalConversations",
                   count(distinct c.session_id) as "uniqueSessions"
            from conversations c
            where c.restaurant_id = :restaurantId
              and c.timestamp > current_date - make_interval(days => :days)
            group by cast(c.timestamp as date)
            order by "day" desc
            """, nativeQuery = true)
    List<DailyConversationStats> aggregateDailyStats(@Param("restaurantId") UUID restaurantId,
                                                     @Param("days") int days);
}
