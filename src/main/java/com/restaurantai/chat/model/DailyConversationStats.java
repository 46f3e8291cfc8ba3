package com.restaurantai.chat.model;

import java.sql.Date;

/**
 * Projection for the per-day conversation aggregate.
 */
public interface DailyConversationStats {

    Date getDay();

    Long getTotalConversations();

    Long getUniqueSessions();
}
