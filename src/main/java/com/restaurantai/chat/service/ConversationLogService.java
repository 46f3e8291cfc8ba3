package com.restaurantai.chat.service;

import com.restaurantai.chat.model.Conversation;
import com.restaurantai.chat.repository.ConversationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Appends conversation records. Writes are handed to a dedicated executor so the reply never waits on them.
 */
@Service
public class ConversationLogService {

    private static final Logger logger = LoggerFactory.getLogger(ConversationLogService.class);

    private final ConversationRepository conversationRepository;
    private final TaskExecutor executor;

    public ConversationLogService(ConversationRepository conversationRepository,
                                  @Qualifier("conversationLogExecutor") TaskExecutor executor) {
        this.conversationRepository = conversationRepository;
        this.executor = executor;
    }

    /**
     * Submits one exchange for persistence. Failures are logged, never thrown.
     */
    public void record(UUID restaurantId, String sessionId, String message, String response,
                       String engine, long responseTimeMs) {
        Conversation conversation = Conversation.builder()
                .restaurantId(restaurantId)
                .sessionId(sessionId)
                .message(message)
                .response(response)
                .aiService(engine)
                .responseTimeMs((int) Math.min(Integer.MAX_VALUE, Math.max(0, responseTimeMs)))
                .build();
        try {
            executor.execute(() -> persist(conversation));
        } catch (TaskRejectedException e) {
            logger.warn("Conversation log queue full, writing inline for restaurant {}", restaurantId);
            persist(conversation);
        }
    }

    private void persist(Conversation conversation) {
        try {
            conversationRepository.save(conversation);
        } catch (RuntimeException e) {
            logger.error("Failed to log conversation for restaurant {} session {}",
                    conversation.getRestaurantId(), conversation.getSessionId(), e);
        }
    }
}
