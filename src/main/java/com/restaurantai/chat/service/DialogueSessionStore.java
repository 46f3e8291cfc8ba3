package com.restaurantai.chat.service;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.restaurantai.chat.model.DialogueSession;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

/**
 * Owns rule-engine dialogue state, one {@link DialogueSession} per (restaurant, session id).
 * Sessions are dropped after a period of inactivity.
 */
@Component
public class DialogueSessionStore {

    private final Cache<String, DialogueSession> sessions;

    public DialogueSessionStore(@Value("${app.dialogue.session-ttl-minutes:60}") long ttlMinutes,
                                @Value("${app.dialogue.max-sessions:100000}") long maxSessions) {
        this.sessions = CacheBuilder.newBuilder()
                .expireAfterAccess(Duration.ofMinutes(Math.max(1, ttlMinutes)))
                .maximumSize(Math.max(1, maxSessions))
                .build();
    }

    /**
     * Returns the session for this conversation thread, creating it on first use.
     */
    public DialogueSession sessionFor(UUID restaurantId, String sessionId) {
        String key = restaurantId + "|" + sessionId;
        try {
            return sessions.get(key, () -> new DialogueSession(sessionId));
        } catch (ExecutionException e) {
            // the loader cannot throw a checked exception
            throw new IllegalStateException("Failed to create dialogue session " + key, e.getCause());
        }
    }

    public long size() {
        sessions.cleanUp();
        return sessions.size();
    }
}
