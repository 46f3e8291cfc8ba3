package com.restaurantai.chat.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-conversation state used by the rule engine. One instance per (restaurant, session) pair.
 */
public class DialogueSession {

    private final String sessionId;
    private final AtomicBoolean greetingUsed = new AtomicBoolean(false);

    public DialogueSession(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public boolean isGreetingUsed() {
        return greetingUsed.get();
    }

    /**
     * Marks the greeting as issued.
     *
     * @return {@code true} if this call was the first greeting of the session
     */
    public boolean markGreeted() {
        return greetingUsed.compareAndSet(false, true);
    }
}
