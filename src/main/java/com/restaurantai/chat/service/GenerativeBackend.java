package com.restaurantai.chat.service;

import com.restaurantai.chat.model.BackendKind;

/**
 * A chat-completion service able to answer a user message under a system prompt.
 */
public interface GenerativeBackend {

    BackendKind getKind();

    /**
     * @param systemPrompt rendered restaurant prompt
     * @param userMessage  raw user message
     * @return trimmed response text, never empty
     * @throws BackendException on transport errors, non-2xx responses or malformed bodies
     */
    String generate(String systemPrompt, String userMessage);
}
