package com.restaurantai.chat.service;

import com.google.common.util.concurrent.RateLimiter;
import com.restaurantai.chat.model.BackendKind;
import com.restaurantai.chat.model.MenuItem;
import com.restaurantai.chat.model.Restaurant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Entry point to whichever generative backend was selected at startup, or none.
 * Renders the restaurant prompt, applies the chat rate limit and delegates the call.
 */
public class BackendClient {

    private static final Logger logger = LoggerFactory.getLogger(BackendClient.class);

    private final GenerativeBackend backend;
    private final PromptBuilder promptBuilder;
    private final RateLimiter chatRateLimiter;
    private final long permitTimeoutMs;

    /**
     * @param backend         selected backend, or {@code null} when none is configured
     * @param promptBuilder   system prompt renderer
     * @param chatRateLimiter limiter applied to every backend call
     * @param permitTimeoutMs how long to wait for a permit before giving up on the backend
     */
    @SuppressWarnings("UnstableApiUsage")
    public BackendClient(GenerativeBackend backend,
                         PromptBuilder promptBuilder,
                         RateLimiter chatRateLimiter,
                         long permitTimeoutMs) {
        this.backend = backend;
        this.promptBuilder = promptBuilder;
        this.chatRateLimiter = chatRateLimiter;
        this.permitTimeoutMs = Math.max(0, permitTimeoutMs);
    }

    public boolean isConfigured() {
        return backend != null;
    }

    public BackendKind getKind() {
        return backend == null ? BackendKind.NONE : backend.getKind();
    }

    /**
     * Generates a reply for a restaurant.
     *
     * @throws BackendException when no backend is configured, the rate limit is exhausted or the call fails
     */
    @SuppressWarnings("UnstableApiUsage")
    public String generate(Restaurant restaurant, List<MenuItem> menuItems, String userMessage) {
        if (backend == null) {
            throw new BackendException("No generative backend configured", BackendException.NO_STATUS, null);
        }
        String systemPrompt = promptBuilder.buildSystemPrompt(restaurant, menuItems);
        logger.debug("System prompt for {} is {} characters", restaurant.getName(), systemPrompt.length());

        if (chatRateLimiter != null && !chatRateLimiter.tryAcquire(1, permitTimeoutMs, TimeUnit.MILLISECONDS)) {
            throw new BackendException(backend.getKind().getId() + " call rejected by chat rate limit", 429, null);
        }

        long start = System.nanoTime();
        String text = backend.generate(systemPrompt, userMessage);
        logger.info("{} responded in {} ms", backend.getKind().getId(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return text;
    }
}
