package com.restaurantai.chat.config;

import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiterConfig.class);

    /**
     * Shared limit on generative backend calls across all restaurants. {@code app.ratelimit.chatQps <= 0} disables it.
     */
    @Bean("chatRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter chatRateLimiter(@Value("${app.ratelimit.chatQps:0}") double chatQps) {
        if (chatQps <= 0) {
            logger.info("Backend chat calls are not rate limited");
            return RateLimiter.create(Double.MAX_VALUE);
        }
        logger.info("Backend chat calls limited to {} per second", chatQps);
        return RateLimiter.create(chatQps);
    }
}
