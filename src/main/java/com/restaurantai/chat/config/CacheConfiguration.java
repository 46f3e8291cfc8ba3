package com.restaurantai.chat.config;

import com.restaurantai.chat.service.FastCache;
import com.restaurantai.chat.service.InMemoryFastCache;
import com.restaurantai.chat.service.RedisFastCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class CacheConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(CacheConfiguration.class);

    @Value("${app.cache.type:redis}")
    private String cacheType;

    @Bean
    public FastCache fastCache(ObjectProvider<StringRedisTemplate> redisTemplate) {
        if ("memory".equalsIgnoreCase(cacheType)) {
            logger.info("Using in-process cache for restaurant data");
            return new InMemoryFastCache();
        }
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template == null) {
            throw new IllegalStateException("app.cache.type=redis but no StringRedisTemplate is configured");
        }
        logger.info("Using Redis cache for restaurant data");
        return new RedisFastCache(template);
    }
}
