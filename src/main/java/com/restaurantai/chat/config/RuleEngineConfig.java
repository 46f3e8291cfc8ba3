package com.restaurantai.chat.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class RuleEngineConfig {

    /**
     * Randomness for canned-reply selection and item sampling. Set {@code app.rules.seed} to pin it.
     */
    @Bean
    public Random ruleEngineRandom(@Value("${app.rules.seed:#{null}}") Long seed) {
        return seed == null ? new Random() : new Random(seed);
    }
}
