package com.restaurantai.chat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import com.restaurantai.chat.model.BackendKind;
import com.restaurantai.chat.service.BackendClient;
import com.restaurantai.chat.service.GenerativeBackend;
import com.restaurantai.chat.service.OpenAiCompatibleBackend;
import com.restaurantai.chat.service.PromptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Picks the generative backend once at startup: OpenAI if its key is set, else Groq, else none.
 */
@Configuration
public class GenerativeBackendConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(GenerativeBackendConfiguration.class);

    @Value("${app.backend.openai.api-key:}")
    private String openAiApiKey;
    @Value("${app.backend.openai.url:}")
    private String openAiUrl;
    @Value("${app.backend.openai.model:}")
    private String openAiModel;

    @Value("${app.backend.groq.api-key:}")
    private String groqApiKey;
    @Value("${app.backend.groq.url:}")
    private String groqUrl;
    @Value("${app.backend.groq.model:}")
    private String groqModel;

    @Value("${app.backend.max-tokens:80}")
    private int maxTokens;
    @Value("${app.backend.temperature:0.8}")
    private double temperature;
    @Value("${app.backend.timeout-ms:10000}")
    private long timeoutMs;
    @Value("${app.backend.permit-timeout-ms:500}")
    private long permitTimeoutMs;

    @Bean("backendRestTemplate")
    public RestTemplate backendRestTemplate(RestTemplateBuilder builder) {
        Duration timeout = Duration.ofMillis(Math.max(1, timeoutMs));
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    @SuppressWarnings("UnstableApiUsage")
    public BackendClient backendClient(@Qualifier("backendRestTemplate") RestTemplate restTemplate,
                                       ObjectMapper objectMapper,
                                       PromptBuilder promptBuilder,
                                       @Qualifier("chatRateLimiter") RateLimiter chatRateLimiter) {
        GenerativeBackend backend = switch (selectKind(openAiApiKey, groqApiKey)) {
            case OPENAI -> new OpenAiCompatibleBackend(BackendKind.OPENAI, restTemplate, objectMapper,
                    openAiUrl, openAiApiKey, openAiModel, maxTokens, temperature);
            case GROQ -> new OpenAiCompatibleBackend(BackendKind.GROQ, restTemplate, objectMapper,
                    groqUrl, groqApiKey, groqModel, maxTokens, temperature);
            case NONE -> null;
        };
        if (backend == null) {
            logger.warn("No AI API key found. Falling back to rule-based responses. "
                    + "Set app.backend.openai.api-key or app.backend.groq.api-key to enable generated replies.");
        } else {
            String key = backend.getKind() == BackendKind.OPENAI ? openAiApiKey : groqApiKey;
            logger.info("Using {} as AI service (key {})", backend.getKind().getId(), mask(key));
        }
        return new BackendClient(backend, promptBuilder, chatRateLimiter, permitTimeoutMs);
    }

    /**
     * Backend priority: OpenAI, then Groq, then none.
     */
    static BackendKind selectKind(String openAiKey, String groqKey) {
        if (openAiKey != null && !openAiKey.isBlank()) {
            return BackendKind.OPENAI;
        }
        if (groqKey != null && !groqKey.isBlank()) {
            return BackendKind.GROQ;
        }
        return BackendKind.NONE;
    }

    static String mask(String key) {
        if (key == null || key.length() <= 12) {
            return "****";
        }
        return key.substring(0, 8) + "..." + key.substring(key.length() - 4);
    }
}
