package com.restaurantai.chat.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.restaurantai.chat.model.BackendKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Calls an OpenAI-style {@code /chat/completions} endpoint (OpenAI itself, or Groq's compatible API).
 */
public class OpenAiCompatibleBackend implements GenerativeBackend {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiCompatibleBackend.class);

    private final BackendKind kind;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String url;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final double temperature;

    /**
     * @param kind          which backend this instance talks to
     * @param restTemplate  HTTP client carrying connect/read timeouts
     * @param objectMapper  JSON mapper for request and response bodies
     * @param url           chat-completions endpoint
     * @param apiKey        bearer token
     * @param model         model identifier sent with every request
     * @param maxTokens     response length bound
     * @param temperature   sampling temperature
     */
    public OpenAiCompatibleBackend(BackendKind kind,
                                   RestTemplate restTemplate,
                                   ObjectMapper objectMapper,
                                   String url,
                                   String apiKey,
                                   String model,
                                   int maxTokens,
                                   double temperature) {
        if (kind == BackendKind.NONE) {
            throw new IllegalArgumentException("OpenAiCompatibleBackend needs a concrete backend kind");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key for " + kind.getId() + " must not be blank");
        }
        this.kind = kind;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.url = url != null && !url.isBlank() ? url : kind.getDefaultUrl();
        this.apiKey = apiKey;
        this.model = model != null && !model.isBlank() ? model : kind.getDefaultModel();
        this.maxTokens = Math.max(16, maxTokens);
        this.temperature = temperature;
    }

    @Override
    public BackendKind getKind() {
        return kind;
    }

    public String getModel() {
        return model;
    }

    @Override
    public String generate(String systemPrompt, String userMessage) {
        String payload = buildPayload(systemPrompt, userMessage);

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String detail = upstreamErrorDetail(e.getResponseBodyAsString());
            throw new BackendException(kind.getId() + " API error: " + status, status, detail, e);
        } catch (ResourceAccessException e) {
            throw new BackendException(kind.getId() + " API unreachable", BackendException.NO_STATUS, e.getMessage(), e);
        } catch (RestClientException e) {
            throw new BackendException(kind.getId() + " API call failed", BackendException.NO_STATUS, e.getMessage(), e);
        }

        int status = response.getStatusCode().value();
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new BackendException(kind.getId() + " API error: " + status, status, response.getBody());
        }
        return extractContent(response.getBody(), status);
    }

    private String buildPayload(String systemPrompt, String userMessage) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model);
        ArrayNode messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemPrompt);
        messages.addObject().put("role", "user").put("content", userMessage);
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", temperature);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new BackendException("Could not serialize " + kind.getId() + " request", BackendException.NO_STATUS, e.getOriginalMessage(), e);
        }
    }

    private String extractContent(String body, int status) {
        if (body == null || body.isBlank()) {
            throw new BackendException(kind.getId() + " API returned an empty body", status, null);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new BackendException(kind.getId() + " API returned malformed JSON", status, e.getOriginalMessage(), e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new BackendException(kind.getId() + " API response missing choices[0].message.content", status, abbreviate(body));
        }
        String text = stripFences(content.asText().trim());
        if (text.isEmpty()) {
            throw new BackendException(kind.getId() + " API returned empty content", status, null);
        }
        return text;
    }

    // Models sometimes wrap plain answers in ``` fences
    private String stripFences(String text) {
        if (text.startsWith("```") && text.endsWith("```") && text.length() >= 6) {
            return text.substring(3, text.length() - 3).trim();
        }
        return text;
    }

    private String upstreamErrorDetail(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.isObject()) {
                String code = error.path("code").asText("unknown");
                String message = error.path("message").asText("Unknown error");
                return "code=" + code + ", message=" + message;
            }
        } catch (JsonProcessingException e) {
            logger.debug("{} error body is not JSON: {}", kind.getId(), e.getOriginalMessage());
        }
        return abbreviate(body);
    }

    private static String abbreviate(String value) {
        return value.length() <= 300 ? value : value.substring(0, 300) + "...";
    }
}
