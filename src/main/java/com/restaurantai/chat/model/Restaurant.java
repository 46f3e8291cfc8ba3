package com.restaurantai.chat.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * A tenant of the chat service. Rows are created by the provisioning tool; this service only reads them.
 */
@Entity
@Table(name = "restaurants")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Restaurant {

    public static final String DEFAULT_AI_NAME = "Sophie";
    public static final String DEFAULT_AI_PERSONALITY = "friendly and helpful";

    @Id
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "subdomain", unique = true, updatable = false)
    private String subdomain;

    @Column(name = "slug", unique = true, updatable = false)
    private String slug;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    // Opaque to the chat pipeline; passed through to the homepage renderer.
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "theme_config")
    private Map<String, Object> themeConfig;

    @Column(name = "ai_personality", columnDefinition = "TEXT")
    private String aiPersonality;

    @Column(name = "ai_name")
    private String aiName;

    @Column(name = "welcome_message", columnDefinition = "TEXT")
    private String welcomeMessage;

    @Column(name = "logo_url")
    private String logoUrl;

    @Column(name = "active")
    private Boolean active;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    /**
     * @return the assistant name, falling back to {@value #DEFAULT_AI_NAME} when unset.
     */
    public String resolveAiName() {
        return aiName == null || aiName.isBlank() ? DEFAULT_AI_NAME : aiName;
    }

    /**
     * @return the persona description, falling back to {@value #DEFAULT_AI_PERSONALITY} when unset.
     */
    public String resolveAiPersonality() {
        return aiPersonality == null || aiPersonality.isBlank() ? DEFAULT_AI_PERSONALITY : aiPersonality;
    }
}
