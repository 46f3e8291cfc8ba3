package com.restaurantai.chat.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One chat turn sent by the browser widget")
public class ChatRequest {
    @Schema(description = "User message", requiredMode = Schema.RequiredMode.REQUIRED, example = "Do you have vegan options?")
    private String message;

    @JsonProperty("session_id")
    @Schema(description = "Client-generated conversation id; defaults to 'anonymous'", example = "b4f1c2")
    private String sessionId;

    @JsonProperty("restaurant_id")
    @Schema(description = "Restaurant slug, used when neither host nor path identify the restaurant", example = "luigi")
    private String restaurantId;
}
