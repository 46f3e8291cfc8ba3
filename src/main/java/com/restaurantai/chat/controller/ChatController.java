package com.restaurantai.chat.controller;

import com.restaurantai.chat.dto.ChatRequest;
import com.restaurantai.chat.dto.ChatResponse;
import com.restaurantai.chat.service.ChatPipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Chat", description = "Restaurant assistant chat")
public class ChatController {

    private final ChatPipelineService chatPipelineService;

    public ChatController(ChatPipelineService chatPipelineService) {
        this.chatPipelineService = chatPipelineService;
    }

    @Operation(
            summary = "Send a chat message to the restaurant assistant",
            description = "The restaurant is taken from the host subdomain, a /r/{slug} path, the restaurant_id " +
                    "query parameter or the restaurant_id body field, in that order. Replies come from the " +
                    "configured AI service, or from the rule engine when none is configured or the call fails."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reply generated",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ChatResponse.class))),
            @ApiResponse(responseCode = "400", description = "Empty message", content = @Content),
            @ApiResponse(responseCode = "404", description = "Restaurant not found or not specified", content = @Content),
            @ApiResponse(responseCode = "503", description = "Database unavailable", content = @Content)
    })
    @PostMapping({"/api/chat", "/r/{slug}/api/chat"})
    public ResponseEntity<ChatResponse> chat(@RequestBody(required = false) ChatRequest request,
                                             HttpServletRequest httpRequest) {
        return ResponseEntity.ok(chatPipelineService.chat(RequestContexts.from(httpRequest), request));
    }
}
