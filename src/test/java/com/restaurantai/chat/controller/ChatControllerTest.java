package com.restaurantai.chat.controller;

import com.restaurantai.chat.dto.ChatResponse;
import com.restaurantai.chat.dto.RecommendationDto;
import com.restaurantai.chat.dto.TenantInfoDto;
import com.restaurantai.chat.model.RequestContext;
import com.restaurantai.chat.model.TenantRoute;
import com.restaurantai.chat.service.ChatPipelineException;
import com.restaurantai.chat.service.ChatPipelineService;
import com.restaurantai.chat.service.EmptyMessageException;
import com.restaurantai.chat.service.StoreUnavailableException;
import com.restaurantai.chat.service.TenantNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    private static final String BODY = "{\"message\":\"hello\",\"session_id\":\"s1\"}";

    @Mock
    private ChatPipelineService chatPipelineService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ChatController(chatPipelineService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void returnsReplyAndPassesHostAndPathToPipeline() throws Exception {
        UUID itemId = UUID.randomUUID();
        when(chatPipelineService.chat(any(), any())).thenReturn(ChatResponse.ok("Ciao!",
                List.of(new RecommendationDto(itemId, "Tiramisu", new BigDecimal("9.00"), "Espresso-soaked ladyfingers.")),
                new TenantInfoDto(UUID.randomUUID(), "Luigi's Trattoria", "Marco")));

        mockMvc.perform(post("/r/luigis-trattoria/api/chat")
                        .header("Host", "localhost:5000")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.response").value("Ciao!"))
                .andExpect(jsonPath("$.recommendations[0].name").value("Tiramisu"))
                .andExpect(jsonPath("$.tenant.ai_name").value("Marco"))
                .andExpect(jsonPath("$.error").doesNotExist());

        ArgumentCaptor<RequestContext> context = ArgumentCaptor.forClass(RequestContext.class);
        verify(chatPipelineService).chat(context.capture(), any());
        assertThat(context.getValue().host()).isEqualTo("localhost:5000");
        assertThat(context.getValue().path()).isEqualTo("/r/luigis-trattoria/api/chat");
    }

    @Test
    void unroutedRequestIs404NotSpecified() throws Exception {
        when(chatPipelineService.chat(any(), any())).thenThrow(new TenantNotFoundException(TenantRoute.none()));

        mockMvc.perform(post("/api/chat").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Restaurant not specified"));
    }

    @Test
    void unknownRestaurantIs404NotFound() throws Exception {
        when(chatPipelineService.chat(any(), any())).thenThrow(new TenantNotFoundException(TenantRoute.subdomain("ghost")));

        mockMvc.perform(post("/api/chat").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Restaurant not found"));
    }

    @Test
    void emptyMessageIs400() throws Exception {
        when(chatPipelineService.chat(any(), any())).thenThrow(new EmptyMessageException());

        mockMvc.perform(post("/api/chat").contentType(MediaType.APPLICATION_JSON).content("{\"message\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Empty message"));
    }

    @Test
    void storeOutageIs503() throws Exception {
        when(chatPipelineService.chat(any(), any())).thenThrow(new StoreUnavailableException("db down", null));

        mockMvc.perform(post("/api/chat").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void anythingElseIs500WithGenericMessage() throws Exception {
        when(chatPipelineService.chat(any(), any()))
                .thenThrow(new ChatPipelineException("Failed to generate response", new IllegalStateException("NPE in template")));

        mockMvc.perform(post("/api/chat").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Failed to generate response"));
    }
}
