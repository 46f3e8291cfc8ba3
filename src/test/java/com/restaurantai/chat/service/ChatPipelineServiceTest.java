package com.restaurantai.chat.service;

import com.restaurantai.chat.dto.ChatRequest;
import com.restaurantai.chat.dto.ChatResponse;
import com.restaurantai.chat.dto.RecommendationDto;
import com.restaurantai.chat.model.BackendKind;
import com.restaurantai.chat.model.MenuItem;
import com.restaurantai.chat.model.RequestContext;
import com.restaurantai.chat.model.TenantRoute;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatPipelineServiceTest {

    private static final RequestContext LUIGI_HOST = new RequestContext("luigi.restaurantai.com", "/api/chat", Map.of());

    @Mock
    private RestaurantStore restaurantStore;

    @Mock
    private BackendClient backendClient;

    @Mock
    private ConversationLogService conversationLogService;

    private final List<MenuItem> menu = MenuFixtures.menu();
    private ChatPipelineService pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new ChatPipelineService(
                new TenantRouteResolver(),
                restaurantStore,
                backendClient,
                new RuleEngineService(new Random(7)),
                new RecommendationExtractor(),
                new DialogueSessionStore(60, 1000),
                conversationLogService);
    }

    private void luigiIsServed() {
        when(restaurantStore.findRestaurant(TenantRoute.subdomain("luigi"))).thenReturn(Optional.of(MenuFixtures.luigis()));
        when(restaurantStore.findMenu(MenuFixtures.RESTAURANT_ID)).thenReturn(menu);
    }

    @Test
    void backendReplyGetsRecommendationsExtractedFromText() {
        luigiIsServed();
        when(backendClient.isConfigured()).thenReturn(true);
        when(backendClient.getKind()).thenReturn(BackendKind.OPENAI);
        when(backendClient.generate(any(), eq(menu), eq("what's good tonight?")))
                .thenReturn("The Tiramisu and the Bruschetta are favourites tonight!");

        ChatResponse response = pipeline.chat(LUIGI_HOST, new ChatRequest("what's good tonight?", "s1", null));

        assertThat(response.success()).isTrue();
        assertThat(response.response()).isEqualTo("The Tiramisu and the Bruschetta are favourites tonight!");
        assertThat(response.recommendations()).extracting(RecommendationDto::name).containsExactly("Bruschetta", "Tiramisu");
        assertThat(response.tenant().name()).isEqualTo("Luigi's Trattoria");
        verify(conversationLogService).record(eq(MenuFixtures.RESTAURANT_ID), eq("s1"), eq("what's good tonight?"),
                eq("The Tiramisu and the Bruschetta are favourites tonight!"), eq("openai"), anyLong());
    }

    @Test
    void backendFailureFallsBackToRulesAndLogsFallbackText() {
        luigiIsServed();
        when(backendClient.isConfigured()).thenReturn(true);
        when(backendClient.getKind()).thenReturn(BackendKind.GROQ);
        when(backendClient.generate(any(), eq(menu), anyString()))
                .thenThrow(new BackendException("groq API error: 500", 500, "code=internal_error, message=boom"));

        ChatResponse response = pipeline.chat(LUIGI_HOST, new ChatRequest("do you have vegan options", "s1", null));

        assertThat(response.success()).isTrue();
        assertThat(response.response()).startsWith("We offer 2 tasty vegan dishes!");
        assertThat(response.recommendations()).extracting(RecommendationDto::name)
                .containsExactly("Bruschetta", "Penne Arrabbiata");
        ArgumentCaptor<String> logged = ArgumentCaptor.forClass(String.class);
        verify(conversationLogService).record(eq(MenuFixtures.RESTAURANT_ID), eq("s1"), eq("do you have vegan options"),
                logged.capture(), eq("rules"), anyLong());
        assertThat(logged.getValue()).isEqualTo(response.response());
    }

    @Test
    void unconfiguredBackendGoesStraightToRules() {
        luigiIsServed();
        when(backendClient.isConfigured()).thenReturn(false);

        ChatResponse response = pipeline.chat(LUIGI_HOST, new ChatRequest("tell me about truffle risotto", null, null));

        assertThat(response.response()).contains("$24.00");
        assertThat(response.recommendations()).extracting(RecommendationDto::name).containsExactly("Truffle Risotto");
        verify(backendClient, never()).generate(any(), any(), anyString());
        verify(conversationLogService).record(eq(MenuFixtures.RESTAURANT_ID), eq("anonymous"), anyString(), anyString(),
                eq("rules"), anyLong());
    }

    @Test
    void greetingStateIsPerSession() {
        luigiIsServed();
        when(backendClient.isConfigured()).thenReturn(false);

        ChatResponse first = pipeline.chat(LUIGI_HOST, new ChatRequest("hello", "s1", null));
        ChatResponse otherSession = pipeline.chat(LUIGI_HOST, new ChatRequest("hello", "s2", null));
        ChatResponse repeat = pipeline.chat(LUIGI_HOST, new ChatRequest("hello", "s1", null));

        assertThat(first.response()).doesNotContain("again", "further", "other questions");
        assertThat(otherSession.response()).doesNotContain("again", "further", "other questions");
        assertThat(repeat.response()).containsAnyOf("again", "further", "other questions");
    }

    @Test
    void unresolvedTenantTouchesNothing() {
        RequestContext bare = new RequestContext("localhost", "/api/chat", Map.of());

        assertThatThrownBy(() -> pipeline.chat(bare, new ChatRequest("hello", "s1", null)))
                .isInstanceOfSatisfying(TenantNotFoundException.class, e -> assertThat(e.isUnrouted()).isTrue());
        verifyNoInteractions(restaurantStore, backendClient, conversationLogService);
    }

    @Test
    void unknownTenantIsNotFound() {
        when(restaurantStore.findRestaurant(TenantRoute.subdomain("ghost"))).thenReturn(Optional.empty());
        RequestContext ghost = new RequestContext("ghost.restaurantai.com", "/api/chat", Map.of());

        assertThatThrownBy(() -> pipeline.chat(ghost, new ChatRequest("hello", "s1", null)))
                .isInstanceOfSatisfying(TenantNotFoundException.class, e -> assertThat(e.isUnrouted()).isFalse());
        verifyNoInteractions(backendClient, conversationLogService);
    }

    @Test
    void blankMessageIsRejectedBeforeAnyLookup() {
        assertThatThrownBy(() -> pipeline.chat(LUIGI_HOST, new ChatRequest("   ", "s1", null)))
                .isInstanceOf(EmptyMessageException.class);
        verifyNoInteractions(restaurantStore, backendClient, conversationLogService);
    }

    @Test
    void bodyRestaurantIdRoutesBySlug() {
        when(restaurantStore.findRestaurant(TenantRoute.slug("luigis-trattoria"))).thenReturn(Optional.of(MenuFixtures.luigis()));
        when(restaurantStore.findMenu(MenuFixtures.RESTAURANT_ID)).thenReturn(menu);
        when(backendClient.isConfigured()).thenReturn(false);
        RequestContext bare = new RequestContext("localhost:5000", "/api/chat", Map.of());

        ChatResponse response = pipeline.chat(bare, new ChatRequest("thanks", "s1", "luigis-trattoria"));

        assertThat(response.success()).isTrue();
    }

    @Test
    void storeOutagePropagates() {
        when(restaurantStore.findRestaurant(TenantRoute.subdomain("luigi")))
                .thenThrow(new StoreUnavailableException("db down", new DataAccessResourceFailureException("refused")));

        assertThatThrownBy(() -> pipeline.chat(LUIGI_HOST, new ChatRequest("hello", "s1", null)))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void unexpectedFailureIsWrappedWithSafeMessage() {
        luigiIsServed();
        when(backendClient.isConfigured()).thenReturn(true);
        when(backendClient.generate(any(), eq(menu), anyString())).thenThrow(new IllegalStateException("bug"));

        assertThatThrownBy(() -> pipeline.chat(LUIGI_HOST, new ChatRequest("hello", "s1", null)))
                .isInstanceOf(ChatPipelineException.class)
                .hasMessage("Failed to generate response");
    }
}
