package com.restaurantai.chat.service;

import com.restaurantai.chat.dto.ChatRequest;
import com.restaurantai.chat.dto.ChatResponse;
import com.restaurantai.chat.dto.RecommendationDto;
import com.restaurantai.chat.dto.TenantInfoDto;
import com.restaurantai.chat.model.DialogueSession;
import com.restaurantai.chat.model.GeneratedReply;
import com.restaurantai.chat.model.MenuItem;
import com.restaurantai.chat.model.RequestContext;
import com.restaurantai.chat.model.Restaurant;
import com.restaurantai.chat.model.TenantRoute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Per-request chat flow: resolve tenant, load profile and menu through the cache, generate a reply
 * (backend first, rule engine on failure or when no backend is configured), pick recommendations,
 * log the exchange and build the response.
 */
@Service
public class ChatPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(ChatPipelineService.class);

    static final String ANONYMOUS_SESSION = "anonymous";
    static final String GENERIC_FAILURE = "Failed to generate response";

    private final TenantRouteResolver tenantRouteResolver;
    private final RestaurantStore restaurantStore;
    private final BackendClient backendClient;
    private final RuleEngineService ruleEngineService;
    private final RecommendationExtractor recommendationExtractor;
    private final DialogueSessionStore dialogueSessionStore;
    private final ConversationLogService conversationLogService;

    public ChatPipelineService(TenantRouteResolver tenantRouteResolver,
                               RestaurantStore restaurantStore,
                               BackendClient backendClient,
                               RuleEngineService ruleEngineService,
                               RecommendationExtractor recommendationExtractor,
                               DialogueSessionStore dialogueSessionStore,
                               ConversationLogService conversationLogService) {
        this.tenantRouteResolver = tenantRouteResolver;
        this.restaurantStore = restaurantStore;
        this.backendClient = backendClient;
        this.ruleEngineService = ruleEngineService;
        this.recommendationExtractor = recommendationExtractor;
        this.dialogueSessionStore = dialogueSessionStore;
        this.conversationLogService = conversationLogService;
    }

    /**
     * Runs one chat turn.
     *
     * @throws TenantNotFoundException   no routable identifier, or no active restaurant for it
     * @throws EmptyMessageException     blank message; nothing is read or written
     * @throws StoreUnavailableException the database could not be reached
     * @throws ChatPipelineException     any other failure, with a user-safe message
     */
    public ChatResponse chat(RequestContext context, ChatRequest request) {
        TenantRoute route = resolveRoute(context, request == null ? null : request.getRestaurantId());
        if (!route.isResolved()) {
            throw new TenantNotFoundException(route);
        }
        String message = request == null || request.getMessage() == null ? "" : request.getMessage().trim();
        if (message.isEmpty()) {
            throw new EmptyMessageException();
        }
        String sessionId = StringUtils.hasText(request.getSessionId()) ? request.getSessionId().trim() : ANONYMOUS_SESSION;

        try {
            Restaurant restaurant = requireRestaurant(route);
            List<MenuItem> menu = restaurantStore.findMenu(restaurant.getId());
            logger.info("Chat for restaurant {} ({} menu items), session {}", restaurant.getName(), menu.size(), sessionId);

            long start = System.nanoTime();
            GeneratedReply reply = generateReply(restaurant, menu, message, sessionId);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            conversationLogService.record(restaurant.getId(), sessionId, message, reply.text(), reply.engine(), elapsedMs);

            List<RecommendationDto> recommendations = reply.recommendations().stream()
                    .map(RecommendationDto::from)
                    .toList();
            return ChatResponse.ok(reply.text(), recommendations, TenantInfoDto.from(restaurant));
        } catch (TenantNotFoundException | StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Error generating response for {}", route.cacheKey(), e);
            throw new ChatPipelineException(GENERIC_FAILURE, e);
        }
    }

    /**
     * Resolves the request to a route without touching cache or database.
     */
    public TenantRoute resolveRoute(RequestContext context, String bodyRestaurantId) {
        return tenantRouteResolver.resolve(context.host(), context.path(), context.queryParams(), bodyRestaurantId);
    }

    /**
     * Loads the active restaurant for a route through the cache.
     *
     * @throws TenantNotFoundException when the route is unresolved or matches no active restaurant
     */
    public Restaurant requireRestaurant(TenantRoute route) {
        if (!route.isResolved()) {
            throw new TenantNotFoundException(route);
        }
        return restaurantStore.findRestaurant(route).orElseThrow(() -> new TenantNotFoundException(route));
    }

    private GeneratedReply generateReply(Restaurant restaurant, List<MenuItem> menu, String message, String sessionId) {
        if (backendClient.isConfigured()) {
            try {
                String text = backendClient.generate(restaurant, menu, message);
                return new GeneratedReply(text, recommendationExtractor.extract(text, menu), backendClient.getKind().getId());
            } catch (BackendException e) {
                logger.warn("{} backend failed (status {}, detail: {}), falling back to rule engine: {}",
                        backendClient.getKind().getId(), e.getStatusCode(), e.getDetail(), e.getMessage());
            }
        }
        DialogueSession session = dialogueSessionStore.sessionFor(restaurant.getId(), sessionId);
        return ruleEngineService.respond(message, restaurant, menu, session);
    }
}
