package com.restaurantai.chat.controller;

import com.restaurantai.chat.dto.MenuResponse;
import com.restaurantai.chat.dto.RestaurantProfileResponse;
import com.restaurantai.chat.dto.TenantInfoDto;
import com.restaurantai.chat.model.MenuItem;
import com.restaurantai.chat.model.Restaurant;
import com.restaurantai.chat.service.ChatPipelineService;
import com.restaurantai.chat.service.RestaurantStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Tag(name = "Menu", description = "Tenant-scoped restaurant profile and menu")
public class MenuController {

    private final ChatPipelineService chatPipelineService;
    private final RestaurantStore restaurantStore;

    public MenuController(ChatPipelineService chatPipelineService, RestaurantStore restaurantStore) {
        this.chatPipelineService = chatPipelineService;
        this.restaurantStore = restaurantStore;
    }

    @Operation(summary = "Active menu items for the routed restaurant",
            description = "Items are ordered by display order, then category, then name.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Menu returned",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = MenuResponse.class))),
            @ApiResponse(responseCode = "404", description = "Restaurant not found or not specified", content = @Content)
    })
    @GetMapping({"/api/menu", "/r/{slug}/api/menu"})
    public ResponseEntity<MenuResponse> menu(HttpServletRequest httpRequest) {
        Restaurant restaurant = routedRestaurant(httpRequest);
        List<MenuItem> items = restaurantStore.findMenu(restaurant.getId());
        return ResponseEntity.ok(new MenuResponse(true, TenantInfoDto.from(restaurant), items, items.size()));
    }

    @Operation(summary = "Display profile of the routed restaurant")
    @GetMapping({"/api/restaurant", "/r/{slug}/api/restaurant"})
    public ResponseEntity<RestaurantProfileResponse> restaurant(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(RestaurantProfileResponse.from(routedRestaurant(httpRequest)));
    }

    private Restaurant routedRestaurant(HttpServletRequest httpRequest) {
        return chatPipelineService.requireRestaurant(
                chatPipelineService.resolveRoute(RequestContexts.from(httpRequest), null));
    }
}
