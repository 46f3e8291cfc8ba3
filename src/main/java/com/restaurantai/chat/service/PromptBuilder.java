package com.restaurantai.chat.service;

import com.restaurantai.chat.model.MenuItem;
import com.restaurantai.chat.model.Restaurant;
import org.springframework.stereotype.Component;

import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the restaurant-specific system prompt sent to the generative backend. Output is deterministic.
 */
@Component
public class PromptBuilder {

    private static final String PROMPT_TEMPLATE = """
            You are %s, the AI assistant for %s.
            You are %s.

            RESTAURANT MENU:
            %s

            GUIDELINES:
            - Be warm and engaging but keep responses concise (10-20 words typically)
            - Only mention prices when specifically asked
            - Make personalized recommendations based on preferences
            - Use emojis occasionally for warmth
            - Always stay in character for %s
            """;

    public String buildSystemPrompt(Restaurant restaurant, List<MenuItem> menuItems) {
        String menuText = menuItems.stream()
                .map(PromptBuilder::menuLine)
                .collect(Collectors.joining("\n"));
        return String.format(PROMPT_TEMPLATE,
                restaurant.resolveAiName(),
                restaurant.getName(),
                restaurant.resolveAiPersonality(),
                menuText,
                restaurant.getName());
    }

    static String menuLine(MenuItem item) {
        return "- " + item.getName() + ": " + nullToEmpty(item.getDescription())
                + " (" + formatPrice(item) + ")"
                + " [Category: " + item.getCategory()
                + ", Vegetarian: " + item.isVegetarian()
                + ", Vegan: " + item.isVegan()
                + ", Gluten-free: " + item.isGlutenFree() + "]";
    }

    /**
     * Formats a price as {@code $X.XX}.
     */
    public static String formatPrice(MenuItem item) {
        return "$" + item.priceOrZero().setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
