package com.restaurantai.chat.service;

import com.restaurantai.chat.model.DialogueSession;
import com.restaurantai.chat.model.GeneratedReply;
import com.restaurantai.chat.model.Intent;
import com.restaurantai.chat.model.MenuItem;
import com.restaurantai.chat.model.Restaurant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword-driven responder used when no generative backend is configured or the backend call failed.
 * Never throws for a non-empty message; unmatched input resolves to general conversation.
 */
@Service
public class RuleEngineService {

    private static final Logger logger = LoggerFactory.getLogger(RuleEngineService.class);

    // Whole-word matches, so "hi" does not fire inside "chicken" or "eat" inside "meatballs"
    private static final Pattern GREETING_KEYWORDS =
            wordPattern("hello", "hi", "hey", "good morning", "good afternoon", "good evening");
    private static final Pattern MENU_KEYWORDS =
            wordPattern("menu", "dishes", "food", "eat", "order", "available", "serve");
    private static final Pattern DIETARY_KEYWORDS =
            wordPattern("vegetarian", "vegan", "gluten", "allergy", "dairy", "nuts");
    private static final Pattern RECOMMENDATION_KEYWORDS =
            wordPattern("recommend", "suggest", "best", "popular", "hungry", "mood", "craving");

    private static final int FEATURED_COUNT = 3;
    private static final int MENU_SAMPLE_COUNT = 3;
    private static final int DEFAULT_SAMPLE_COUNT = 2;
    private static final int MAX_RECOMMENDATIONS = 2;
    private static final int POPULAR_COUNT = 3;

    // Heuristic thresholds, tunable.
    private static final int HEARTY_MIN_CALORIES = 350;
    private static final int LIGHT_MAX_CALORIES = 300;
    private static final int HEALTHY_MAX_CALORIES = 400;
    private static final int SPICY_MIN_LEVEL = 2;
    private static final BigDecimal POPULARITY_PRICE_PIVOT = BigDecimal.valueOf(30);

    private final Random random;

    public RuleEngineService(Random ruleEngineRandom) {
        this.random = ruleEngineRandom;
    }

    /**
     * Produces a canned reply and its recommendations.
     *
     * @param message    raw user message
     * @param restaurant the tenant, used for persona text
     * @param menuItems  active menu in display order
     * @param session    dialogue state of this conversation thread
     */
    public GeneratedReply respond(String message, Restaurant restaurant, List<MenuItem> menuItems, DialogueSession session) {
        String normalized = message == null ? "" : message.toLowerCase(Locale.ROOT).trim();
        List<MenuItem> menu = menuItems == null ? List.of() : menuItems;
        Intent intent = classify(normalized, menu);
        logger.debug("Rule engine classified '{}' as {}", normalized, intent);

        return switch (intent) {
            case GREETING -> greeting(restaurant, menu, session);
            case MENU_QUERY -> menuQuery(normalized, menu);
            case DIETARY_QUERY -> dietaryQuery(normalized, menu);
            case RECOMMENDATION_REQUEST -> recommendationRequest(normalized, menu);
            case SPECIFIC_ITEM_QUERY -> specificItemQuery(normalized, menu);
            case GENERAL_CONVERSATION -> generalConversation(normalized, menu);
        };
    }

    /**
     * Classifies a lower-cased, trimmed message. Categories are checked in {@link Intent} order.
     */
    public Intent classify(String normalized, List<MenuItem> menuItems) {
        if (GREETING_KEYWORDS.matcher(normalized).find()) {
            return Intent.GREETING;
        }
        if (MENU_KEYWORDS.matcher(normalized).find()) {
            return Intent.MENU_QUERY;
        }
        if (DIETARY_KEYWORDS.matcher(normalized).find()) {
            return Intent.DIETARY_QUERY;
        }
        if (RECOMMENDATION_KEYWORDS.matcher(normalized).find()) {
            return Intent.RECOMMENDATION_REQUEST;
        }
        if (mentionsMenuItem(normalized, menuItems)) {
            return Intent.SPECIFIC_ITEM_QUERY;
        }
        return Intent.GENERAL_CONVERSATION;
    }

    private GeneratedReply greeting(Restaurant restaurant, List<MenuItem> menu, DialogueSession session) {
        String text;
        if (session == null || session.markGreeted()) {
            String welcome = restaurant == null ? null : restaurant.getWelcomeMessage();
            if (welcome != null && !welcome.isBlank()) {
                text = welcome;
            } else {
                String aiName = restaurant == null ? Restaurant.DEFAULT_AI_NAME : restaurant.resolveAiName();
                String place = restaurant == null || restaurant.getName() == null ? "our restaurant" : restaurant.getName();
                text = pick(List.of(
                        "Hello! Welcome to " + place + "! I'm " + aiName + ", here to help you discover delicious dishes that match your taste. What can I help you find today?",
                        "Hi there! I'm excited to help you explore our menu and find something amazing to eat. Are you looking for something specific, or would you like me to suggest some popular options?",
                        "Welcome! I'm here to make your dining experience special. Whether you're craving something specific or want to try something new, I'm here to help. What sounds good to you?"
                ));
            }
        } else {
            text = pick(List.of(
                    "Nice to see you again! What else can I help you with from our menu?",
                    "How can I assist you further with your dining choices?",
                    "What other questions do you have about our dishes?"
            ));
        }
        return reply(text, menu.subList(0, Math.min(FEATURED_COUNT, menu.size())));
    }

    private GeneratedReply menuQuery(String message, List<MenuItem> menu) {
        String text;
        if (menu.isEmpty()) {
            text = "Our menu is being updated right now. Please check back in a moment!";
        } else if (message.contains("categories") || message.contains("types")) {
            Set<String> categories = menu.stream()
                    .map(MenuItem::getCategory)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            text = "We offer dishes in these categories: " + String.join(", ", categories)
                    + ". We have " + menu.size() + " delicious options total. Would you like to explore any specific category?";
        } else if (message.contains("price") || message.contains("cost")) {
            BigDecimal min = menu.stream().map(MenuItem::priceOrZero).min(Comparator.naturalOrder()).orElse(BigDecimal.ZERO);
            BigDecimal max = menu.stream().map(MenuItem::priceOrZero).max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO);
            text = "Our menu prices range from " + money(min) + " to " + money(max) + ". What's your budget range today?";
        } else {
            text = "Our menu features " + menu.size() + " carefully crafted dishes. We have options for every dietary preference and taste. What type of food are you in the mood for?";
        }
        return reply(text, sample(menu, MENU_SAMPLE_COUNT));
    }

    private GeneratedReply dietaryQuery(String message, List<MenuItem> menu) {
        List<MenuItem> matches;
        StringBuilder text = new StringBuilder();
        if (message.contains("vegetarian")) {
            matches = filter(menu, MenuItem::isVegetarian);
            text.append("We have ").append(matches.size()).append(" delicious vegetarian options! ");
        } else if (message.contains("vegan")) {
            matches = filter(menu, MenuItem::isVegan);
            text.append("We offer ").append(matches.size()).append(" tasty vegan dishes! ");
        } else if (message.contains("gluten")) {
            matches = filter(menu, MenuItem::isGlutenFree);
            text.append("We have ").append(matches.size()).append(" gluten-free options available! ");
        } else {
            text.append("I'd be happy to help with dietary preferences! We accommodate vegetarian, vegan, and gluten-free diets. "
                    + "We also list all allergens for each dish. What specific dietary needs do you have?");
            return reply(text.toString(), sample(menu, DEFAULT_SAMPLE_COUNT));
        }

        List<MenuItem> examples = matches.subList(0, Math.min(MAX_RECOMMENDATIONS, matches.size()));
        if (!examples.isEmpty()) {
            text.append("I especially recommend: ")
                    .append(examples.stream().map(MenuItem::getName).collect(Collectors.joining(" and ")))
                    .append(".");
        }
        return reply(text.toString().trim(), examples);
    }

    private GeneratedReply recommendationRequest(String message, List<MenuItem> menu) {
        List<MenuItem> candidates;
        String text;
        if (containsAny(message, List.of("hungry", "starving", "filling"))) {
            candidates = filter(menu, item -> "main".equalsIgnoreCase(item.getCategory())
                    && item.caloriesOrZero() > HEARTY_MIN_CALORIES);
            text = "You sound really hungry! I recommend our hearty main courses that will definitely satisfy your appetite.";
        } else if (containsAny(message, List.of("light", "small"))) {
            candidates = filter(menu, item -> "appetizer".equalsIgnoreCase(item.getCategory())
                    || item.caloriesOrZero() < LIGHT_MAX_CALORIES);
            text = "For something light, our appetizers are perfect, or I can suggest some lighter main dishes.";
        } else if (containsAny(message, List.of("spicy", "hot"))) {
            candidates = filter(menu, item -> item.getSpiceLevel() > SPICY_MIN_LEVEL);
            text = "Looking for some heat? Our spicy dishes will definitely give you that kick you're craving!";
        } else if (containsAny(message, List.of("healthy", "nutritious", "diet"))) {
            candidates = filter(menu, item -> item.caloriesOrZero() < HEALTHY_MAX_CALORIES || item.isGlutenFree());
            text = "For healthy choices, I recommend our nutritious options that are both delicious and good for you.";
        } else if (containsAny(message, List.of("sweet", "dessert"))) {
            candidates = filter(menu, item -> "dessert".equalsIgnoreCase(item.getCategory()));
            text = "Our desserts are absolutely divine! Perfect way to end your meal on a sweet note.";
        } else {
            candidates = popular(menu);
            text = "I'd love to recommend some of our most popular dishes that guests absolutely love!";
        }
        return reply(text, candidates.subList(0, Math.min(MAX_RECOMMENDATIONS, candidates.size())));
    }

    private GeneratedReply specificItemQuery(String message, List<MenuItem> menu) {
        for (MenuItem item : menu) {
            if (!nameMentioned(message, item)) {
                continue;
            }
            StringBuilder text = new StringBuilder("Great choice! Our ")
                    .append(item.getName()).append(" is ")
                    .append(item.getDescription() == null ? "one of our favourites." : item.getDescription())
                    .append(" It's priced at ").append(PromptBuilder.formatPrice(item)).append(".");
            if (message.contains("ingredient")) {
                text.append(" The main ingredients are: ").append(String.join(", ", item.ingredientList())).append(".");
            }
            if (message.contains("allerg")) {
                text.append(item.allergenList().isEmpty()
                        ? " This dish has no major allergens."
                        : " Please note it contains: " + String.join(", ", item.allergenList()) + ".");
            }
            if (message.contains("spicy") || message.contains("hot")) {
                text.append(" The spice level is ").append(item.getSpiceLevel()).append(" out of 5.");
            }
            if (message.contains("time") && item.getPrepTime() != null) {
                text.append(" Preparation time is about ").append(item.getPrepTime()).append(".");
            }
            return reply(text.toString(), List.of(item));
        }
        // matched on an ingredient only
        return reply("I'd be happy to tell you about any of our dishes! Could you be more specific about which item you're interested in, "
                + "or would you like me to suggest something based on your preferences?", sample(menu, DEFAULT_SAMPLE_COUNT));
    }

    private GeneratedReply generalConversation(String message, List<MenuItem> menu) {
        List<String> responses;
        if (containsAny(message, List.of("how are you", "how do you do"))) {
            responses = List.of(
                    "I'm doing great, thank you for asking! I'm excited to help you find something delicious to eat. What sounds good to you today?",
                    "I'm wonderful, thanks! Ready to help you discover your next favorite dish. What are you in the mood for?");
        } else if (containsAny(message, List.of("thank you", "thanks"))) {
            responses = List.of(
                    "You're very welcome! I'm here whenever you need help with our menu. Anything else I can assist you with?",
                    "My pleasure! I love helping people find great food. Is there anything else you'd like to know?");
        } else if (containsAny(message, List.of("bye", "goodbye", "see you"))) {
            responses = List.of(
                    "Goodbye! I hope you enjoy your meal and have a wonderful dining experience. Come back anytime!",
                    "Have a fantastic meal! It was great helping you today. See you next time!");
        } else {
            responses = List.of(
                    "That's an interesting question! While I specialize in helping with our menu and dining recommendations, I'm always happy to chat. Speaking of food, is there anything from our menu I can help you with?",
                    "I appreciate you asking! I'm here primarily to help you navigate our delicious menu options. What kind of flavors are you craving today?",
                    "Thanks for sharing! I'd love to help you find something amazing to eat. Are you looking for any particular type of cuisine or dish?");
        }
        return reply(pick(responses), sample(menu, DEFAULT_SAMPLE_COUNT));
    }

    /**
     * Most popular items by {@code calories + (30 - price)}, ascending.
     */
    List<MenuItem> popular(List<MenuItem> menu) {
        return menu.stream()
                .sorted(Comparator.comparing((MenuItem item) ->
                        BigDecimal.valueOf(item.caloriesOrZero()).add(POPULARITY_PRICE_PIVOT).subtract(item.priceOrZero())))
                .limit(POPULAR_COUNT)
                .collect(Collectors.toList());
    }

    private boolean mentionsMenuItem(String message, List<MenuItem> menu) {
        for (MenuItem item : menu) {
            if (nameMentioned(message, item)) {
                return true;
            }
            for (String ingredient : item.ingredientList()) {
                if (ingredient != null && !ingredient.isBlank() && message.contains(ingredient.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean nameMentioned(String message, MenuItem item) {
        return item.getName() != null && !item.getName().isBlank()
                && message.contains(item.getName().toLowerCase(Locale.ROOT));
    }

    private List<MenuItem> sample(List<MenuItem> menu, int count) {
        List<MenuItem> copy = new ArrayList<>(menu);
        Collections.shuffle(copy, random);
        return List.copyOf(copy.subList(0, Math.min(count, copy.size())));
    }

    private String pick(List<String> options) {
        return options.get(random.nextInt(options.size()));
    }

    private static List<MenuItem> filter(List<MenuItem> menu, Predicate<MenuItem> predicate) {
        return menu.stream().filter(predicate).collect(Collectors.toList());
    }

    private static Pattern wordPattern(String... keywords) {
        return Pattern.compile(Arrays.stream(keywords)
                .map(Pattern::quote)
                .collect(Collectors.joining("|", "\\b(?:", ")\\b")));
    }

    private static boolean containsAny(String message, List<String> keywords) {
        for (String keyword : keywords) {
            if (message.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String money(BigDecimal amount) {
        return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static GeneratedReply reply(String text, List<MenuItem> recommendations) {
        return new GeneratedReply(text, List.copyOf(recommendations), GeneratedReply.RULES_ENGINE);
    }
}
