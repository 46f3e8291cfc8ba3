package com.restaurantai.chat.service;

import com.restaurantai.chat.model.MenuItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds menu items mentioned by name in generated text. Exact, case-insensitive substring match only;
 * results follow menu order, not position in the text.
 */
@Component
public class RecommendationExtractor {

    public static final int MAX_RECOMMENDATIONS = 2;

    public List<MenuItem> extract(String text, List<MenuItem> menuItems) {
        if (text == null || text.isEmpty() || menuItems == null) {
            return List.of();
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        List<MenuItem> found = new ArrayList<>(MAX_RECOMMENDATIONS);
        for (MenuItem item : menuItems) {
            String name = item.getName();
            if (name == null || name.isBlank()) {
                continue;
            }
            if (haystack.contains(name.toLowerCase(Locale.ROOT))) {
                found.add(item);
                if (found.size() >= MAX_RECOMMENDATIONS) {
                    break;
                }
            }
        }
        return found;
    }
}
