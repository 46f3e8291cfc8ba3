package com.restaurantai.chat.model;

import java.util.List;

/**
 * Reply text together with the menu items surfaced alongside it and the engine that produced it.
 */
public record GeneratedReply(
        String text,
        List<MenuItem> recommendations,
        String engine
) {
    public static final String RULES_ENGINE = "rules";

    public List<MenuItem> recommendations() {
        return recommendations == null ? List.of() : recommendations;
    }
}
