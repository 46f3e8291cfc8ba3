package com.restaurantai.chat.service;

import com.restaurantai.chat.model.MenuItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationExtractorTest {

    private final RecommendationExtractor extractor = new RecommendationExtractor();
    private final List<MenuItem> menu = MenuFixtures.menu();

    @Test
    void returnsItemsInMenuOrderNotTextOrder() {
        List<MenuItem> found = extractor.extract("Try the TIRAMISU after our bruschetta!", menu);

        assertThat(found).extracting(MenuItem::getName).containsExactly("Bruschetta", "Tiramisu");
    }

    @Test
    void stopsAfterTwoMatches() {
        String text = "Bruschetta, Truffle Risotto and Tiramisu are all great tonight.";

        assertThat(extractor.extract(text, menu))
                .hasSize(RecommendationExtractor.MAX_RECOMMENDATIONS)
                .extracting(MenuItem::getName)
                .containsExactly("Bruschetta", "Truffle Risotto");
    }

    @Test
    void multiWordNamesMustAppearVerbatim() {
        assertThat(extractor.extract("The risotto with truffle is lovely.", menu)).isEmpty();
    }

    @Test
    void emptyTextOrMenuYieldsNothing() {
        assertThat(extractor.extract("", menu)).isEmpty();
        assertThat(extractor.extract(null, menu)).isEmpty();
        assertThat(extractor.extract("Tiramisu", List.of())).isEmpty();
    }
}
