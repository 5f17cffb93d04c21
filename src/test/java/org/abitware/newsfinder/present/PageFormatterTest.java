package org.abitware.newsfinder.present;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.abitware.newsfinder.highlight.HighlightEngine;
import org.abitware.newsfinder.news.NewsItem;
import org.junit.jupiter.api.Test;

class PageFormatterTest {

    private final HighlightEngine highlighter = new HighlightEngine();
    private final PageFormatter formatter = new PageFormatter(highlighter);

    private static final NewsItem JETS = new NewsItem("Meduza", "F-16 delivered", "https://meduza.io/1",
            "2024-01-01 10:00", "<p>The F 16 jets arrived &amp; were inspected</p>");

    @Test
    void emptyListings() {
        assertThat(formatter.page(Collections.emptyList(), 0, 10, 0, "Latest news"))
                .isEqualTo("Latest news\nNo results.");
        assertThat(formatter.page(Collections.emptyList(), 20, 10, 5, "Latest news"))
                .isEqualTo("Latest news\nPage 3/1 is empty.");
    }

    @Test
    void searchPageHighlightsTitleAndSnippet() {
        List<String> patterns = highlighter.extractPatterns("F-16");
        String text = formatter.searchPage(Arrays.asList(JETS, JETS), 10, 10, 12, "Search: F-16", patterns);

        assertThat(text).startsWith("Search: F-16\nResults 11–12 of 12 (page 2/2)");
        assertThat(text).contains("11. <b>F-16</b> delivered");
        assertThat(text).contains("12. <b>F-16</b> delivered");
        assertThat(text).contains("Meduza · 2024-01-01 10:00");
        assertThat(text).contains("The <b>F 16</b> jets arrived &amp; were inspected");
    }

    @Test
    void browsePageHasNoSnippets() {
        String text = formatter.page(Collections.singletonList(JETS), 0, 10, 1, "Meduza");
        assertThat(text).isEqualTo("Meduza\nResults 1–1 of 1 (page 1/1)\n\n1. F-16 delivered\n   Meduza · 2024-01-01 10:00");
    }

    @Test
    void singleItems() {
        String text = formatter.singleItem(JETS, 2, 7);
        assertThat(text).startsWith("News 3/7\n\n<b>F-16 delivered</b>\nMeduza · 2024-01-01 10:00");
        assertThat(text).endsWith("https://meduza.io/1");

        assertThat(formatter.sourceItem(JETS, 0, 2, "Meduza")).startsWith("Meduza: 1/2\n\n");
    }
}
