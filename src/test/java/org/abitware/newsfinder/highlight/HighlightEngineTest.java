package org.abitware.newsfinder.highlight;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

class HighlightEngineTest {

    private final HighlightEngine engine = new HighlightEngine();

    @Test
    void patternsIncludeVariantsLongestFirst() {
        assertThat(engine.extractPatterns("F-16 OR танк")).containsExactly("F-16", "F 16", "танк");
    }

    @Test
    void negatedTermsAreNotHighlighted() {
        assertThat(engine.extractPatterns("путин -песков")).containsExactly("путин");
        assertThat(engine.extractPatterns("-песков")).isEmpty();
        assertThat(engine.extractPatterns("")).isEmpty();
    }

    @Test
    void highlightIsCaseInsensitiveAndKeepsOriginalCase() {
        assertThat(engine.highlight("Танк и ТАНК", Collections.singletonList("танк")))
                .isEqualTo("<b>Танк</b> и <b>ТАНК</b>");
    }

    @Test
    void highlightTreatsPatternLiterally() {
        assertThat(engine.highlight("cost $5 (approx)", Arrays.asList("$5", "(approx)")))
                .isEqualTo("cost <b>$5</b> <b>(approx)</b>");
    }

    @Test
    void highlightWithoutPatternsReturnsText() {
        assertThat(engine.highlight("text", Collections.emptyList())).isEqualTo("text");
        assertThat(engine.highlight(null, Collections.singletonList("x"))).isEmpty();
    }

    @Test
    void snippetStartsShortlyBeforeFirstHit() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 100; i++) sb.append('x');
        sb.append("танк");
        for (int i = 0; i < 300; i++) sb.append('y');
        String summary = sb.toString();

        List<String> patterns = Collections.singletonList("танк");
        String snippet = engine.snippet(summary, patterns, 60);

        assertThat(snippet).startsWith(HighlightEngine.ELLIPSIS).endsWith(HighlightEngine.ELLIPSIS);
        assertThat(snippet).contains("<b>танк</b>");
        // lead-in plus the hit
        assertThat(snippet).contains(repeat('x', HighlightEngine.LEAD_IN) + "<b>");
    }

    @Test
    void snippetAtStartHasNoLeadingEllipsis() {
        String snippet = engine.snippet("F-16 delivered", Arrays.asList("F-16", "F 16"));
        assertThat(snippet).isEqualTo("<b>F-16</b> delivered");
    }

    @Test
    void snippetOffsetsIgnoreLowercaseLengthChanges() {
        // "İ" lowercases to two chars
        String dotted = repeat('İ', 50) + " танк";
        assertThat(engine.snippet(dotted, Collections.singletonList("танк")))
                .isEqualTo(HighlightEngine.ELLIPSIS + repeat('İ', 39) + " <b>танк</b>");

        String mixed = repeat('İ', 30) + repeat('x', 100) + " танк" + repeat('y', 300);
        assertThat(engine.snippet(mixed, Collections.singletonList("танк")))
                .startsWith(HighlightEngine.ELLIPSIS + repeat('x', 39) + " <b>танк</b>");
    }

    @Test
    void laterPatternsDoNotMatchInsideMarkup() {
        List<String> patterns = engine.extractPatterns("F-16 b");
        assertThat(engine.highlight("F-16 and b", patterns)).isEqualTo("<b>F-16</b> and <b>b</b>");
        assertThat(engine.highlight("<b>x</b> b", Collections.singletonList("b"))).isEqualTo("<b>x</b> <b>b</b>");
    }

    @Test
    void snippetIsEmptyWithoutHit() {
        assertThat(engine.snippet("nothing here", Collections.singletonList("танк"))).isEmpty();
        assertThat(engine.snippet(null, Collections.singletonList("танк"))).isEmpty();
    }

    private static String repeat(char c, int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) sb.append(c);
        return sb.toString();
    }
}
