package org.abitware.newsfinder.search.query;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class QueryTokenizerTest {

    @Test
    void nullAndBlankYieldNoTokens() {
        assertThat(QueryTokenizer.tokenize(null)).isEmpty();
        assertThat(QueryTokenizer.tokenize("   ")).isEmpty();
    }

    @Test
    void operatorsAreCaseInsensitive() {
        assertThat(QueryTokenizer.tokenize("a or b and not c")).containsExactly(
                Token.term("a"), Token.op(Token.OR), Token.term("b"),
                Token.op(Token.AND), Token.op(Token.NOT), Token.term("c"));
    }

    @Test
    void leadingMinusIsNegation() {
        assertThat(QueryTokenizer.tokenize("путин -песков")).containsExactly(
                Token.term("путин"), Token.op(Token.NOT), Token.term("песков"));
    }

    @Test
    void loneMinusOrPunctuatedMinusStaysTerm() {
        assertThat(QueryTokenizer.tokenize("-")).containsExactly(Token.term("-"));
        assertThat(QueryTokenizer.tokenize("-a.b")).containsExactly(Token.term("-a.b"));
    }

    @Test
    void compoundWordKeepsSurfaceForm() {
        assertThat(QueryTokenizer.tokenize("F-16")).containsExactly(Token.compound("F 16", "F-16"));
        assertThat(QueryTokenizer.tokenize("Су-35-С")).containsExactly(Token.compound("Су 35 С", "Су-35-С"));
    }

    @Test
    void unicodeDashesAreNormalized() {
        assertThat(QueryTokenizer.tokenize("F–16")).containsExactly(Token.compound("F 16", "F-16"));
    }

    @Test
    void typographicQuotesOpenPhrases() {
        assertThat(QueryTokenizer.tokenize("«белый дом»")).containsExactly(Token.phrase("белый дом"));
        assertThat(QueryTokenizer.tokenize("“white house” x")).containsExactly(
                Token.phrase("white house"), Token.term("x"));
    }

    @Test
    void unterminatedPhraseRunsToEnd() {
        assertThat(QueryTokenizer.tokenize("a \"b c")).containsExactly(Token.term("a"), Token.phrase("b c"));
    }

    @Test
    void emptyPhraseIsDropped() {
        assertThat(QueryTokenizer.tokenize("\"  \" a")).containsExactly(Token.term("a"));
    }

    @Test
    void compoundDetection() {
        assertThat(QueryTokenizer.isCompound("F-16")).isTrue();
        assertThat(QueryTokenizer.isCompound("F--16")).isFalse();
        assertThat(QueryTokenizer.isCompound("-16")).isFalse();
        assertThat(QueryTokenizer.isCompound("F16")).isFalse();
        assertThat(QueryTokenizer.isCompound(null)).isFalse();
    }
}
