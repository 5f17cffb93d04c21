package org.abitware.newsfinder.search.query;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class QueryCompilerTest {

    private static QueryNode parse(String q) {
        return NewsQueryParser.parse(q).orElseThrow(IllegalStateException::new);
    }

    @Test
    void splitKeepsQueryOrder() {
        TermSplit split = QueryCompiler.splitPositiveNegative(parse("a -b c OR d NOT e"));
        assertThat(split.positives).extracting(t -> t.value).containsExactly("a", "c", "d");
        assertThat(split.negatives).extracting(t -> t.value).containsExactly("b", "e");
        assertThat(split.isNegativeOnly()).isFalse();
    }

    @Test
    void splitPhraseAndNegatedTerm() {
        TermSplit split = QueryCompiler.splitPositiveNegative(parse("\"мировой кризис\" -санкции"));
        assertThat(split.positives).extracting(t -> t.value).containsExactly("мировой кризис");
        assertThat(split.positives.get(0).phrase).isTrue();
        assertThat(split.negatives).extracting(t -> t.value).containsExactly("санкции");
        assertThat(QueryCompiler.buildIndexMatchExpression(parse("\"мировой кризис\" -санкции")))
                .isEqualTo("\"мировой кризис\"");
    }

    @Test
    void negativeOnlyQuery() {
        TermSplit split = QueryCompiler.splitPositiveNegative(parse("-spam"));
        assertThat(split.isNegativeOnly()).isTrue();
        assertThat(QueryCompiler.buildIndexMatchExpression(parse("-spam"))).isEmpty();
    }

    @Test
    void matchExpressionQuotesPhrasesAndFlattensOr() {
        assertThat(QueryCompiler.buildIndexMatchExpression(parse("F-16 OR танк -учения")))
                .isEqualTo("\"F 16\" танк");
        assertThat(QueryCompiler.buildIndexMatchExpression(parse("a OR b")))
                .isEqualTo(QueryCompiler.buildIndexMatchExpression(parse("a b")));
    }

    @Test
    void innerQuotesAreDoubled() {
        QueryNode.Term t = new QueryNode.Term("say \"hi\"", true, "say \"hi\"");
        assertThat(QueryCompiler.buildIndexMatchExpression(t)).isEqualTo("\"say \"\"hi\"\"\"");
    }

    @Test
    void fallbackAddsHyphenVariants() {
        FallbackPredicate p = QueryCompiler.buildFallbackPredicate(parse("F-16 NOT \"Су 35\""));
        assertThat(p.positives()).containsExactly("f-16", "f 16");
        assertThat(p.negatives()).containsExactly("су 35", "су-35");
        assertThat(p.matches("New F 16 delivered", null)).isTrue();
        assertThat(p.matches("F-16 and Су-35", "")).isFalse();
        assertThat(p.matches("MiG-29", "nothing")).isFalse();
    }

    @Test
    void fallbackWithOnlyNegativesMatchesEverythingElse() {
        FallbackPredicate p = QueryCompiler.buildFallbackPredicate(parse("-spam"));
        assertThat(p.positives()).isEmpty();
        assertThat(p.matches("news", "text")).isTrue();
        assertThat(p.matches("news", "SPAM inside")).isFalse();
        assertThat(p.describe()).isEqualTo("1=1 AND NOT (title~'spam' OR summary~'spam')");
    }

    @Test
    void neverPredicateMatchesNothing() {
        FallbackPredicate never = FallbackPredicate.never();
        assertThat(never.isNeverTrue()).isTrue();
        assertThat(never.matches("anything", "at all")).isFalse();
        assertThat(never.describe()).isEqualTo("0=1");
    }

    @Test
    void surfaceVariants() {
        assertThat(QueryCompiler.surfaceVariants("F 16")).containsExactly("F 16", "F-16");
        assertThat(QueryCompiler.surfaceVariants("F-16")).containsExactly("F-16", "F 16");
        assertThat(QueryCompiler.surfaceVariants("hello, world")).containsExactly("hello, world");
        assertThat(QueryCompiler.surfaceVariants("plain")).containsExactly("plain");
    }

    @Test
    void compileCombinesBoth() {
        CompiledQuery c = QueryCompiler.compile(parse("a b"));
        assertThat(c.indexMatchExpression).isEqualTo("a b");
        assertThat(c.fallbackPredicate.positives()).containsExactly("a", "b");
    }
}
