package org.abitware.newsfinder.search.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class NewsQueryParserTest {

    private static QueryNode.Term term(String v) {
        return new QueryNode.Term(v, false, v);
    }

    @Test
    void emptyInputHasNoTree() {
        assertThat(NewsQueryParser.parse("")).isEmpty();
        assertThat(NewsQueryParser.parse(null)).isEmpty();
        assertThat(NewsQueryParser.parse("OR AND")).isEmpty();
        assertThat(NewsQueryParser.debug(Optional.empty())).isEqualTo("<EMPTY>");
    }

    @Test
    void singleTermIsNotWrapped() {
        assertThat(NewsQueryParser.parse("meduza")).contains(term("meduza"));
    }

    @Test
    void adjacencyIsAnd() {
        assertThat(NewsQueryParser.parse("a b")).contains(new QueryNode.And(Arrays.asList(term("a"), term("b"))));
        assertThat(NewsQueryParser.parse("a AND b")).isEqualTo(NewsQueryParser.parse("a b"));
    }

    @Test
    void orBindsLoosest() {
        QueryNode expected = new QueryNode.Or(Arrays.asList(
                new QueryNode.And(Arrays.asList(term("a"), term("b"))),
                term("c")));
        assertThat(NewsQueryParser.parse("a b OR c")).contains(expected);
    }

    @Test
    void notAppliesToFollowingTermOnly() {
        QueryNode expected = new QueryNode.And(Arrays.asList(
                term("a"), new QueryNode.Not(term("b")), term("c")));
        assertThat(NewsQueryParser.parse("a NOT b c")).contains(expected);
        assertThat(NewsQueryParser.parse("a -b c")).contains(expected);
    }

    @Test
    void negatedTermAfterPhrase() {
        QueryNode expected = new QueryNode.And(Arrays.asList(
                new QueryNode.Term("мировой кризис", true, "мировой кризис"),
                new QueryNode.Not(term("санкции"))));
        assertThat(NewsQueryParser.parse("\"мировой кризис\" -санкции")).contains(expected);
    }

    @Test
    void danglingNotIsDropped() {
        assertThat(NewsQueryParser.parse("a NOT")).contains(term("a"));
        assertThat(NewsQueryParser.parse("NOT OR a")).contains(term("a"));
    }

    @Test
    void emptyOrGroupsAreSkipped() {
        assertThat(NewsQueryParser.parse("OR a OR OR b OR")).contains(
                new QueryNode.Or(Arrays.asList(term("a"), term("b"))));
    }

    @Test
    void compoundAndPhraseBecomePhraseTerms() {
        assertThat(NewsQueryParser.parse("F-16")).contains(new QueryNode.Term("F 16", true, "F-16"));
        assertThat(NewsQueryParser.parse("\"white house\"")).contains(
                new QueryNode.Term("white house", true, "white house"));
    }

    @Test
    void debugRendering() {
        assertThat(NewsQueryParser.debug(NewsQueryParser.parse("a -b OR F-16"))).isEqualTo(
                "OR(AND(TERM(phrase=false, value='a', original='a'), "
                        + "NOT(TERM(phrase=false, value='b', original='b'))), "
                        + "TERM(phrase=true, value='F 16', original='F-16'))");
    }
}
