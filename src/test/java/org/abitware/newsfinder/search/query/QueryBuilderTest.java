package org.abitware.newsfinder.search.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Optional;

import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.Query;
import org.junit.jupiter.api.Test;

class QueryBuilderTest {

    private final QueryBuilder builder = new QueryBuilder(new StandardAnalyzer());

    @Test
    void splitsTermsAndPhrases() {
        List<QueryBuilder.Part> parts = QueryBuilder.split("a \"F 16\" \"say \"\"hi\"\"\" b");
        assertThat(parts).extracting(p -> p.text).containsExactly("a", "F 16", "say \"hi\"", "b");
        assertThat(parts).extracting(p -> p.phrase).containsExactly(false, true, true, false);
    }

    @Test
    void everyPartIsRequired() {
        Optional<Query> q = builder.buildQuery("танк \"F 16\"");
        assertThat(q).isPresent();
        BooleanQuery bq = (BooleanQuery) q.get();
        assertThat(bq.clauses()).hasSize(2);
        assertThat(bq.clauses()).extracting(BooleanClause::getOccur)
                .containsOnly(BooleanClause.Occur.MUST);
        assertThat(bq.toString()).contains("title:танк").contains("summary:танк")
                .contains("title:\"f 16\"");
    }

    @Test
    void specialCharactersAreEscaped() {
        assertThat(builder.buildQuery("c++ (x)")).isPresent();
    }

    @Test
    void blankOrTokenlessExpressionIsEmpty() {
        assertThat(builder.buildQuery("")).isEmpty();
        assertThat(builder.buildQuery(null)).isEmpty();
        assertThat(builder.buildQuery("a ...")).isEmpty();
    }
}
