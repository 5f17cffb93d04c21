package org.abitware.newsfinder.search.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.abitware.newsfinder.index.NewsFields;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builder class for turning an index match expression into a Lucene query.
 * Every term or phrase of the expression becomes a required clause that may be
 * satisfied by either the title or the summary field.
 *
 * @author DocFinder Team
 * @version 1.0
 * @since 1.0
 */
public class QueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(QueryBuilder.class);

    /** Analyzer for query parsing, same as the one used at index time */
    private final Analyzer queryAnalyzer;

    /**
     * Constructs a QueryBuilder.
     *
     * @param queryAnalyzer the analyzer the text fields were indexed with
     */
    public QueryBuilder(Analyzer queryAnalyzer) {
        this.queryAnalyzer = queryAnalyzer;
    }

    /**
     * Builds a Lucene query from a match expression.
     *
     * @param matchExpression space-separated terms, phrases in double quotes with
     *                        inner quotes doubled
     * @return the query, or empty when some part cannot be expressed against the index
     */
    public Optional<Query> buildQuery(String matchExpression) {
        List<Part> parts = split(matchExpression);
        if (parts.isEmpty()) {
            return Optional.empty();
        }

        BooleanQuery.Builder root = new BooleanQuery.Builder();
        for (Part part : parts) {
            Optional<Query> clause = buildClause(part);
            if (!clause.isPresent()) {
                log.debug("Match part '{}' has no indexable tokens", part.text);
                return Optional.empty();
            }
            root.add(clause.get(), BooleanClause.Occur.MUST);
        }
        return Optional.of(root.build());
    }

    /**
     * Builds the clause for one term or phrase across all text fields.
     *
     * @param part the term or phrase
     * @return the clause, or empty when the analyzer leaves nothing to match
     */
    private Optional<Query> buildClause(Part part) {
        MultiFieldQueryParser parser = new MultiFieldQueryParser(NewsFields.TEXT_FIELDS, queryAnalyzer);
        parser.setDefaultOperator(QueryParser.Operator.AND);
        parser.setAllowLeadingWildcard(false);

        String escaped = QueryParser.escape(part.text);
        String source = part.phrase ? "\"" + escaped + "\"" : escaped;
        try {
            Query parsed = parser.parse(source);
            if (parsed == null || (parsed instanceof BooleanQuery && ((BooleanQuery) parsed).clauses().isEmpty())) {
                return Optional.empty();
            }
            return Optional.of(parsed);
        } catch (ParseException ex) {
            log.warn("Could not parse match part '{}': {}", part.text, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Splits a match expression into bare terms and quoted phrases.
     * Inside a phrase a doubled quote stands for a literal quote.
     *
     * @param expression the match expression
     * @return parts in expression order
     */
    static List<Part> split(String expression) {
        List<Part> parts = new ArrayList<>();
        if (expression == null) return parts;

        int i = 0;
        int n = expression.length();
        while (i < n) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '"') {
                StringBuilder phrase = new StringBuilder();
                i++;
                while (i < n) {
                    char p = expression.charAt(i);
                    if (p == '"') {
                        if (i + 1 < n && expression.charAt(i + 1) == '"') {
                            phrase.append('"');
                            i += 2;
                            continue;
                        }
                        i++;
                        break;
                    }
                    phrase.append(p);
                    i++;
                }
                String text = phrase.toString().trim();
                if (!text.isEmpty()) {
                    parts.add(new Part(text, true));
                }
                continue;
            }
            int j = i;
            while (j < n && !Character.isWhitespace(expression.charAt(j))) {
                j++;
            }
            parts.add(new Part(expression.substring(i, j), false));
            i = j;
        }
        return parts;
    }

    /**
     * One term or phrase of a match expression.
     */
    static final class Part {
        final String text;
        final boolean phrase;

        Part(String text, boolean phrase) {
            this.text = text;
            this.phrase = phrase;
        }
    }
}
