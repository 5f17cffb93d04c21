package org.abitware.newsfinder.search.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Compiles a query tree into a native index match expression and a
 * substring predicate for the fallback scan.
 *
 * @author DocFinder Team
 * @version 1.0
 * @since 1.0
 */
public final class QueryCompiler {

    private QueryCompiler() {}

    /**
     * Separates required from excluded terms. Only a term directly under
     * {@link QueryNode.Not} counts as negative.
     *
     * @param node the query tree
     * @return positive and negative terms in query order
     */
    public static TermSplit splitPositiveNegative(QueryNode node) {
        List<QueryNode.Term> positives = new ArrayList<>();
        List<QueryNode.Term> negatives = new ArrayList<>();
        node.accept(new QueryNode.Visitor<Void>() {
            @Override
            public Void visitTerm(QueryNode.Term term) {
                positives.add(term);
                return null;
            }

            @Override
            public Void visitNot(QueryNode.Not not) {
                negatives.add(not.child);
                return null;
            }

            @Override
            public Void visitAnd(QueryNode.And and) {
                and.children.forEach(c -> c.accept(this));
                return null;
            }

            @Override
            public Void visitOr(QueryNode.Or or) {
                or.children.forEach(c -> c.accept(this));
                return null;
            }
        });
        return new TermSplit(positives, negatives);
    }

    /**
     * Space-joined positive terms, phrases quoted with inner quotes doubled.
     * OR structure is not preserved: {@code a OR b} yields the same expression as
     * {@code a b}.
     *
     * @param node the query tree
     * @return the match expression, empty when there are no positives
     */
    public static String buildIndexMatchExpression(QueryNode node) {
        return matchExpression(splitPositiveNegative(node).positives);
    }

    static String matchExpression(List<QueryNode.Term> positives) {
        StringBuilder sb = new StringBuilder();
        for (QueryNode.Term t : positives) {
            if (sb.length() > 0) sb.append(' ');
            if (t.phrase) {
                sb.append('"').append(t.value.replace("\"", "\"\"")).append('"');
            } else {
                sb.append(t.value);
            }
        }
        return sb.toString();
    }

    /**
     * Builds the substring predicate: any positive (with its hyphen/space
     * variant) must occur, no negative may occur.
     *
     * @param node the query tree
     * @return the predicate
     */
    public static FallbackPredicate buildFallbackPredicate(QueryNode node) {
        TermSplit split = splitPositiveNegative(node);
        if (split.isEmpty()) {
            return FallbackPredicate.never();
        }
        return new FallbackPredicate(patterns(split.positives), patterns(split.negatives));
    }

    public static CompiledQuery compile(QueryNode node) {
        return new CompiledQuery(buildIndexMatchExpression(node), buildFallbackPredicate(node));
    }

    private static List<String> patterns(List<QueryNode.Term> terms) {
        Set<String> out = new LinkedHashSet<>();
        for (QueryNode.Term t : terms) {
            for (String v : surfaceVariants(t.original)) {
                out.add(v.toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * The surface form plus its compound counterpart: "F 16" also yields "F-16",
     * "F-16" also yields "F 16".
     *
     * @param original the user's surface form
     * @return one or two variants, the original first
     */
    public static List<String> surfaceVariants(String original) {
        List<String> variants = new ArrayList<>(2);
        variants.add(original);
        if (original.indexOf(' ') >= 0 && original.indexOf('-') < 0) {
            String hyphenated = original.replace(' ', '-');
            if (QueryTokenizer.isCompound(hyphenated)) {
                variants.add(hyphenated);
            }
        } else if (QueryTokenizer.isCompound(original)) {
            variants.add(original.replace('-', ' '));
        }
        return variants;
    }
}
