package org.abitware.newsfinder.search.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point of the query language: tokenizes, converts tokens into the
 * builder's marker/term sequence and builds the tree.
 *
 * @author DocFinder Team
 * @version 1.0
 * @since 1.0
 */
public final class NewsQueryParser {

    private NewsQueryParser() {}

    /**
     * Parses a user query.
     *
     * @param query the raw query, may be null
     * @return the query tree, or empty when nothing searchable remains
     */
    public static Optional<QueryNode> parse(String query) {
        List<Token> tokens = QueryTokenizer.tokenize(query);
        List<Object> sequence = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            switch (t.kind) {
                case OP:
                    sequence.add(t.text);
                    break;
                case PHRASE:
                case COMPOUND_TERM:
                    sequence.add(new QueryNode.Term(t.text, true, t.original));
                    break;
                case TERM:
                default:
                    sequence.add(new QueryNode.Term(t.text, false, t.original));
                    break;
            }
        }
        return AstBuilder.build(sequence);
    }

    /** Renders a tree for logs, {@code <EMPTY>} when absent. */
    public static String debug(Optional<QueryNode> node) {
        return node.map(NewsQueryParser::debug).orElse("<EMPTY>");
    }

    public static String debug(QueryNode node) {
        return node.accept(new QueryNode.Visitor<String>() {
            @Override
            public String visitTerm(QueryNode.Term term) {
                return "TERM(phrase=" + term.phrase + ", value='" + term.value
                        + "', original='" + term.original + "')";
            }

            @Override
            public String visitNot(QueryNode.Not not) {
                return "NOT(" + visitTerm(not.child) + ")";
            }

            @Override
            public String visitAnd(QueryNode.And and) {
                return "AND(" + and.children.stream().map(c -> c.accept(this))
                        .collect(Collectors.joining(", ")) + ")";
            }

            @Override
            public String visitOr(QueryNode.Or or) {
                return "OR(" + or.children.stream().map(c -> c.accept(this))
                        .collect(Collectors.joining(", ")) + ")";
            }
        });
    }
}
