package org.abitware.newsfinder.search.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link QueryNode} from an interleaved sequence of operator markers
 * ({@link Token#AND}, {@link Token#OR}, {@link Token#NOT} as strings) and
 * {@link QueryNode.Term} values.
 *
 * <p>Precedence, lowest to highest: OR, implicit AND, NOT. Parentheses do not exist.
 */
final class AstBuilder {

    private AstBuilder() {}

    static Optional<QueryNode> build(List<Object> sequence) {
        if (sequence == null || sequence.isEmpty()) {
            return Optional.empty();
        }
        List<Object> folded = foldNegations(sequence);

        List<List<QueryNode>> groups = new ArrayList<>();
        groups.add(new ArrayList<>());
        for (Object item : folded) {
            if (Token.OR.equals(item)) {
                groups.add(new ArrayList<>());
            } else if (item instanceof QueryNode) {
                groups.get(groups.size() - 1).add((QueryNode) item);
            }
            // AND markers carry no meaning beyond adjacency
        }

        List<QueryNode> alternatives = new ArrayList<>();
        for (List<QueryNode> group : groups) {
            if (group.isEmpty()) continue;
            alternatives.add(group.size() == 1 ? group.get(0) : new QueryNode.And(group));
        }
        if (alternatives.isEmpty()) {
            return Optional.empty();
        }
        if (alternatives.size() == 1) {
            return Optional.of(alternatives.get(0));
        }
        return Optional.of(new QueryNode.Or(alternatives));
    }

    /** NOT directly followed by a term becomes Not(term); a dangling NOT is dropped. */
    private static List<Object> foldNegations(List<Object> sequence) {
        List<Object> out = new ArrayList<>(sequence.size());
        for (int i = 0; i < sequence.size(); i++) {
            Object item = sequence.get(i);
            if (Token.NOT.equals(item)) {
                Object next = i + 1 < sequence.size() ? sequence.get(i + 1) : null;
                if (next instanceof QueryNode.Term) {
                    out.add(new QueryNode.Not((QueryNode.Term) next));
                    i++;
                }
                continue;
            }
            out.add(item);
        }
        return out;
    }
}
