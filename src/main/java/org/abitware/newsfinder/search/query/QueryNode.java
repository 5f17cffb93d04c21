package org.abitware.newsfinder.search.query;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Boolean query tree. The hierarchy is closed: the only subclasses are
 * {@link Term}, {@link Not}, {@link And} and {@link Or}, and every consumer
 * goes through {@link Visitor} so a new node kind fails to compile everywhere
 * it is not handled.
 *
 * @author DocFinder Team
 * @version 1.0
 * @since 1.0
 */
public abstract class QueryNode {

    private QueryNode() {}

    public abstract <R> R accept(Visitor<R> visitor);

    /** Exhaustive match over the four node kinds. */
    public interface Visitor<R> {
        R visitTerm(Term term);
        R visitNot(Not not);
        R visitAnd(And and);
        R visitOr(Or or);
    }

    /**
     * A search term. {@code value} is the index form (multi-word phrases space-joined),
     * {@code original} the surface form used for substring matching and highlighting.
     */
    public static final class Term extends QueryNode {
        public final String value;
        public final boolean phrase;
        public final String original;

        public Term(String value, boolean phrase, String original) {
            this.value = Objects.requireNonNull(value, "value");
            this.phrase = phrase;
            this.original = (original == null || original.isEmpty()) ? value : original;
            if (this.original.isEmpty()) {
                throw new IllegalArgumentException("term must not be empty");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTerm(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Term)) return false;
            Term t = (Term) o;
            return phrase == t.phrase && value.equals(t.value) && original.equals(t.original);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, phrase, original);
        }

        @Override
        public String toString() {
            return NewsQueryParser.debug(this);
        }
    }

    /** Negation of a single term; the grammar never negates a sub-expression. */
    public static final class Not extends QueryNode {
        public final Term child;

        public Not(Term child) {
            this.child = Objects.requireNonNull(child, "child");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Not && child.equals(((Not) o).child);
        }

        @Override
        public int hashCode() {
            return 31 * child.hashCode() + 1;
        }

        @Override
        public String toString() {
            return NewsQueryParser.debug(this);
        }
    }

    /** Conjunction; never empty. */
    public static final class And extends QueryNode {
        public final List<QueryNode> children;

        public And(List<QueryNode> children) {
            this.children = nonEmpty(children, "AND");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnd(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof And && children.equals(((And) o).children);
        }

        @Override
        public int hashCode() {
            return 31 * children.hashCode() + 2;
        }

        @Override
        public String toString() {
            return NewsQueryParser.debug(this);
        }
    }

    /** Disjunction; never empty. */
    public static final class Or extends QueryNode {
        public final List<QueryNode> children;

        public Or(List<QueryNode> children) {
            this.children = nonEmpty(children, "OR");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOr(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Or && children.equals(((Or) o).children);
        }

        @Override
        public int hashCode() {
            return 31 * children.hashCode() + 3;
        }

        @Override
        public String toString() {
            return NewsQueryParser.debug(this);
        }
    }

    private static List<QueryNode> nonEmpty(List<QueryNode> children, String what) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException(what + " node needs at least one child");
        }
        return Collections.unmodifiableList(List.copyOf(children));
    }
}
