package org.abitware.newsfinder.search.query;

import java.util.Objects;

/**
 * One lexical unit of a user query.
 *
 * <p>{@code text} is the operator name, phrase text, normalized compound form
 * or plain term; {@code original} is what the user typed, which differs from
 * {@code text} only for compound terms ("F 16" vs "F-16").
 */
public final class Token {

    public enum Kind { OP, PHRASE, COMPOUND_TERM, TERM }

    public static final String AND = "AND";
    public static final String OR = "OR";
    public static final String NOT = "NOT";

    public final Kind kind;
    public final String text;
    public final String original;

    private Token(Kind kind, String text, String original) {
        this.kind = kind;
        this.text = text;
        this.original = original;
    }

    public static Token op(String name) {
        return new Token(Kind.OP, name, name);
    }

    public static Token phrase(String text) {
        return new Token(Kind.PHRASE, text, text);
    }

    public static Token compound(String normalized, String original) {
        return new Token(Kind.COMPOUND_TERM, normalized, original);
    }

    public static Token term(String text) {
        return new Token(Kind.TERM, text, text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return kind == other.kind && text.equals(other.text) && original.equals(other.original);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, original);
    }

    @Override
    public String toString() {
        if (kind == Kind.COMPOUND_TERM) {
            return kind + "(" + text + " | " + original + ")";
        }
        return kind + "(" + text + ")";
    }
}
