package org.abitware.newsfinder.search.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits raw query text into operators, phrases, compound terms and plain terms.
 * Any input produces a (possibly empty) token list; there is no error path.
 *
 * @author DocFinder Team
 * @version 1.0
 * @since 1.0
 */
public final class QueryTokenizer {

    /** Dash variants folded to ASCII '-' */
    private static final String DASHES =
            "\u2010\u2011\u2012\u2013\u2014\u2015\u2212\u2043\uFE63\uFF0D\u00AD";

    /** Typographic quotes folded to ASCII '"' */
    private static final String QUOTES =
            "\u201C\u201D\u00AB\u00BB\u201E\u201F\u2039\u203A";

    private static final String GROUP = "[A-Za-zА-Яа-я0-9]+";

    static final Pattern ALNUM = Pattern.compile("^" + GROUP + "$");
    static final Pattern COMPOUND = Pattern.compile("^" + GROUP + "(?:-" + GROUP + ")+$");

    private QueryTokenizer() {}

    /**
     * Maps dash and quote variants to their ASCII forms.
     *
     * @param s the raw input
     * @return the normalized string, never null
     */
    public static String normalize(String s) {
        if (s == null) return "";
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (DASHES.indexOf(ch) >= 0) {
                out.append('-');
            } else if (QUOTES.indexOf(ch) >= 0) {
                out.append('"');
            } else {
                out.append(ch);
            }
        }
        return out.toString();
    }

    /**
     * Tokenizes a query.
     *
     * @param raw the raw query, may be null
     * @return tokens in input order
     */
    public static List<Token> tokenize(String raw) {
        String q = normalize(raw);
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = q.length();
        while (i < n) {
            char c = q.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '"') {
                int close = q.indexOf('"', i + 1);
                String phrase;
                if (close < 0) {
                    phrase = q.substring(i + 1);
                    i = n;
                } else {
                    phrase = q.substring(i + 1, close);
                    i = close + 1;
                }
                phrase = phrase.trim();
                if (!phrase.isEmpty()) {
                    tokens.add(Token.phrase(phrase));
                }
                continue;
            }
            int j = i;
            while (j < n && !Character.isWhitespace(q.charAt(j)) && q.charAt(j) != '"') {
                j++;
            }
            String word = q.substring(i, j);
            i = j;
            addWord(tokens, word);
        }
        return tokens;
    }

    private static void addWord(List<Token> tokens, String word) {
        String upper = word.toUpperCase(Locale.ROOT);
        if (upper.equals(Token.AND) || upper.equals(Token.OR) || upper.equals(Token.NOT)) {
            tokens.add(Token.op(upper));
            return;
        }
        if (word.length() > 1 && word.charAt(0) == '-' && ALNUM.matcher(word.substring(1)).matches()) {
            tokens.add(Token.op(Token.NOT));
            tokens.add(Token.term(word.substring(1)));
            return;
        }
        if (COMPOUND.matcher(word).matches()) {
            String normalized = Arrays.stream(word.split("-"))
                    .filter(p -> !p.isEmpty())
                    .collect(Collectors.joining(" "));
            tokens.add(Token.compound(normalized, word));
            return;
        }
        tokens.add(Token.term(word));
    }

    /**
     * Whether {@code word} is two or more alphanumeric groups joined by single hyphens.
     *
     * @param word candidate word
     * @return true for compound words such as "F-16"
     */
    public static boolean isCompound(String word) {
        return word != null && COMPOUND.matcher(word).matches();
    }
}
