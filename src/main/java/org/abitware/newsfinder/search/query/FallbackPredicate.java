package org.abitware.newsfinder.search.query;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive containment test over a document's title and summary,
 * treating both fields as one haystack per pattern.
 *
 * <p>A document matches when any positive pattern occurs (or, with no positives,
 * unconditionally) and no negative pattern occurs. A predicate with neither
 * positives nor negatives matches nothing.
 */
public final class FallbackPredicate {

    private static final FallbackPredicate NEVER =
            new FallbackPredicate(Collections.emptyList(), Collections.emptyList());

    private final List<String> positives;
    private final List<String> negatives;

    FallbackPredicate(List<String> positives, List<String> negatives) {
        this.positives = Collections.unmodifiableList(positives);
        this.negatives = Collections.unmodifiableList(negatives);
    }

    public static FallbackPredicate never() {
        return NEVER;
    }

    /** Lowercased substrings, any of which admits a document. */
    public List<String> positives() {
        return positives;
    }

    /** Lowercased substrings, any of which rejects a document. */
    public List<String> negatives() {
        return negatives;
    }

    public boolean isNeverTrue() {
        return positives.isEmpty() && negatives.isEmpty();
    }

    public boolean matches(String title, String summary) {
        if (isNeverTrue()) return false;
        String t = lower(title);
        String s = lower(summary);
        if (!positives.isEmpty() && !containsAny(t, s, positives)) {
            return false;
        }
        return !containsAny(t, s, negatives);
    }

    private static boolean containsAny(String title, String summary, List<String> patterns) {
        for (String p : patterns) {
            if (title.contains(p) || summary.contains(p)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    /** SQL-like rendering for debug logs. */
    public String describe() {
        if (isNeverTrue()) return "0=1";
        StringBuilder sb = new StringBuilder();
        if (positives.isEmpty()) {
            sb.append("1=1");
        } else {
            sb.append('(');
            for (int i = 0; i < positives.size(); i++) {
                if (i > 0) sb.append(" OR ");
                sb.append(contains(positives.get(i)));
            }
            sb.append(')');
        }
        for (String n : negatives) {
            sb.append(" AND NOT ").append(contains(n));
        }
        return sb.toString();
    }

    private static String contains(String p) {
        return "(title~'" + p + "' OR summary~'" + p + "')";
    }

    @Override
    public String toString() {
        return describe();
    }
}
