package org.abitware.newsfinder.highlight;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.abitware.newsfinder.search.query.NewsQueryParser;
import org.abitware.newsfinder.search.query.QueryCompiler;
import org.abitware.newsfinder.search.query.QueryNode;

/**
 * Marks query terms in result text and cuts summary snippets around the first hit.
 *
 * <p>Patterns come from a separate parse of the query, so highlighting never
 * depends on how the search itself was executed.
 */
public class HighlightEngine {

    public static final int DEFAULT_SNIPPET_LENGTH = 180;

    /** Characters kept before the first hit */
    static final int LEAD_IN = 40;

    static final String ELLIPSIS = "…";
    static final String OPEN = "<b>";
    static final String CLOSE = "</b>";

    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    /**
     * Literal patterns to highlight for a query: the surface form of every
     * positive term, plus its hyphen/space counterpart, longest first.
     *
     * @param rawQuery the user query
     * @return patterns, empty when the query has no positive terms
     */
    public List<String> extractPatterns(String rawQuery) {
        Optional<QueryNode> ast = NewsQueryParser.parse(rawQuery);
        if (!ast.isPresent()) {
            return Collections.emptyList();
        }
        Set<String> patterns = new LinkedHashSet<>();
        for (QueryNode.Term t : QueryCompiler.splitPositiveNegative(ast.get()).positives) {
            String original = t.original.trim();
            if (original.isEmpty()) continue;
            patterns.add(original);
            if (original.indexOf(' ') >= 0 && original.indexOf('-') < 0) {
                patterns.add(original.replace(' ', '-'));
            }
            if (original.indexOf('-') >= 0) {
                patterns.add(original.replace('-', ' '));
            }
        }
        List<String> sorted = new ArrayList<>(patterns);
        // stable: equal lengths keep query order
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return sorted;
    }

    /**
     * Wraps every case-insensitive occurrence of each pattern in {@code <b>}.
     * Patterns are applied one after another over the growing output; markup
     * added by an earlier pattern is never matched by a later one.
     *
     * @param text already escaped text
     * @param patterns literal patterns
     * @return the marked-up text
     */
    public String highlight(String text, List<String> patterns) {
        if (text == null || text.isEmpty() || patterns == null || patterns.isEmpty()) {
            return text == null ? "" : text;
        }
        String out = text;
        for (String p : patterns) {
            if (p == null || p.isEmpty()) continue;
            out = markOutsideTags(out, literal(p));
        }
        return out;
    }

    private static String markOutsideTags(String text, Pattern pattern) {
        StringBuilder sb = new StringBuilder(text.length() + 16);
        Matcher tags = TAG.matcher(text);
        int last = 0;
        while (tags.find()) {
            sb.append(mark(text.substring(last, tags.start()), pattern));
            sb.append(tags.group());
            last = tags.end();
        }
        sb.append(mark(text.substring(last), pattern));
        return sb.toString();
    }

    private static String mark(String segment, Pattern pattern) {
        if (segment.isEmpty()) return segment;
        return pattern.matcher(segment).replaceAll(r -> OPEN + Matcher.quoteReplacement(r.group()) + CLOSE);
    }

    private static Pattern literal(String p) {
        return Pattern.compile(Pattern.quote(p), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public String snippet(String summary, List<String> patterns) {
        return snippet(summary, patterns, DEFAULT_SNIPPET_LENGTH);
    }

    /**
     * Cuts a window of {@code maxLen} characters starting shortly before the
     * earliest pattern occurrence and highlights it.
     *
     * @param summary the summary text
     * @param patterns literal patterns
     * @param maxLen window length
     * @return the snippet, or an empty string when no pattern occurs
     */
    public String snippet(String summary, List<String> patterns, int maxLen) {
        if (summary == null || summary.isEmpty() || patterns == null || patterns.isEmpty()) {
            return "";
        }
        // offsets must index the original text; lowercasing can change its length
        int first = -1;
        for (String p : patterns) {
            if (p == null || p.isEmpty()) continue;
            Matcher m = literal(p).matcher(summary);
            if (m.find() && (first < 0 || m.start() < first)) {
                first = m.start();
            }
        }
        if (first < 0) {
            return "";
        }
        int start = Math.min(Math.max(0, first - LEAD_IN), summary.length());
        int end = (int) Math.min((long) start + Math.max(1, maxLen), summary.length());
        String window = summary.substring(start, end);
        if (start > 0) {
            window = ELLIPSIS + window;
        }
        if (end < summary.length()) {
            window = window + ELLIPSIS;
        }
        return highlight(window, patterns);
    }
}
