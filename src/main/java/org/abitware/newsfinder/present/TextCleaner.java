package org.abitware.newsfinder.present;

import java.util.regex.Pattern;

import org.jsoup.parser.Parser;

/** Turns feed text (HTML fragments, entities, messy whitespace) into escaped plain text. */
public final class TextCleaner {

    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    private static final Pattern BRACKET_ENTITY = Pattern.compile("\\[&#\\d+;?\\]");
    private static final Pattern MULTISPACE = Pattern.compile("[ \\t\\r\\f\\u000B]+");
    private static final Pattern NEWLINES = Pattern.compile("\\n{3,}");

    private TextCleaner() {}

    /**
     * Cleans raw feed text for display.
     *
     * @param raw text as fetched, may be null
     * @return cleaned text with {@code &}, {@code <} and {@code >} escaped
     */
    public static String clean(String raw) {
        if (raw == null || raw.isEmpty()) return "";
        // "[&#8230;]" must survive unescaping to be recognized
        String txt = BRACKET_ENTITY.matcher(raw).replaceAll("…");
        txt = Parser.unescapeEntities(txt, false);
        txt = TAG.matcher(txt).replaceAll("");
        txt = txt.replace(' ', ' ');
        txt = MULTISPACE.matcher(txt).replaceAll(" ");
        txt = NEWLINES.matcher(txt).replaceAll("\n\n");
        return escape(txt.trim());
    }

    /** Escapes the three characters significant in message markup. */
    public static String escape(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
