package org.abitware.newsfinder.present;

import java.util.Collections;
import java.util.List;

import org.abitware.newsfinder.highlight.HighlightEngine;
import org.abitware.newsfinder.news.NewsItem;

/**
 * Renders listing pages and single items as message text.
 *
 * @author DocFinder Team
 * @version 1.0
 * @since 1.0
 */
public class PageFormatter {

    static final String NO_RESULTS = "No results.";

    private final HighlightEngine highlighter;

    public PageFormatter(HighlightEngine highlighter) {
        this.highlighter = highlighter;
    }

    /**
     * Search results page with highlighted titles and summary snippets.
     *
     * @param rows rows of this page
     * @param offset offset of the first row
     * @param limit page size
     * @param total matches on all pages
     * @param header first line, already escaped
     * @param patterns highlight patterns
     * @return the message text
     */
    public String searchPage(List<NewsItem> rows, int offset, int limit, long total,
                             String header, List<String> patterns) {
        return render(rows, offset, limit, total, header, patterns, true);
    }

    /** Browse listing: titles and dates only. */
    public String page(List<NewsItem> rows, int offset, int limit, long total, String header) {
        return render(rows, offset, limit, total, header, Collections.emptyList(), false);
    }

    private String render(List<NewsItem> rows, int offset, int limit, long total,
                          String header, List<String> patterns, boolean snippets) {
        StringBuilder sb = new StringBuilder();
        if (header != null && !header.isEmpty()) {
            sb.append(header).append('\n');
        }
        int pageSize = Math.max(1, limit);
        long pages = Math.max(1, (total + pageSize - 1) / pageSize);
        long pageNo = offset / pageSize + 1;

        if (rows.isEmpty()) {
            sb.append(total == 0 ? NO_RESULTS : "Page " + pageNo + "/" + pages + " is empty.");
            return sb.toString();
        }

        sb.append("Results ").append(offset + 1).append('–').append(offset + rows.size())
                .append(" of ").append(total)
                .append(" (page ").append(pageNo).append('/').append(pages).append(")\n");

        for (int i = 0; i < rows.size(); i++) {
            NewsItem item = rows.get(i);
            sb.append('\n').append(offset + i + 1).append(". ")
                    .append(highlighter.highlight(TextCleaner.clean(item.title), patterns)).append('\n');
            sb.append("   ").append(TextCleaner.escape(item.source));
            if (item.published != null && !item.published.isEmpty()) {
                sb.append(" · ").append(TextCleaner.escape(item.published));
            }
            sb.append('\n');
            if (snippets) {
                String snippet = highlighter.snippet(TextCleaner.clean(item.summary), patterns);
                if (!snippet.isEmpty()) {
                    sb.append("   ").append(snippet).append('\n');
                }
            }
        }
        return sb.toString().trim();
    }

    /**
     * A single item of the newest-first list.
     *
     * @param item the item
     * @param idx zero-based position
     * @param total list size
     */
    public String singleItem(NewsItem item, int idx, long total) {
        return "News " + (idx + 1) + "/" + total + "\n\n" + body(item);
    }

    /** A single item of one source's list. */
    public String sourceItem(NewsItem item, int idx, long total, String source) {
        return TextCleaner.escape(source) + ": " + (idx + 1) + "/" + total + "\n\n" + body(item);
    }

    private static String body(NewsItem item) {
        StringBuilder sb = new StringBuilder();
        sb.append("<b>").append(TextCleaner.clean(item.title)).append("</b>\n");
        sb.append(TextCleaner.escape(item.source));
        if (item.published != null && !item.published.isEmpty()) {
            sb.append(" · ").append(TextCleaner.escape(item.published));
        }
        String summary = TextCleaner.clean(item.summary);
        if (!summary.isEmpty()) {
            sb.append("\n\n").append(summary);
        }
        sb.append("\n\n").append(TextCleaner.escape(item.link));
        return sb.toString();
    }
}
