package org.abitware.newsfinder.search;

import java.util.Collections;
import java.util.List;
import org.abitware.newsfinder.news.NewsItem;

/**
 * One page of matches. {@code total} counts matches on all pages for the path
 * that actually executed.
 */
public class SearchResult {
    private static final SearchResult EMPTY = new SearchResult(Collections.emptyList(), 0L, SearchPath.NONE);

    public final List<NewsItem> rows;
    public final long total;
    public final SearchPath path;

    public SearchResult(List<NewsItem> rows, long total) {
        this(rows, total, SearchPath.NONE);
    }

    public SearchResult(List<NewsItem> rows, long total, SearchPath path) {
        this.rows = rows == null ? Collections.emptyList() : Collections.unmodifiableList(rows);
        this.total = Math.max(0L, total);
        this.path = path == null ? SearchPath.NONE : path;
    }

    public static SearchResult empty() {
        return EMPTY;
    }

    public SearchResult withPath(SearchPath newPath) {
        return new SearchResult(rows, total, newPath);
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public String toString() {
        return "SearchResult{rows=" + rows.size() + ", total=" + total + ", path=" + path + "}";
    }
}
