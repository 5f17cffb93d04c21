package org.abitware.newsfinder.store;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;
import org.abitware.newsfinder.news.NewsItem;
import org.abitware.newsfinder.news.SourceCount;
import org.abitware.newsfinder.search.SearchResult;
import org.abitware.newsfinder.search.query.FallbackPredicate;

/**
 * Storage collaborator of the search engine. Listings are ordered newest first.
 * Failures are reported as {@link NewsStoreException}.
 */
public interface NewsStore extends Closeable {

    /**
     * Whether a native full-text index exists. Fixed for the lifetime of the store.
     */
    boolean isFullTextAvailable();

    /**
     * Executes a match expression against the full-text index.
     *
     * @param matchExpression space-separated terms, phrases in double quotes
     * @param limit page size
     * @param offset matches to skip
     * @return one page ordered by id descending and the exact match count
     * @throws IndexUnavailableException if {@link #isFullTextAvailable()} is false
     */
    SearchResult indexSearch(String matchExpression, int limit, int offset);

    /**
     * Scans the whole collection with a substring predicate.
     *
     * @param predicate containment test over title and summary
     * @param limit page size
     * @param offset matches to skip
     * @return one page ordered by id descending and the exact match count
     */
    SearchResult substringSearch(FallbackPredicate predicate, int limit, int offset);

    /**
     * Adds items, skipping those whose hash is already stored.
     *
     * @return number of items actually inserted
     */
    int insertMany(List<NewsItem> items);

    List<NewsItem> latestPage(int offset, int limit);

    long total();

    /** Item counts per source, largest first. */
    List<SourceCount> countBySource();

    long totalBySource(String source);

    List<NewsItem> sourceNews(String source, int limit, int offset);

    /** Index rebuild support, when this store has a rebuildable index. */
    default Optional<IndexRebuilder> rebuilder() {
        return Optional.empty();
    }

    @Override
    void close();
}
