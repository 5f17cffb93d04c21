package org.abitware.newsfinder.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.abitware.newsfinder.news.NewsItem;
import org.abitware.newsfinder.search.query.FallbackPredicate;
import org.abitware.newsfinder.search.query.NewsQueryParser;
import org.abitware.newsfinder.search.query.QueryCompiler;
import org.abitware.newsfinder.search.query.QueryNode;
import org.abitware.newsfinder.search.query.TermSplit;
import org.abitware.newsfinder.store.NewsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Search execution policy: parse, compile, try the full-text index, post-filter
 * negated terms, and fall back to a substring scan whenever the index path
 * yields no rows.
 *
 * <p>The index path totals are approximate in the presence of negated terms
 * (only removals on the current page are subtracted); the fallback path is exact.
 *
 * @author DocFinder Team
 * @version 1.0
 * @since 1.0
 */
public class SearchEngine implements SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchEngine.class);

    private final NewsStore store;

    /** Read once: absence of the index is permanent */
    private final boolean indexAvailable;

    public SearchEngine(NewsStore store) {
        this.store = store;
        this.indexAvailable = store.isFullTextAvailable();
        if (!indexAvailable) {
            log.info("Full-text index unavailable; all searches use the substring scan");
        }
    }

    public boolean isIndexAvailable() {
        return indexAvailable;
    }

    @Override
    public SearchResult search(String query, int limit, int offset) {
        String raw = query == null ? "" : query.trim();
        if (raw.isEmpty()) {
            return SearchResult.empty();
        }
        Optional<QueryNode> parsed = NewsQueryParser.parse(raw);
        if (!parsed.isPresent()) {
            return SearchResult.empty();
        }
        int pageSize = Math.max(1, limit);
        int skip = Math.max(0, offset);

        QueryNode ast = parsed.get();
        TermSplit split = QueryCompiler.splitPositiveNegative(ast);

        if (indexAvailable && !split.isNegativeOnly()) {
            SearchResult indexed = searchIndex(ast, split, pageSize, skip);
            if (!indexed.isEmpty()) {
                log.debug("Query [{}] answered from index: {} rows of {}", raw, indexed.rows.size(), indexed.total);
                return indexed;
            }
        }

        FallbackPredicate predicate = QueryCompiler.buildFallbackPredicate(ast);
        SearchResult scanned = store.substringSearch(predicate, pageSize, skip).withPath(SearchPath.FALLBACK);
        log.debug("Query [{}] answered by scan {}: {} rows of {}", raw, predicate, scanned.rows.size(), scanned.total);
        return scanned;
    }

    private SearchResult searchIndex(QueryNode ast, TermSplit split, int limit, int offset) {
        String match = QueryCompiler.buildIndexMatchExpression(ast);
        if (match.trim().isEmpty()) {
            return SearchResult.empty();
        }
        SearchResult page = store.indexSearch(match, limit, offset);
        if (split.negatives.isEmpty() || page.isEmpty()) {
            return page.withPath(SearchPath.INDEX);
        }
        return excludeNegatives(page, split.negatives).withPath(SearchPath.INDEX);
    }

    /**
     * Drops rows containing any negated term. The total is reduced by the rows
     * removed from this page only.
     */
    static SearchResult excludeNegatives(SearchResult page, List<QueryNode.Term> negatives) {
        List<String> needles = new ArrayList<>(negatives.size());
        for (QueryNode.Term t : negatives) {
            needles.add(t.original.toLowerCase(Locale.ROOT));
        }
        List<NewsItem> kept = new ArrayList<>(page.rows.size());
        for (NewsItem row : page.rows) {
            if (!containsAny(row, needles)) {
                kept.add(row);
            }
        }
        int removed = page.rows.size() - kept.size();
        return new SearchResult(kept, Math.max(0L, page.total - removed), page.path);
    }

    private static boolean containsAny(NewsItem row, List<String> needles) {
        String title = row.title == null ? "" : row.title.toLowerCase(Locale.ROOT);
        String summary = row.summary == null ? "" : row.summary.toLowerCase(Locale.ROOT);
        for (String n : needles) {
            if (title.contains(n) || summary.contains(n)) {
                return true;
            }
        }
        return false;
    }
}
