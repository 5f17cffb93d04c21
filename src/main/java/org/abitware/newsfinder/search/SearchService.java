package org.abitware.newsfinder.search;

/** Search over the news collection. */
public interface SearchService {

    /**
     * Runs a query and returns one page.
     *
     * @param query raw user query
     * @param limit page size
     * @param offset number of matches to skip
     * @return the page plus the total number of matches
     */
    SearchResult search(String query, int limit, int offset);
}
