package org.abitware.newsfinder.search.query;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.abitware.newsfinder.index.NewsDocumentBuilder;
import org.abitware.newsfinder.index.NewsFields;
import org.abitware.newsfinder.news.NewsItem;
import org.abitware.newsfinder.search.SearchResult;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;

/**
 * Query executor that runs Lucene queries and substring scans against the
 * news index and converts hits to {@link NewsItem} pages.
 * Each call opens its own reader; nothing is shared between calls.
 *
 * @author DocFinder Team
 * @version 1.0
 * @since 1.0
 */
public class QueryExecutor {

    /** Newest first */
    public static final Sort BY_ID_DESC = new Sort(new SortField(NewsFields.ID_SORT, SortField.Type.LONG, true));

    /** Newest publication first, then newest id */
    public static final Sort BY_PUBLISHED_DESC = new Sort(
            new SortField(NewsFields.PUBLISHED_SORT, SortField.Type.STRING, true),
            new SortField(NewsFields.ID_SORT, SortField.Type.LONG, true));

    /** Index directory */
    private final Directory directory;

    /**
     * Constructs a QueryExecutor over the given directory.
     *
     * @param directory the Lucene directory holding the news index
     */
    public QueryExecutor(Directory directory) {
        this.directory = directory;
    }

    /**
     * Executes a query and returns one page plus the exact hit count.
     *
     * @param query the Lucene query
     * @param sort result ordering
     * @param limit page size
     * @param offset hits to skip
     * @return the page
     * @throws IOException if the index cannot be read
     */
    public SearchResult execute(Query query, Sort sort, int limit, int offset) throws IOException {
        try (DirectoryReader reader = DirectoryReader.open(directory)) {
            IndexSearcher searcher = new IndexSearcher(reader);
            int total = searcher.count(query);
            if (total == 0 || offset >= total) {
                return new SearchResult(new ArrayList<>(), total);
            }

            int want = (int) Math.min((long) offset + limit, total);
            TopDocs top = searcher.search(query, want, sort);
            StoredFields stored = searcher.storedFields();

            List<NewsItem> rows = new ArrayList<>(Math.max(0, want - offset));
            ScoreDoc[] hits = top.scoreDocs;
            for (int i = offset; i < hits.length && rows.size() < limit; i++) {
                rows.add(NewsDocumentBuilder.toItem(stored.document(hits[i].doc)));
            }
            return new SearchResult(rows, total);
        }
    }

    /**
     * Counts the documents matching a query.
     *
     * @param query the Lucene query
     * @return the hit count
     * @throws IOException if the index cannot be read
     */
    public int count(Query query) throws IOException {
        try (DirectoryReader reader = DirectoryReader.open(directory)) {
            return new IndexSearcher(reader).count(query);
        }
    }

    /**
     * Scans every document newest first and keeps those accepted by the predicate.
     * The count is exact over the whole collection.
     *
     * @param predicate containment test over title and summary
     * @param limit page size
     * @param offset matches to skip
     * @return the page
     * @throws IOException if the index cannot be read
     */
    public SearchResult scan(FallbackPredicate predicate, int limit, int offset) throws IOException {
        List<NewsItem> rows = new ArrayList<>();
        if (predicate.isNeverTrue()) {
            return new SearchResult(rows, 0);
        }
        long matched = 0;
        for (Document doc : allDocuments(BY_ID_DESC)) {
            if (!predicate.matches(doc.get(NewsFields.TITLE), doc.get(NewsFields.SUMMARY))) {
                continue;
            }
            if (matched >= offset && rows.size() < limit) {
                rows.add(NewsDocumentBuilder.toItem(doc));
            }
            matched++;
        }
        return new SearchResult(rows, matched);
    }

    /**
     * Loads every stored document in the given order.
     *
     * @param sort the ordering
     * @return stored documents
     * @throws IOException if the index cannot be read
     */
    public List<Document> allDocuments(Sort sort) throws IOException {
        try (DirectoryReader reader = DirectoryReader.open(directory)) {
            IndexSearcher searcher = new IndexSearcher(reader);
            int n = reader.numDocs();
            List<Document> docs = new ArrayList<>(n);
            if (n == 0) {
                return docs;
            }
            TopDocs top = searcher.search(new MatchAllDocsQuery(), n, sort);
            StoredFields stored = searcher.storedFields();
            for (ScoreDoc sd : top.scoreDocs) {
                docs.add(stored.document(sd.doc));
            }
            return docs;
        }
    }
}
