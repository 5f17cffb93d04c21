package org.abitware.newsfinder.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import org.abitware.newsfinder.index.NewsDocumentBuilder;
import org.abitware.newsfinder.index.NewsFields;
import org.abitware.newsfinder.news.NewsItem;
import org.abitware.newsfinder.news.SourceCount;
import org.abitware.newsfinder.search.SearchResult;
import org.abitware.newsfinder.search.query.FallbackPredicate;
import org.abitware.newsfinder.search.query.QueryBuilder;
import org.abitware.newsfinder.search.query.QueryExecutor;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * News store backed by a Lucene index. All fields are stored, so the index is
 * both the collection and, when enabled, its full-text index over title and summary.
 *
 * <p>Reads open a fresh reader per call; writes open an {@link IndexWriter} per call
 * and are serialized.
 *
 * @author DocFinder Team
 * @version 1.0
 * @since 1.0
 */
public class LuceneNewsStore implements NewsStore, IndexRebuilder {

    private static final Logger log = LoggerFactory.getLogger(LuceneNewsStore.class);

    private static final DateTimeFormatter ADDED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Directory directory;
    private final boolean fullText;
    private final Analyzer analyzer;
    private final NewsDocumentBuilder documentBuilder;
    private final QueryBuilder queryBuilder;
    private final QueryExecutor queryExecutor;
    private final AtomicLong lastId;
    private final Object writeLock = new Object();

    /**
     * Opens (creating if needed) a store over the given directory.
     *
     * @param directory the Lucene directory
     * @param fullText whether title and summary are indexed for full-text search
     */
    public LuceneNewsStore(Directory directory, boolean fullText) {
        this.directory = directory;
        this.fullText = fullText;
        this.analyzer = new StandardAnalyzer();
        this.documentBuilder = new NewsDocumentBuilder(fullText);
        this.queryBuilder = new QueryBuilder(analyzer);
        this.queryExecutor = new QueryExecutor(directory);
        try {
            initIndex();
            this.lastId = new AtomicLong(readMaxId());
        } catch (IOException e) {
            throw new NewsStoreException("Could not open news index", e);
        }
        if (!fullText) {
            log.info("Full-text index disabled; searches use substring scan only");
        }
    }

    /**
     * Opens a store in a filesystem directory.
     *
     * @param indexDir the index directory, created if missing
     * @param fullText whether title and summary are indexed
     * @return the store
     */
    public static LuceneNewsStore open(Path indexDir, boolean fullText) {
        try {
            Files.createDirectories(indexDir);
            return new LuceneNewsStore(FSDirectory.open(indexDir), fullText);
        } catch (IOException e) {
            throw new NewsStoreException("Could not open index directory " + indexDir, e);
        }
    }

    /**
     * Opens a heap-resident store, used by tests and demos.
     *
     * @param fullText whether title and summary are indexed
     * @return the store
     */
    public static LuceneNewsStore inMemory(boolean fullText) {
        return new LuceneNewsStore(new ByteBuffersDirectory(), fullText);
    }

    private void initIndex() throws IOException {
        // an empty commit so readers can always open
        try (IndexWriter writer = newWriter(IndexWriterConfig.OpenMode.CREATE_OR_APPEND)) {
            writer.commit();
        }
    }

    private long readMaxId() throws IOException {
        SearchResult newest = queryExecutor.execute(new MatchAllDocsQuery(), QueryExecutor.BY_ID_DESC, 1, 0);
        return newest.rows.isEmpty() ? 0L : newest.rows.get(0).id;
    }

    private IndexWriter newWriter(IndexWriterConfig.OpenMode mode) throws IOException {
        IndexWriterConfig config = new IndexWriterConfig(analyzer).setOpenMode(mode);
        return new IndexWriter(directory, config);
    }

    @Override
    public boolean isFullTextAvailable() {
        return fullText;
    }

    @Override
    public SearchResult indexSearch(String matchExpression, int limit, int offset) {
        if (!fullText) {
            throw new IndexUnavailableException("Full-text index is not enabled");
        }
        Optional<Query> query = queryBuilder.buildQuery(matchExpression);
        if (!query.isPresent()) {
            return new SearchResult(new ArrayList<>(), 0);
        }
        try {
            return queryExecutor.execute(query.get(), QueryExecutor.BY_ID_DESC, limit, offset);
        } catch (IOException e) {
            throw new NewsStoreException("Index search failed", e);
        }
    }

    @Override
    public SearchResult substringSearch(FallbackPredicate predicate, int limit, int offset) {
        try {
            return queryExecutor.scan(predicate, limit, offset);
        } catch (IOException e) {
            throw new NewsStoreException("Substring scan failed", e);
        }
    }

    @Override
    public int insertMany(List<NewsItem> items) {
        if (items == null || items.isEmpty()) {
            return 0;
        }
        synchronized (writeLock) {
            try (IndexWriter writer = newWriter(IndexWriterConfig.OpenMode.CREATE_OR_APPEND)) {
                Set<String> batch = new HashSet<>();
                String now = LocalDateTime.now().format(ADDED_AT);
                int inserted = 0;
                for (NewsItem item : items) {
                    if (!batch.add(item.hash) || exists(item.hash)) {
                        continue;
                    }
                    NewsItem stored = item.withId(lastId.incrementAndGet(), item.addedAt != null ? item.addedAt : now);
                    writer.addDocument(documentBuilder.createDocument(stored));
                    inserted++;
                }
                writer.commit();
                if (inserted > 0) {
                    log.debug("Inserted {} of {} news items", inserted, items.size());
                }
                return inserted;
            } catch (IOException e) {
                throw new NewsStoreException("Could not insert news items", e);
            }
        }
    }

    private boolean exists(String hash) throws IOException {
        return queryExecutor.count(new TermQuery(new Term(NewsFields.HASH, hash))) > 0;
    }

    @Override
    public List<NewsItem> latestPage(int offset, int limit) {
        return page(new MatchAllDocsQuery(), limit, offset).rows;
    }

    @Override
    public long total() {
        return count(new MatchAllDocsQuery());
    }

    @Override
    public List<SourceCount> countBySource() {
        Map<String, Long> counts = new LinkedHashMap<>();
        try {
            for (Document doc : queryExecutor.allDocuments(QueryExecutor.BY_ID_DESC)) {
                counts.merge(doc.get(NewsFields.SOURCE), 1L, Long::sum);
            }
        } catch (IOException e) {
            throw new NewsStoreException("Could not count sources", e);
        }
        return counts.entrySet().stream()
                .sorted((a, b) -> Long.compare(b.getValue(), a.getValue()))
                .map(e -> new SourceCount(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    @Override
    public long totalBySource(String source) {
        return count(sourceQuery(source));
    }

    @Override
    public List<NewsItem> sourceNews(String source, int limit, int offset) {
        return page(sourceQuery(source), limit, offset).rows;
    }

    private static Query sourceQuery(String source) {
        return new TermQuery(new Term(NewsFields.SOURCE_KEY, NewsDocumentBuilder.sourceKey(source)));
    }

    private SearchResult page(Query query, int limit, int offset) {
        try {
            return queryExecutor.execute(query, QueryExecutor.BY_PUBLISHED_DESC, Math.max(1, limit), Math.max(0, offset));
        } catch (IOException e) {
            throw new NewsStoreException("Could not read news page", e);
        }
    }

    private long count(Query query) {
        try {
            return queryExecutor.count(query);
        } catch (IOException e) {
            throw new NewsStoreException("Could not count news items", e);
        }
    }

    @Override
    public Optional<IndexRebuilder> rebuilder() {
        return fullText ? Optional.of(this) : Optional.empty();
    }

    @Override
    public RebuildMode rebuild() {
        if (!fullText) {
            throw new IndexUnavailableException("Full-text index is not enabled");
        }
        synchronized (writeLock) {
            List<NewsItem> snapshot;
            try {
                snapshot = queryExecutor.allDocuments(QueryExecutor.BY_ID_DESC).stream()
                        .map(NewsDocumentBuilder::toItem)
                        .collect(Collectors.toList());
            } catch (IOException e) {
                throw new IndexRebuildException("Could not read stored documents", e);
            }

            try {
                softRebuild(snapshot);
                log.info("Index soft rebuild completed ({} documents)", snapshot.size());
                return RebuildMode.SOFT;
            } catch (IOException | RuntimeException e) {
                log.warn("Soft rebuild failed ({}); performing full rebuild", e.getMessage());
            }

            try {
                fullRebuild(snapshot);
                log.info("Index full rebuild completed ({} documents)", snapshot.size());
                return RebuildMode.FULL;
            } catch (IOException | RuntimeException e) {
                throw new IndexRebuildException("Full index rebuild failed", e);
            }
        }
    }

    /**
     * Re-indexes every document in place. On failure the writer is rolled back,
     * leaving the previous commit untouched.
     *
     * @param snapshot all stored items
     * @throws IOException if re-indexing fails
     */
    protected void softRebuild(List<NewsItem> snapshot) throws IOException {
        IndexWriter writer = newWriter(IndexWriterConfig.OpenMode.APPEND);
        try {
            for (NewsItem item : snapshot) {
                writer.updateDocument(NewsDocumentBuilder.idTerm(item.id), rebuildDocument(item));
            }
            writer.forceMerge(1);
            writer.commit();
            writer.close();
        } catch (IOException | RuntimeException e) {
            writer.rollback();
            throw e;
        }
    }

    /**
     * Drops the index, recreates it and back-fills it from the snapshot.
     * Nothing is committed unless the whole snapshot was written; on failure
     * the writer is rolled back and the previous commit stays in place.
     *
     * @param snapshot all stored items
     * @throws IOException if the new index cannot be written
     */
    protected void fullRebuild(List<NewsItem> snapshot) throws IOException {
        IndexWriter writer = newWriter(IndexWriterConfig.OpenMode.CREATE);
        try {
            for (NewsItem item : snapshot) {
                writer.addDocument(rebuildDocument(item));
            }
            writer.commit();
            writer.close();
        } catch (IOException | RuntimeException e) {
            writer.rollback();
            throw e;
        }
    }

    /**
     * Document written for an item during a rebuild.
     *
     * @param item a stored item
     * @return the document to index
     */
    protected Document rebuildDocument(NewsItem item) {
        return documentBuilder.createDocument(item);
    }

    @Override
    public void close() {
        try {
            directory.close();
        } catch (IOException e) {
            log.warn("Error closing news index: {}", e.getMessage());
        }
        analyzer.close();
    }
}
