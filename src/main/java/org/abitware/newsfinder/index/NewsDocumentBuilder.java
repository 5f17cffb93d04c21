package org.abitware.newsfinder.index;

import java.util.Locale;
import org.abitware.newsfinder.news.NewsItem;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;
import org.apache.lucene.util.BytesRef;

/**
 * Converts between {@link NewsItem} and Lucene documents.
 * Every field is stored so the index alone can reproduce the collection;
 * title and summary are analyzed only when the full-text index is enabled.
 *
 * @author DocFinder Team
 * @version 1.0
 * @since 1.0
 */
public class NewsDocumentBuilder {

    /** Whether title and summary go into the inverted index */
    private final boolean fullText;

    /**
     * Constructs a NewsDocumentBuilder.
     *
     * @param fullText true to analyze title and summary for full-text search
     */
    public NewsDocumentBuilder(boolean fullText) {
        this.fullText = fullText;
    }

    /**
     * Creates a Lucene document for a news item that already carries its id.
     *
     * @param item the news item
     * @return the created Lucene document
     */
    public Document createDocument(NewsItem item) {
        Document doc = new Document();

        addIdFields(doc, item.id);

        doc.add(new StoredField(NewsFields.SOURCE, item.source));
        doc.add(new StringField(NewsFields.SOURCE_KEY, sourceKey(item.source), Field.Store.NO));

        addTextField(doc, NewsFields.TITLE, item.title);
        addTextField(doc, NewsFields.SUMMARY, item.summary == null ? "" : item.summary);

        doc.add(new StoredField(NewsFields.LINK, item.link));
        String published = item.published == null ? "" : item.published;
        doc.add(new StoredField(NewsFields.PUBLISHED, published));
        doc.add(new SortedDocValuesField(NewsFields.PUBLISHED_SORT, new BytesRef(published)));

        doc.add(new StringField(NewsFields.HASH, item.hash, Field.Store.YES));
        if (item.addedAt != null) {
            doc.add(new StoredField(NewsFields.ADDED_AT, item.addedAt));
        }
        return doc;
    }

    /**
     * Restores a news item from a stored document.
     *
     * @param doc the stored Lucene document
     * @return the news item
     */
    public static NewsItem toItem(Document doc) {
        IndexableField id = doc.getField(NewsFields.ID);
        String published = doc.get(NewsFields.PUBLISHED);
        String summary = doc.get(NewsFields.SUMMARY);
        return new NewsItem(
                id == null ? 0L : id.numericValue().longValue(),
                doc.get(NewsFields.SOURCE),
                doc.get(NewsFields.TITLE),
                doc.get(NewsFields.LINK),
                (published == null || published.isEmpty()) ? null : published,
                (summary == null || summary.isEmpty()) ? null : summary,
                doc.get(NewsFields.HASH),
                doc.get(NewsFields.ADDED_AT));
    }

    /**
     * Term identifying the document of a given id.
     *
     * @param id the document id
     * @return the id term
     */
    public static Term idTerm(long id) {
        return new Term(NewsFields.ID_KEY, Long.toString(id));
    }

    /** Lowercased source used for case-insensitive source filters. */
    public static String sourceKey(String source) {
        return source == null ? "" : source.toLowerCase(Locale.ROOT);
    }

    private void addIdFields(Document doc, long id) {
        doc.add(new LongPoint(NewsFields.ID, id));
        doc.add(new StoredField(NewsFields.ID, id));
        doc.add(new NumericDocValuesField(NewsFields.ID_SORT, id));
        doc.add(new StringField(NewsFields.ID_KEY, Long.toString(id), Field.Store.NO));
    }

    private void addTextField(Document doc, String name, String value) {
        if (fullText) {
            doc.add(new TextField(name, value, Field.Store.YES));
        } else {
            doc.add(new StoredField(name, value));
        }
    }
}
