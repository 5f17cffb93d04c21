package org.abitware.newsfinder.index;

/** Field names used in the news index. */
public final class NewsFields {
    /** Numeric id: point for lookups, doc values for ordering, stored for loading */
    public static final String ID = "id";
    public static final String ID_SORT = "id_sort";
    /** Exact id term, used to replace a document in place */
    public static final String ID_KEY = "id_key";

    public static final String SOURCE = "source";
    /** Lowercased source for case-insensitive filtering */
    public static final String SOURCE_KEY = "source_key";

    public static final String TITLE = "title";
    public static final String SUMMARY = "summary";
    public static final String LINK = "link";
    public static final String PUBLISHED = "published";
    public static final String PUBLISHED_SORT = "published_sort";
    public static final String HASH = "hash";
    public static final String ADDED_AT = "added_at";

    /** Fields the full-text index covers */
    public static final String[] TEXT_FIELDS = { TITLE, SUMMARY };

    private NewsFields() {}
}
