package org.abitware.newsfinder.news;

/** Number of stored items for one source. */
public class SourceCount {
    public final String source;
    public final long count;

    public SourceCount(String source, long count) {
        this.source = source;
        this.count = count;
    }
}
