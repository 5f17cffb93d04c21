package org.abitware.newsfinder.news;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/** A single news entry as stored in the collection. {@code id} is 0 until the store assigns one. */
public class NewsItem {
    public final long id;
    public final String source;
    public final String title;
    public final String link;
    public final String published;
    public final String summary;
    public final String hash;
    public final String addedAt;

    public NewsItem(String source, String title, String link, String published, String summary) {
        this(0L, source, title, link, published, summary, contentHash(source, title, link), null);
    }

    public NewsItem(long id, String source, String title, String link, String published,
                    String summary, String hash, String addedAt) {
        this.id = id;
        this.source = Objects.requireNonNull(source, "source");
        this.title = Objects.requireNonNull(title, "title");
        this.link = Objects.requireNonNull(link, "link");
        this.published = published;
        this.summary = summary;
        this.hash = Objects.requireNonNull(hash, "hash");
        this.addedAt = addedAt;
    }

    /** Same entry with the identity assigned by the store. */
    public NewsItem withId(long newId, String newAddedAt) {
        return new NewsItem(newId, source, title, link, published, summary, hash, newAddedAt);
    }

    /** Deduplication key: SHA-256 over source, title and link. */
    public static String contentHash(String source, String title, String link) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            String joined = source + '\u0001' + title + '\u0001' + link;
            byte[] digest = md.digest(joined.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "NewsItem{id=" + id + ", source=" + source + ", title=" + title + "}";
    }
}
