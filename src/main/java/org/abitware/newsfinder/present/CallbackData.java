package org.abitware.newsfinder.present;

import java.util.Optional;

/**
 * Navigation payload attached to a button, encoded as {@code prefix:field:field}.
 */
public final class CallbackData {

    public enum Kind {
        /** Latest news list: offset, limit */
        LATEST_PAGE("lp"),
        /** Search results: key, offset, limit */
        SEARCH_PAGE("fs"),
        /** Source list: key, offset, limit */
        SOURCE_PAGE("sp"),
        /** Single latest item: index */
        NEWS_ITEM("ni"),
        /** Single source item: key, index */
        SOURCE_ITEM("sni");

        public final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String close() {
            return prefix + ":close";
        }

        static Optional<Kind> byPrefix(String prefix) {
            for (Kind k : values()) {
                if (k.prefix.equals(prefix)) return Optional.of(k);
            }
            return Optional.empty();
        }
    }

    public final Kind kind;
    /** Session key, null for LATEST_PAGE and NEWS_ITEM */
    public final String key;
    public final int offset;
    public final int limit;
    public final boolean close;

    private CallbackData(Kind kind, String key, int offset, int limit, boolean close) {
        this.kind = kind;
        this.key = key;
        this.offset = offset;
        this.limit = limit;
        this.close = close;
    }

    public static String latestPage(int offset, int limit) {
        return Kind.LATEST_PAGE.prefix + ":" + offset + ":" + limit;
    }

    public static String searchPage(String key, int offset, int limit) {
        return Kind.SEARCH_PAGE.prefix + ":" + key + ":" + offset + ":" + limit;
    }

    public static String sourcePage(String key, int offset, int limit) {
        return Kind.SOURCE_PAGE.prefix + ":" + key + ":" + offset + ":" + limit;
    }

    public static String newsItem(int idx) {
        return Kind.NEWS_ITEM.prefix + ":" + idx;
    }

    public static String sourceItem(String key, int idx) {
        return Kind.SOURCE_ITEM.prefix + ":" + key + ":" + idx;
    }

    /** For single-item payloads the index is carried in {@link #offset}. */
    public int index() {
        return offset;
    }

    /**
     * Decodes a payload.
     *
     * @param data the raw payload
     * @return the decoded data, empty if malformed
     */
    public static Optional<CallbackData> decode(String data) {
        if (data == null || data.isEmpty()) return Optional.empty();
        String[] parts = data.split(":", -1);
        Optional<Kind> kind = Kind.byPrefix(parts[0]);
        if (!kind.isPresent()) return Optional.empty();
        Kind k = kind.get();
        if (parts.length == 2 && "close".equals(parts[1])) {
            return Optional.of(new CallbackData(k, null, 0, 0, true));
        }
        try {
            switch (k) {
                case LATEST_PAGE:
                    if (parts.length != 3) return Optional.empty();
                    return page(k, null, parts[1], parts[2]);
                case SEARCH_PAGE:
                case SOURCE_PAGE:
                    if (parts.length != 4 || parts[1].isEmpty()) return Optional.empty();
                    return page(k, parts[1], parts[2], parts[3]);
                case NEWS_ITEM:
                    if (parts.length != 2) return Optional.empty();
                    return item(k, null, parts[1]);
                case SOURCE_ITEM:
                    if (parts.length != 3 || parts[1].isEmpty()) return Optional.empty();
                    return item(k, parts[1], parts[2]);
                default:
                    return Optional.empty();
            }
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<CallbackData> page(Kind k, String key, String offset, String limit) {
        int o = Integer.parseInt(offset);
        int l = Integer.parseInt(limit);
        if (o < 0 || l < 1) return Optional.empty();
        return Optional.of(new CallbackData(k, key, o, l, false));
    }

    private static Optional<CallbackData> item(Kind k, String key, String idx) {
        return Optional.of(new CallbackData(k, key, Integer.parseInt(idx), 1, false));
    }
}
