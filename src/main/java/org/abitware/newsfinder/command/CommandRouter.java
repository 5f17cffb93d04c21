package org.abitware.newsfinder.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.abitware.newsfinder.config.NewsFinderSettings;
import org.abitware.newsfinder.highlight.HighlightEngine;
import org.abitware.newsfinder.news.NewsItem;
import org.abitware.newsfinder.news.SourceCount;
import org.abitware.newsfinder.present.CallbackData;
import org.abitware.newsfinder.present.Keyboard;
import org.abitware.newsfinder.present.PageFormatter;
import org.abitware.newsfinder.present.TextCleaner;
import org.abitware.newsfinder.search.SearchResult;
import org.abitware.newsfinder.search.SearchService;
import org.abitware.newsfinder.search.query.NewsQueryParser;
import org.abitware.newsfinder.session.SessionCache;
import org.abitware.newsfinder.session.StaleSessionException;
import org.abitware.newsfinder.store.IndexRebuildException;
import org.abitware.newsfinder.store.IndexRebuilder;
import org.abitware.newsfinder.store.NewsStore;
import org.abitware.newsfinder.store.NewsStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches chat commands and button callbacks to the store and search engine
 * and renders the replies.
 *
 * @author DocFinder Team
 * @version 1.0
 * @since 1.0
 */
public class CommandRouter {

    private static final Logger log = LoggerFactory.getLogger(CommandRouter.class);

    static final String HELP =
            "Commands:\n"
            + "/latest - newest news\n"
            + "/news [N] - news item N\n"
            + "/filter <query> [|page] - search; supports \"phrases\", OR, NOT, -word\n"
            + "/source <name> [N] - news of one source\n"
            + "/sources - list sources\n"
            + "/stats - collection statistics";

    static final String EMPTY_QUERY = "Empty query.";
    static final String NO_NEWS = "No news yet.";
    static final String BAD_CALLBACK = "Bad callback data.";
    static final String STALE_SEARCH = "This search has expired. Run /filter again.";
    static final String STALE_SOURCE = "This source view has expired. Run /source again.";
    static final String NOT_ALLOWED = "Not allowed.";
    static final String INDEX_UNAVAILABLE = "Full-text index is not available.";
    static final String UNKNOWN = "Unknown command. See /help.";
    static final String FAILED = "Something went wrong, please try again later.";

    static final int MAX_SOURCE_CANDIDATES = 20;

    private final NewsStore store;
    private final SearchService search;
    private final HighlightEngine highlighter;
    private final PageFormatter formatter;
    private final SessionCache searchSessions;
    private final SessionCache sourceSessions;
    private final NewsFinderSettings settings;

    public CommandRouter(NewsStore store, SearchService search, HighlightEngine highlighter,
                         SessionCache searchSessions, SessionCache sourceSessions,
                         NewsFinderSettings settings) {
        this.store = store;
        this.search = search;
        this.highlighter = highlighter;
        this.formatter = new PageFormatter(highlighter);
        this.searchSessions = searchSessions;
        this.sourceSessions = sourceSessions;
        this.settings = settings;
    }

    /**
     * Handles a command message.
     *
     * @param userId sender
     * @param text message text starting with {@code /}
     * @return the reply
     */
    public Reply handle(long userId, String text) {
        String line = text == null ? "" : text.trim();
        if (!line.startsWith("/")) {
            return Reply.text(UNKNOWN);
        }
        int space = indexOfWhitespace(line);
        String command = (space < 0 ? line : line.substring(0, space)).toLowerCase(Locale.ROOT);
        String args = space < 0 ? "" : line.substring(space + 1).trim();
        int at = command.indexOf('@');
        if (at > 0) {
            command = command.substring(0, at);
        }

        try {
            switch (command) {
                case "/start":
                case "/help":
                    return Reply.text(HELP);
                case "/latest":
                    return latestPage(0, settings.latestCount);
                case "/news":
                    return newsItem(parsePosition(args) - 1);
                case "/filter":
                    return filter(args);
                case "/source":
                    return source(args);
                case "/sources":
                    return Reply.text(sources());
                case "/stats":
                    return Reply.text(stats());
                case "/rebuild":
                    return rebuild(userId);
                default:
                    return Reply.text(UNKNOWN);
            }
        } catch (NewsStoreException e) {
            log.error("Command {} from {} failed: {}", command, userId, e.getMessage(), e);
            return Reply.text(FAILED);
        }
    }

    /**
     * Handles a button press.
     *
     * @param userId sender
     * @param data the callback payload
     * @return the reply
     */
    public Reply handleCallback(long userId, String data) {
        Optional<CallbackData> decoded = CallbackData.decode(data == null ? null : data.trim());
        if (!decoded.isPresent()) {
            log.debug("Malformed callback from {}: {}", userId, data);
            return Reply.alert(BAD_CALLBACK);
        }
        CallbackData cb = decoded.get();
        if (cb.close) {
            return Reply.closed();
        }
        try {
            switch (cb.kind) {
                case LATEST_PAGE:
                    return latestPage(cb.offset, cb.limit);
                case NEWS_ITEM:
                    return newsItem(cb.index());
                case SEARCH_PAGE:
                    return searchPage(searchSessions.require(cb.key), cb.key, cb.offset, cb.limit);
                case SOURCE_PAGE:
                    return sourcePage(sourceSessions.require(cb.key), cb.key, cb.offset, cb.limit);
                case SOURCE_ITEM:
                    return sourceItem(sourceSessions.require(cb.key), cb.key, cb.index());
                default:
                    return Reply.alert(BAD_CALLBACK);
            }
        } catch (StaleSessionException e) {
            log.debug("{} (user {})", e.getMessage(), userId);
            return Reply.alert(cb.kind == CallbackData.Kind.SEARCH_PAGE ? STALE_SEARCH : STALE_SOURCE);
        } catch (NewsStoreException e) {
            log.error("Callback {} from {} failed: {}", data, userId, e.getMessage(), e);
            return Reply.alert(FAILED);
        }
    }

    private Reply latestPage(int offset, int limit) {
        long total = store.total();
        List<NewsItem> rows = store.latestPage(offset, limit);
        String text = formatter.page(rows, offset, limit, total, "Latest news");
        return Reply.withKeyboard(text, Keyboard.page(rows, offset, limit, total,
                o -> CallbackData.latestPage(o, limit), CallbackData.Kind.LATEST_PAGE.close()));
    }

    private Reply newsItem(int requested) {
        long total = store.total();
        if (total == 0) {
            return Reply.text(NO_NEWS);
        }
        int idx = clamp(requested, total);
        List<NewsItem> rows = store.latestPage(idx, 1);
        if (rows.isEmpty()) {
            return Reply.text(NO_NEWS);
        }
        NewsItem item = rows.get(0);
        return Reply.withKeyboard(formatter.singleItem(item, idx, total),
                Keyboard.item(item.link, idx, total, CallbackData::newsItem, CallbackData.Kind.NEWS_ITEM.close()));
    }

    private Reply filter(String args) {
        String query = args;
        int page = 1;
        int bar = args.lastIndexOf('|');
        if (bar >= 0) {
            Integer n = parsePositive(args.substring(bar + 1).trim());
            if (n != null) {
                page = n;
                query = args.substring(0, bar);
            }
        }
        query = query.trim();
        if (query.isEmpty() || !NewsQueryParser.parse(query).isPresent()) {
            return Reply.text(EMPTY_QUERY);
        }
        String key = searchSessions.put(query);
        int limit = settings.searchPageSize;
        return searchPage(query, key, pageOffset(page, limit), limit);
    }

    private Reply searchPage(String query, String key, int offset, int limit) {
        SearchResult result = search.search(query, limit, offset);
        List<String> patterns = highlighter.extractPatterns(query);
        String header = "Search: " + TextCleaner.escape(query);
        String text = formatter.searchPage(result.rows, offset, limit, result.total, header, patterns);
        return Reply.withKeyboard(text, Keyboard.page(result.rows, offset, limit, result.total,
                o -> CallbackData.searchPage(key, o, limit), CallbackData.Kind.SEARCH_PAGE.close()));
    }

    private Reply source(String args) {
        if (args.isEmpty()) {
            return Reply.text("Usage: /source <name> [N]");
        }
        String name = args;
        Integer position = null;
        int space = args.lastIndexOf(' ');
        if (space > 0) {
            position = parsePositive(args.substring(space + 1).trim());
            if (position != null) {
                name = args.substring(0, space).trim();
            }
        }

        List<SourceCount> counts = store.countBySource();
        List<SourceCount> candidates = resolveSource(counts, name);
        if (candidates.isEmpty()) {
            return Reply.text("Source not found: " + TextCleaner.escape(name));
        }
        if (candidates.size() > 1) {
            StringBuilder sb = new StringBuilder("Several sources match:\n");
            for (int i = 0; i < candidates.size() && i < MAX_SOURCE_CANDIDATES; i++) {
                SourceCount c = candidates.get(i);
                sb.append("• ").append(TextCleaner.escape(c.source)).append(" (").append(c.count).append(")\n");
            }
            if (candidates.size() > MAX_SOURCE_CANDIDATES) {
                sb.append("…and ").append(candidates.size() - MAX_SOURCE_CANDIDATES).append(" more\n");
            }
            return Reply.text(sb.toString().trim());
        }

        String resolved = candidates.get(0).source;
        String key = sourceSessions.put(resolved);
        if (position == null) {
            return sourcePage(resolved, key, 0, settings.pageSize);
        }
        return sourceItem(resolved, key, position - 1);
    }

    /**
     * Exact case-insensitive match first, otherwise every source containing the name.
     */
    static List<SourceCount> resolveSource(List<SourceCount> counts, String name) {
        String needle = name.toLowerCase(Locale.ROOT);
        List<SourceCount> partial = new ArrayList<>();
        for (SourceCount c : counts) {
            String candidate = c.source.toLowerCase(Locale.ROOT);
            if (candidate.equals(needle)) {
                List<SourceCount> exact = new ArrayList<>();
                exact.add(c);
                return exact;
            }
            if (candidate.contains(needle)) {
                partial.add(c);
            }
        }
        return partial;
    }

    private Reply sourcePage(String source, String key, int offset, int limit) {
        long total = store.totalBySource(source);
        List<NewsItem> rows = store.sourceNews(source, limit, offset);
        String text = formatter.page(rows, offset, limit, total, TextCleaner.escape(source));
        return Reply.withKeyboard(text, Keyboard.page(rows, offset, limit, total,
                o -> CallbackData.sourcePage(key, o, limit), CallbackData.Kind.SOURCE_PAGE.close()));
    }

    private Reply sourceItem(String source, String key, int requested) {
        long total = store.totalBySource(source);
        if (total == 0) {
            return Reply.text("No news from " + TextCleaner.escape(source) + ".");
        }
        int idx = clamp(requested, total);
        List<NewsItem> rows = store.sourceNews(source, 1, idx);
        if (rows.isEmpty()) {
            return Reply.text("No news from " + TextCleaner.escape(source) + ".");
        }
        NewsItem item = rows.get(0);
        return Reply.withKeyboard(formatter.sourceItem(item, idx, total, source),
                Keyboard.item(item.link, idx, total, i -> CallbackData.sourceItem(key, i),
                        CallbackData.Kind.SOURCE_ITEM.close()));
    }

    private String sources() {
        List<SourceCount> counts = store.countBySource();
        if (counts.isEmpty()) {
            return NO_NEWS;
        }
        StringBuilder sb = new StringBuilder("Sources:\n");
        for (SourceCount c : counts) {
            sb.append("• ").append(TextCleaner.escape(c.source)).append(" (").append(c.count).append(")\n");
        }
        return sb.toString().trim();
    }

    private String stats() {
        List<SourceCount> counts = store.countBySource();
        StringBuilder sb = new StringBuilder();
        sb.append("Total news: ").append(store.total()).append('\n');
        sb.append("Sources: ").append(counts.size()).append('\n');
        sb.append("Full-text index: ").append(store.isFullTextAvailable() ? "on" : "off").append('\n');
        sb.append("Active searches: ").append(searchSessions.size()).append('\n');
        sb.append("Active source views: ").append(sourceSessions.size());
        return sb.toString();
    }

    private Reply rebuild(long userId) {
        if (settings.adminUserId == 0 || userId != settings.adminUserId) {
            log.warn("User {} attempted /rebuild", userId);
            return Reply.text(NOT_ALLOWED);
        }
        Optional<IndexRebuilder> rebuilder = store.rebuilder();
        if (!rebuilder.isPresent()) {
            return Reply.text(INDEX_UNAVAILABLE);
        }
        try {
            IndexRebuilder.RebuildMode mode = rebuilder.get().rebuild();
            return Reply.text("Index rebuilt (" + mode.name().toLowerCase(Locale.ROOT) + ").");
        } catch (IndexRebuildException e) {
            log.error("Index rebuild failed: {}", e.getMessage(), e);
            return Reply.text("Index rebuild failed: " + e.getMessage());
        }
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }

    /** 1-based position, defaulting to 1 when absent or malformed. */
    private static int parsePosition(String args) {
        Integer n = parsePositive(args.trim());
        return n == null ? 1 : n;
    }

    private static Integer parsePositive(String s) {
        if (s.isEmpty()) return null;
        try {
            int n = Integer.parseInt(s);
            return n > 0 ? n : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Offset of a 1-based page, kept in int range so row numbers never wrap. */
    static int pageOffset(int page, int limit) {
        long offset = (long) (page - 1) * limit;
        return (int) Math.min(offset, (long) Integer.MAX_VALUE - limit);
    }

    private static int clamp(int idx, long total) {
        return (int) Math.max(0, Math.min(idx, total - 1));
    }
}
