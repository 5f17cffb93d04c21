package org.abitware.newsfinder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.abitware.newsfinder.command.CommandRouter;
import org.abitware.newsfinder.command.Reply;
import org.abitware.newsfinder.config.ConfigManager;
import org.abitware.newsfinder.config.NewsFinderSettings;
import org.abitware.newsfinder.highlight.HighlightEngine;
import org.abitware.newsfinder.news.NewsItem;
import org.abitware.newsfinder.search.SearchEngine;
import org.abitware.newsfinder.session.SessionCache;
import org.abitware.newsfinder.store.LuceneNewsStore;
import org.abitware.newsfinder.store.NewsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final String IMPORT = ":import";
    static final String QUIT = ":quit";

    public static void main(String[] args) throws IOException {
        // optional argument: path of an override config file
        ConfigManager config = args.length > 0 ? new ConfigManager(Paths.get(args[0])) : new ConfigManager();
        NewsFinderSettings settings = config.load();

        LuceneNewsStore store = LuceneNewsStore.open(settings.indexDir, settings.fullText);
        Runtime.getRuntime().addShutdownHook(new Thread(store::close));

        CommandRouter router = createRouter(store, settings);
        // the console user acts as the configured admin
        long userId = settings.adminUserId != 0 ? settings.adminUserId : 1L;

        log.info("NewsFinder started: index={}, fullText={}, items={}", settings.indexDir, settings.fullText, store.total());
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintStream out = System.out;
        out.println("Type /help for commands, :import <file.tsv> to load news, :quit to exit.");
        String line;
        while ((line = in.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) continue;
            if (QUIT.equals(line)) break;
            if (line.startsWith(IMPORT)) {
                importFile(store, line.substring(IMPORT.length()).trim(), out);
                continue;
            }
            Reply reply = line.startsWith("/") ? router.handle(userId, line) : router.handleCallback(userId, line);
            print(reply, out);
        }
    }

    static CommandRouter createRouter(NewsStore store, NewsFinderSettings settings) {
        Duration ttl = Duration.ofMinutes(settings.sessionTtlMinutes);
        SessionCache searchSessions = new SessionCache("search", settings.sessionMaxEntries, ttl);
        SessionCache sourceSessions = new SessionCache("source", settings.sessionMaxEntries, ttl);
        return new CommandRouter(store, new SearchEngine(store), new HighlightEngine(),
                searchSessions, sourceSessions, settings);
    }

    private static void importFile(NewsStore store, String file, PrintStream out) {
        if (file.isEmpty()) {
            out.println("Usage: " + IMPORT + " <file.tsv>");
            return;
        }
        try {
            List<NewsItem> items = parseTsv(Files.readAllLines(Paths.get(file), StandardCharsets.UTF_8));
            int inserted = store.insertMany(items);
            out.println("Imported " + inserted + " of " + items.size() + " items.");
        } catch (IOException e) {
            log.warn("Could not import {}: {}", file, e.getMessage());
            out.println("Could not read " + file + ": " + e.getMessage());
        }
    }

    /**
     * Parses {@code source, title, link, published, summary} tab-separated lines.
     * Lines with fewer than three fields or starting with {@code #} are skipped.
     */
    static List<NewsItem> parseTsv(List<String> lines) {
        List<NewsItem> items = new ArrayList<>();
        for (String l : lines) {
            if (l.trim().isEmpty() || l.startsWith("#")) continue;
            String[] f = l.split("\t", -1);
            if (f.length < 3 || f[0].trim().isEmpty() || f[1].trim().isEmpty()) {
                log.debug("Skipping malformed import line: {}", l);
                continue;
            }
            String published = f.length > 3 ? emptyToNull(f[3]) : null;
            String summary = f.length > 4 ? emptyToNull(f[4]) : null;
            items.add(new NewsItem(f[0].trim(), f[1].trim(), f[2].trim(), published, summary));
        }
        return items;
    }

    private static String emptyToNull(String s) {
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static void print(Reply reply, PrintStream out) {
        if (reply.removeKeyboard) {
            out.println("(closed)");
            return;
        }
        out.println(reply.alert ? "[!] " + reply.text : reply.text);
        reply.keyboard().ifPresent(kb -> out.print(kb));
        out.println();
    }
}
