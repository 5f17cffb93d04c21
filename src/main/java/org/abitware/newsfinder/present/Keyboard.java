package org.abitware.newsfinder.present;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;

import org.abitware.newsfinder.news.NewsItem;

/**
 * Rows of buttons attached to a reply. Navigation buttons are derived only
 * from offset, limit and total.
 */
public class Keyboard {

    static final int LINKS_PER_ROW = 5;

    static final String PREV = "« Prev";
    static final String NEXT = "Next »";
    static final String FIRST = "⏮";
    static final String BACK = "◀";
    static final String FORWARD = "▶";
    static final String LAST = "⏭";
    static final String CLOSE = "✖ Close";
    static final String OPEN = "🔗 Open";

    public final List<List<Button>> rows;

    public Keyboard(List<List<Button>> rows) {
        List<List<Button>> copy = new ArrayList<>(rows.size());
        for (List<Button> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /**
     * Keyboard for a listing page: one numbered link per row, previous/next, close.
     *
     * @param items rows shown on the page
     * @param offset offset of the first row
     * @param limit page size
     * @param total matches on all pages
     * @param pageCallback payload for the page starting at a given offset
     * @param closeCallback payload of the close button
     */
    public static Keyboard page(List<NewsItem> items, int offset, int limit, long total,
                                IntFunction<String> pageCallback, String closeCallback) {
        List<List<Button>> rows = new ArrayList<>();
        List<Button> links = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            links.add(Button.link("🔗 " + (offset + i + 1), items.get(i).link));
            if (links.size() == LINKS_PER_ROW) {
                rows.add(links);
                links = new ArrayList<>();
            }
        }
        if (!links.isEmpty()) rows.add(links);

        List<Button> nav = new ArrayList<>();
        if (offset > 0) {
            nav.add(Button.callback(PREV, pageCallback.apply(Math.max(0, offset - limit))));
        }
        if ((long) offset + limit < total) {
            nav.add(Button.callback(NEXT, pageCallback.apply(offset + limit)));
        }
        if (!nav.isEmpty()) rows.add(nav);

        rows.add(Collections.singletonList(Button.callback(CLOSE, closeCallback)));
        return new Keyboard(rows);
    }

    /**
     * Keyboard for a single item: open link, first/previous/next/last, close.
     *
     * @param link the item link
     * @param idx zero-based position of the item
     * @param total number of items
     * @param itemCallback payload for the item at a given position
     * @param closeCallback payload of the close button
     */
    public static Keyboard item(String link, int idx, long total,
                                IntFunction<String> itemCallback, String closeCallback) {
        List<List<Button>> rows = new ArrayList<>();
        if (link != null && !link.isEmpty()) {
            rows.add(Collections.singletonList(Button.link(OPEN, link)));
        }
        List<Button> nav = new ArrayList<>();
        if (idx > 0) {
            nav.add(Button.callback(FIRST, itemCallback.apply(0)));
            nav.add(Button.callback(BACK, itemCallback.apply(idx - 1)));
        }
        if (idx + 1 < total) {
            nav.add(Button.callback(FORWARD, itemCallback.apply(idx + 1)));
            nav.add(Button.callback(LAST, itemCallback.apply((int) (total - 1))));
        }
        if (!nav.isEmpty()) rows.add(nav);

        rows.add(Collections.singletonList(Button.callback(CLOSE, closeCallback)));
        return new Keyboard(rows);
    }

    /** Every callback payload on the keyboard, in row order. */
    public List<String> callbacks() {
        List<String> out = new ArrayList<>();
        for (List<Button> row : rows) {
            for (Button b : row) {
                if (!b.isLink()) out.add(b.callbackData);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (List<Button> row : rows) {
            for (Button b : row) {
                sb.append(b).append(' ');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
