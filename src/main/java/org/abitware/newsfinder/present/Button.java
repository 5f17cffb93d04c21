package org.abitware.newsfinder.present;

/** A keyboard button: either opens a URL or sends a callback payload. */
public class Button {
    public final String label;
    public final String url;
    public final String callbackData;

    private Button(String label, String url, String callbackData) {
        this.label = label;
        this.url = url;
        this.callbackData = callbackData;
    }

    public static Button link(String label, String url) {
        return new Button(label, url, null);
    }

    public static Button callback(String label, String data) {
        return new Button(label, null, data);
    }

    public boolean isLink() {
        return url != null;
    }

    @Override
    public String toString() {
        return "[" + label + " -> " + (isLink() ? url : callbackData) + "]";
    }
}
