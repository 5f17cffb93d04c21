package org.abitware.newsfinder.session;

/** A pagination key is not (or no longer) known. The user has to start over. */
public class StaleSessionException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String key;

    public StaleSessionException(String cacheName, String key) {
        super("Unknown " + cacheName + " session: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
