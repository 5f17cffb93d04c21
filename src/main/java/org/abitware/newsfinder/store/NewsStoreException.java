package org.abitware.newsfinder.store;

/** Storage I/O failure. */
public class NewsStoreException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public NewsStoreException(String message) {
        super(message);
    }

    public NewsStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
