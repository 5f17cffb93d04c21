package org.abitware.newsfinder.store;

/** The store was opened without a full-text index. */
public class IndexUnavailableException extends NewsStoreException {
    private static final long serialVersionUID = 1L;

    public IndexUnavailableException(String message) {
        super(message);
    }
}
