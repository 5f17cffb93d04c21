package org.abitware.newsfinder.store;

/** Both the in-place and the full index rebuild failed. Searching is unaffected. */
public class IndexRebuildException extends NewsStoreException {
    private static final long serialVersionUID = 1L;

    public IndexRebuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
