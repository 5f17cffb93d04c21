package org.abitware.newsfinder.search;

/** Which execution path produced a result. */
public enum SearchPath {
    /** Nothing executed: blank or empty query */
    NONE,
    /** Native full-text index */
    INDEX,
    /** Substring scan over the whole collection */
    FALLBACK
}
