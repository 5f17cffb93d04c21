package org.abitware.newsfinder.store;

/** Optional store capability: rebuild the full-text index from stored documents. */
public interface IndexRebuilder {

    enum RebuildMode {
        /** Documents were re-indexed in place */
        SOFT,
        /** Index dropped, recreated and back-filled */
        FULL
    }

    /**
     * Rebuilds the index, falling back to a full drop-and-recreate when the
     * in-place pass fails.
     *
     * @return how the rebuild was performed
     * @throws IndexRebuildException if both passes fail
     */
    RebuildMode rebuild();
}
