package org.abitware.newsfinder.search.query;

import java.util.Collections;
import java.util.List;

/** Terms a document must contain (positives) and must not contain (negatives). */
public final class TermSplit {
    public final List<QueryNode.Term> positives;
    public final List<QueryNode.Term> negatives;

    TermSplit(List<QueryNode.Term> positives, List<QueryNode.Term> negatives) {
        this.positives = Collections.unmodifiableList(positives);
        this.negatives = Collections.unmodifiableList(negatives);
    }

    /** Only exclusions, nothing to look up in the index. */
    public boolean isNegativeOnly() {
        return positives.isEmpty() && !negatives.isEmpty();
    }

    public boolean isEmpty() {
        return positives.isEmpty() && negatives.isEmpty();
    }
}
