package org.abitware.newsfinder.search.query;

/** Both executable forms of one query; built per search call and then dropped. */
public final class CompiledQuery {
    public final String indexMatchExpression;
    public final FallbackPredicate fallbackPredicate;

    CompiledQuery(String indexMatchExpression, FallbackPredicate fallbackPredicate) {
        this.indexMatchExpression = indexMatchExpression;
        this.fallbackPredicate = fallbackPredicate;
    }
}
