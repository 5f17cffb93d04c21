package org.abitware.newsfinder.session;

import java.time.Duration;
import java.util.Optional;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps short keys to the payload (query text or source name) a paginated
 * listing was started with, so follow-up page requests only carry the key.
 *
 * <p>Bounded in size and expiring after a period without access. Keys are
 * 32-bit fingerprints: when two payloads share a key the later {@link #put}
 * wins and the earlier session pages through the newer payload.
 */
public class SessionCache {

    private static final Logger log = LoggerFactory.getLogger(SessionCache.class);

    private final String name;
    private final Cache<String, String> entries;

    public SessionCache(String name, long maxEntries, Duration ttl) {
        this(name, maxEntries, ttl, Ticker.systemTicker());
    }

    SessionCache(String name, long maxEntries, Duration ttl, Ticker ticker) {
        this.name = name;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterAccess(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Registers a payload and returns its key.
     *
     * @param payload query text or source name, case preserved
     * @return the fingerprint key
     */
    public String put(String payload) {
        String key = SessionKeys.fingerprint(payload);
        String previous = entries.asMap().put(key, payload);
        if (previous != null && !SessionKeys.normalize(previous).equals(SessionKeys.normalize(payload))) {
            log.warn("{} session key {} reassigned from '{}' to '{}'", name, key, previous, payload);
        }
        return key;
    }

    public Optional<String> get(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    /**
     * Looks a key up, failing with a distinct condition when it is unknown.
     *
     * @param key the session key
     * @return the payload
     * @throws StaleSessionException if the key is not present
     */
    public String require(String key) throws StaleSessionException {
        Optional<String> payload = get(key);
        if (!payload.isPresent()) {
            throw new StaleSessionException(name, key);
        }
        return payload.get();
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }
}
