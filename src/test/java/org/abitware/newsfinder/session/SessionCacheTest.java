package org.abitware.newsfinder.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

class SessionCacheTest {

    private final AtomicLong nanos = new AtomicLong();

    private SessionCache cache(long maxEntries, Duration ttl) {
        return new SessionCache("search", maxEntries, ttl, nanos::get);
    }

    private void advance(long minutes) {
        nanos.addAndGet(TimeUnit.MINUTES.toNanos(minutes));
    }

    @Test
    void roundTripPreservesCase() throws Exception {
        SessionCache c = cache(100, Duration.ofMinutes(10));
        String key = c.put("Meduza");
        assertThat(key).isEqualTo("b10e7386");
        assertThat(c.get(key)).contains("Meduza");
        assertThat(c.require(key)).isEqualTo("Meduza");
    }

    @Test
    void collidingPayloadsShareKeyAndLaterWins() {
        SessionCache c = cache(100, Duration.ofMinutes(10));
        String first = c.put("query 17972");
        String second = c.put("query 78134");
        assertThat(first).isEqualTo("e26a3cd8").isEqualTo(second);
        assertThat(c.get(first)).contains("query 78134");
        assertThat(c.size()).isEqualTo(1);
    }

    @Test
    void entriesExpireAfterIdleTtl() {
        SessionCache c = cache(100, Duration.ofMinutes(10));
        String key = c.put("танк");
        advance(6);
        assertThat(c.get(key)).isPresent();
        advance(6);
        // the read above restarted the idle clock
        assertThat(c.get(key)).isPresent();
        advance(11);
        assertThat(c.get(key)).isEmpty();
    }

    @Test
    void sizeIsBounded() {
        SessionCache c = cache(2, Duration.ofMinutes(10));
        c.put("a");
        c.put("b");
        c.put("c");
        assertThat(c.size()).isEqualTo(2);
    }

    @Test
    void concurrentPutsKeepEveryPayload() throws Exception {
        SessionCache c = new SessionCache("search", 10_000, Duration.ofMinutes(10));
        int threads = 8;
        int perThread = 250;
        Map<String, String> issued = new ConcurrentHashMap<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int base = t * perThread;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = base; i < base + perThread; i++) {
                        String payload = "payload " + i;
                        String key = c.put(payload);
                        issued.put(key, payload);
                        assertThat(c.get(key)).contains(payload);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(issued).hasSize(threads * perThread);
        assertThat(c.size()).isEqualTo(threads * perThread);
        for (Map.Entry<String, String> e : issued.entrySet()) {
            assertThat(c.get(e.getKey())).contains(e.getValue());
        }
    }

    @Test
    void unknownKeyIsStale() {
        SessionCache c = cache(100, Duration.ofMinutes(10));
        assertThat(c.get("deadbeef")).isEmpty();
        assertThat(c.get(null)).isEmpty();
        assertThatThrownBy(() -> c.require("deadbeef"))
                .isInstanceOf(StaleSessionException.class)
                .hasMessageContaining("search")
                .satisfies(e -> assertThat(((StaleSessionException) e).getKey()).isEqualTo("deadbeef"));
    }
}
