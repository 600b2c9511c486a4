package dev.aparikh.torrentsearch.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedExpiringCacheTest {

    private MutableClock clock;
    private BoundedExpiringCache<String, Long> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T10:00:00Z"));
        cache = new BoundedExpiringCache<>(3, Duration.ofSeconds(60), clock);
    }

    @Test
    void returnsStoredValue() {
        cache.put("a", 1L);

        assertThat(cache.get("a")).contains(1L);
        assertThat(cache.get("missing")).isEmpty();
    }

    @Test
    void entryExpiresExactlyAtItsTtl() {
        cache.put("a", 1L);

        clock.advance(Duration.ofSeconds(59));
        assertThat(cache.get("a")).contains(1L);

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void readDoesNotExtendExpiry() {
        cache.put("a", 1L);
        clock.advance(Duration.ofSeconds(30));
        assertThat(cache.get("a")).isPresent();

        clock.advance(Duration.ofSeconds(30));
        assertThat(cache.get("a")).isEmpty();
    }

    @Test
    void perEntryTtlOverridesDefault() {
        cache.put("short", 1L, Duration.ofSeconds(5));
        cache.put("fallback", 2L, Duration.ZERO);

        clock.advance(Duration.ofSeconds(5));

        assertThat(cache.get("short")).isEmpty();
        assertThat(cache.get("fallback")).contains(2L);
    }

    @Test
    void evictsLeastRecentlyUsedWhenFull() {
        cache.put("a", 1L);
        clock.advance(Duration.ofSeconds(1));
        cache.put("b", 2L);
        clock.advance(Duration.ofSeconds(1));
        cache.put("c", 3L);
        clock.advance(Duration.ofSeconds(1));

        cache.get("a");
        cache.put("d", 4L);

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).contains(1L);
        assertThat(cache.get("c")).contains(3L);
        assertThat(cache.get("d")).contains(4L);
    }

    @Test
    void evictionOrderHoldsWithinOneClockTick() {
        cache.put("a", 1L);
        cache.put("b", 2L);
        cache.put("c", 3L);
        cache.get("a");

        cache.put("d", 4L);

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).isPresent();
    }

    @Test
    void overwritingKeyDoesNotEvict() {
        cache.put("a", 1L);
        cache.put("b", 2L);
        cache.put("c", 3L);

        cache.put("a", 10L);

        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.get("a")).contains(10L);
        assertThat(cache.get("b")).contains(2L);
    }

    @Test
    void overwriteResetsExpiry() {
        cache.put("a", 1L);
        clock.advance(Duration.ofSeconds(50));
        cache.put("a", 2L);
        clock.advance(Duration.ofSeconds(50));

        assertThat(cache.get("a")).contains(2L);
    }

    @Test
    void ignoresNullKeysAndValues() {
        cache.put(null, 1L);
        cache.put("a", null);

        assertThat(cache.size()).isZero();
        assertThat(cache.get(null)).isEmpty();
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new BoundedExpiringCache<String, Long>(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BoundedExpiringCache<String, Long>(1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void neverExceedsCapacityUnderConcurrentWrites() throws Exception {
        BoundedExpiringCache<String, Long> shared = new BoundedExpiringCache<>(16, Duration.ofMinutes(1));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            int thread = t;
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    shared.put(thread + "-" + i, (long) i);
                    shared.get(thread + "-" + (i / 2));
                    assertThat(shared.size()).isLessThanOrEqualTo(16);
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(shared.size()).isEqualTo(16);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
