package com.transitlog.backend.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySharedCacheTest {

    private MutableClock clock;
    private InMemorySharedCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-15T08:00:00Z"));
        cache = new InMemorySharedCache(clock);
    }

    @Test
    void testGet_BeforeExpiry_ReturnsValue() {
        cache.put("key", "value", Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(59));

        assertEquals(Optional.of("value"), cache.get("key"));
    }

    @Test
    void testGet_AfterExpiry_ReturnsEmpty() {
        cache.put("key", "value", Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(60));

        assertEquals(Optional.empty(), cache.get("key"));
    }

    @Test
    void testPut_LastWriteWins() {
        cache.put("key", "first", Duration.ofSeconds(60));
        cache.put("key", "second", Duration.ofSeconds(60));

        assertEquals(Optional.of("second"), cache.get("key"));
    }

    @Test
    void testEvict_RemovesEntry() {
        cache.put("key", "value", Duration.ofSeconds(60));
        cache.evict("key");

        assertTrue(cache.get("key").isEmpty());
    }

    @Test
    void testPut_SweepsExpiredEntries() {
        // Given
        for (int i = 0; i < 100; i++) {
            cache.put("schedule-" + i, "zip", Duration.ofSeconds(1));
        }
        assertEquals(100, cache.size());

        // When
        clock.advance(Duration.ofHours(1));
        cache.put("fresh", "value", Duration.ofSeconds(60));

        // Then
        assertEquals(1, cache.size());
        assertEquals(Optional.of("value"), cache.get("fresh"));
    }

    @Test
    void testPut_KeepsLiveEntries() {
        cache.put("long", "kept", Duration.ofDays(7));
        cache.put("short", "gone", Duration.ofSeconds(1));
        clock.advance(Duration.ofMinutes(5));

        cache.put("other", "value", Duration.ofSeconds(60));

        assertEquals(2, cache.size());
        assertEquals(Optional.of("kept"), cache.get("long"));
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
