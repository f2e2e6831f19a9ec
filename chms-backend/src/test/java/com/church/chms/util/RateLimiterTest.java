package com.church.chms.util;

import com.church.chms.config.ChmsProperties;
import com.church.chms.exception.RateLimitExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        rateLimiter = new RateLimiter(clock, new ChmsProperties());
    }

    // 默认 5 次 / 300 秒
    @Test
    void testCheck_BlocksAfterMaxAttempts() {
        for (int i = 0; i < 5; i++) {
            assertTrue(rateLimiter.check("login:ama"));
        }
        assertFalse(rateLimiter.check("login:ama"));
        assertEquals(0, rateLimiter.getRemaining("login:ama"));
        assertTrue(rateLimiter.check("login:kofi"));
    }

    // 令牌在窗口结束时整体补满
    @Test
    void testCheck_RefillsAfterWindow() {
        rateLimiter.check("k", 2, 60);
        clock.advance(Duration.ofSeconds(30));
        rateLimiter.check("k", 2, 60);
        assertFalse(rateLimiter.check("k", 2, 60));
        assertEquals(30, rateLimiter.retryAfterSeconds("k", 60));

        clock.advance(Duration.ofSeconds(31));
        assertTrue(rateLimiter.check("k", 2, 60));
        assertEquals(1, rateLimiter.getRemaining("k", 2, 60));
    }

    @Test
    void testGetResetTime() {
        assertEquals(0, rateLimiter.getResetTime("nobody"));

        rateLimiter.check("k");
        long start = clock.instant().getEpochSecond();
        assertEquals(start + 300, rateLimiter.getResetTime("k"));

        clock.advance(Duration.ofSeconds(300));
        assertEquals(0, rateLimiter.getResetTime("k"));
    }

    @Test
    void testClear() {
        rateLimiter.check("k", 1, 60);
        assertFalse(rateLimiter.check("k", 1, 60));

        rateLimiter.clear("k");

        assertTrue(rateLimiter.check("k", 1, 60));
    }

    @Test
    void testEnforce_ThrowsWithMinutes() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.enforce("ip:10.0.0.1");
        }
        clock.advance(Duration.ofSeconds(100));

        RateLimitExceededException ex = assertThrows(RateLimitExceededException.class,
                () -> rateLimiter.enforce("ip:10.0.0.1"));
        assertEquals("Too many requests. Please try again in 4 minute(s).", ex.getMessage());
        assertEquals(200, ex.getRetryAfterSeconds());
    }

    @Test
    void testCleanup_RemovesIdleIdentifiers() {
        rateLimiter.check("old");
        clock.advance(Duration.ofHours(2));
        rateLimiter.check("recent");

        int removed = rateLimiter.cleanup(3600);

        assertEquals(1, removed);
        assertEquals(1, rateLimiter.trackedIdentifiers());
        assertEquals(5, rateLimiter.getRemaining("old"));
        assertEquals(4, rateLimiter.getRemaining("recent"));
    }

    // 不同的限额各自使用独立的桶配置
    @Test
    void testCheck_LimitsChangePerCall() {
        assertTrue(rateLimiter.check("k", 1, 60));
        assertFalse(rateLimiter.check("k", 1, 60));

        assertTrue(rateLimiter.check("k", 3, 60));
        assertEquals(2, rateLimiter.getRemaining("k", 3, 60));
    }

    static class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
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
