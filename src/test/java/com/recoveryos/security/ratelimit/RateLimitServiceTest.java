package com.recoveryos.security.ratelimit;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimitServiceTest {

    private static final long T0 = TimeUnit.SECONDS.toNanos(1_000);
    private static final Duration WINDOW = Duration.ofSeconds(10);

    @Test
    void admitsCapacityWithinWindowAndRejectsTheNext() {
        RateLimitService service = new RateLimitService();

        for (int i = 0; i < 5; i++) {
            assertTrue(service.admit("client", T0 + seconds(i), 5, WINDOW), "request " + i);
        }
        assertFalse(service.admit("client", T0 + seconds(9), 5, WINDOW));
    }

    @Test
    void admitsAgainOnceEarliestEntryLeavesWindow() {
        RateLimitService service = new RateLimitService();
        for (int i = 0; i < 5; i++) {
            service.admit("client", T0 + seconds(i), 5, WINDOW);
        }

        assertFalse(service.admit("client", T0 + seconds(10) - 1, 5, WINDOW));
        assertTrue(service.admit("client", T0 + seconds(10), 5, WINDOW));
        assertFalse(service.admit("client", T0 + seconds(10), 5, WINDOW));
    }

    @Test
    void entryExactlyOneWindowOldIsExpired() {
        RateLimitService service = new RateLimitService();

        assertTrue(service.admit("client", T0, 1, WINDOW));
        assertFalse(service.admit("client", T0 + WINDOW.toNanos() - 1, 1, WINDOW));
        assertTrue(service.admit("client", T0 + WINDOW.toNanos(), 1, WINDOW));
    }

    @Test
    void rejectionDoesNotConsumeCapacity() {
        RateLimitService service = new RateLimitService();
        service.admit("client", T0, 1, WINDOW);
        for (int i = 1; i < 9; i++) {
            assertFalse(service.admit("client", T0 + seconds(i), 1, WINDOW));
        }

        assertTrue(service.admit("client", T0 + seconds(10), 1, WINDOW));
    }

    @Test
    void keysAreIndependent() {
        RateLimitService service = new RateLimitService();

        assertTrue(service.admit("a", T0, 1, WINDOW));
        assertFalse(service.admit("a", T0, 1, WINDOW));
        assertTrue(service.admit("b", T0, 1, WINDOW));
    }

    @Test
    void retryAfterPointsAtOldestEntryExpiry() {
        RateLimitService service = new RateLimitService();
        service.decide("client", T0, 1, WINDOW);

        RateLimitDecision blocked = service.decide("client", T0 + seconds(3), 1, WINDOW);
        assertFalse(blocked.allowed());
        assertEquals(7, blocked.retryAfterSeconds());

        RateLimitDecision almost = service.decide("client", T0 + seconds(10) - 1, 1, WINDOW);
        assertEquals(1, almost.retryAfterSeconds());
    }

    @Test
    void invalidLimitsAreProgrammingErrors() {
        RateLimitService service = new RateLimitService();

        assertThrows(IllegalArgumentException.class, () -> service.admit("client", T0, 0, WINDOW));
        assertThrows(IllegalArgumentException.class, () -> service.admit("client", T0, 1, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> service.admit("client", T0, 1, Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> service.admit(null, T0, 1, WINDOW));
    }

    @Test
    void concurrentRequestsForOneKeyNeverExceedCapacity() throws Exception {
        RateLimitService service = new RateLimitService();
        int threads = 64;
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return service.admit("burst", T0, 10, WINDOW);
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertEquals(10, admitted);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void checkReadsTickerAndRule() {
        FakeTicker ticker = new FakeTicker();
        RateLimitService service = new RateLimitService(ticker, Duration.ZERO);
        RateLimitProperties.Rule rule = baseRule();
        rule.setMaxRequests(2);
        rule.setWindowSeconds(10);

        assertTrue(service.check(rule, "fp").allowed());
        assertTrue(service.check(rule, "fp").allowed());
        assertFalse(service.check(rule, "fp").allowed());

        ticker.advance(Duration.ofSeconds(10));
        assertTrue(service.check(rule, "fp").allowed());
    }

    @Test
    void rulesWithDifferentKeysDoNotShareWindows() {
        RateLimitService service = new RateLimitService(new FakeTicker(), Duration.ZERO);
        RateLimitProperties.Rule checkin = baseRule();
        checkin.setMaxRequests(1);
        RateLimitProperties.Rule consent = baseRule();
        consent.setPath("/consents");
        consent.setMaxRequests(1);

        assertTrue(service.check(checkin, "fp").allowed());
        assertTrue(service.check(consent, "fp").allowed());
        assertFalse(service.check(checkin, "fp").allowed());
    }

    @Test
    void idleWindowsAreEvictedWhenConfigured() {
        FakeTicker ticker = new FakeTicker();
        RateLimitService service = new RateLimitService(ticker, Duration.ofSeconds(30));
        RateLimitProperties.Rule rule = baseRule();
        rule.setWindowSeconds(10);
        service.check(rule, "fp");
        assertEquals(1, service.trackedKeys());

        ticker.advance(Duration.ofSeconds(31));
        assertEquals(0, service.trackedKeys());
    }

    @Test
    void idleEvictionWaitsForLongerWindowOfDirectCaller() {
        FakeTicker ticker = new FakeTicker();
        RateLimitService service = new RateLimitService(ticker, Duration.ofSeconds(30));
        Duration window = Duration.ofSeconds(120);
        assertTrue(service.admit("k", ticker.read(), 1, window));

        ticker.advance(Duration.ofSeconds(31));
        assertEquals(1, service.trackedKeys());
        assertFalse(service.admit("k", ticker.read(), 1, window));

        ticker.advance(Duration.ofSeconds(121));
        assertEquals(0, service.trackedKeys());
    }

    @Test
    void idleWindowsAreKeptByDefault() {
        FakeTicker ticker = new FakeTicker();
        RateLimitService service = new RateLimitService(ticker, Duration.ZERO);
        service.check(baseRule(), "fp");

        ticker.advance(Duration.ofDays(1));
        assertEquals(1, service.trackedKeys());
    }

    private static long seconds(long value) {
        return TimeUnit.SECONDS.toNanos(value);
    }

    private static RateLimitProperties.Rule baseRule() {
        RateLimitProperties.Rule rule = new RateLimitProperties.Rule();
        rule.setPath("/check-in");
        return rule;
    }

    private static final class FakeTicker implements Ticker {
        private final AtomicLong nanos = new AtomicLong(T0);

        @Override
        public long read() {
            return nanos.get();
        }

        private void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }
    }
}
