package com.recoveryos.security.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Sliding-window log limiter. Each key owns an ordered log of admission times
 * (ticker nanoseconds); a request is admitted while fewer than {@code capacity}
 * entries fall inside {@code (now - window, now]}.
 * <p>
 * Prune, capacity check and append run inside one {@code compute} on the
 * backing map, so they are atomic per key and never serialize unrelated keys.
 */
public class RateLimitService {

    private final Ticker ticker;
    private final Cache<String, RateWindow> windows;

    public RateLimitService() {
        this(Ticker.systemTicker(), Duration.ZERO);
    }

    public RateLimitService(Ticker ticker, Duration idleEviction) {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        if (idleEviction != null && !idleEviction.isZero() && !idleEviction.isNegative()) {
            this.windows = Caffeine.newBuilder()
                    .ticker(ticker)
                    .expireAfter(new RateWindowExpiry(idleEviction.toNanos()))
                    .build();
        } else {
            this.windows = Caffeine.newBuilder().ticker(ticker).build();
        }
    }

    public RateLimitDecision check(RateLimitProperties.Rule rule, String clientKey) {
        Objects.requireNonNull(rule, "rule");
        return decide(windowKey(rule, clientKey), ticker.read(), rule.getMaxRequests(), rule.window());
    }

    public boolean admit(String key, long now, int capacity, Duration window) {
        return decide(key, now, capacity, window).allowed();
    }

    public RateLimitDecision decide(String key, long now, int capacity, Duration window) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(window, "window");
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        long windowNanos = window.toNanos();
        RateLimitDecision[] decision = new RateLimitDecision[1];
        windows.asMap().compute(key, (k, existing) -> {
            RateWindow log = existing != null ? existing : new RateWindow();
            decision[0] = log.tryAdmit(now, capacity, windowNanos);
            return log;
        });
        return decision[0];
    }

    long trackedKeys() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    private static String windowKey(RateLimitProperties.Rule rule, String clientKey) {
        return "rate:" + buildRuleKey(rule) + ":" + Objects.requireNonNull(clientKey, "clientKey");
    }

    private static String buildRuleKey(RateLimitProperties.Rule rule) {
        if (rule.getKey() != null && !rule.getKey().isBlank()) {
            return rule.getKey();
        }
        return rule.getPath().replace('/', '_');
    }

    private static final class RateWindow {
        private final Deque<Long> admitted = new ArrayDeque<>();
        // longest window any caller has applied to this key
        private long windowNanos;

        private RateLimitDecision tryAdmit(long now, int capacity, long windowNanos) {
            this.windowNanos = Math.max(this.windowNanos, windowNanos);
            // half-open window: an entry exactly one window old has expired
            while (!admitted.isEmpty() && now - admitted.peekFirst() >= windowNanos) {
                admitted.pollFirst();
            }
            if (admitted.size() < capacity) {
                admitted.addLast(now);
                return RateLimitDecision.allow();
            }
            long remainingNanos = windowNanos - (now - admitted.peekFirst());
            long retryAfterSeconds = (remainingNanos + TimeUnit.SECONDS.toNanos(1) - 1) / TimeUnit.SECONDS.toNanos(1);
            return RateLimitDecision.block(retryAfterSeconds);
        }
    }

    /**
     * Idle expiry per window, never shorter than the longest window used on
     * that key, so an evicted log holds no admission that could still count.
     */
    private static final class RateWindowExpiry implements Expiry<String, RateWindow> {
        private final long idleNanos;

        private RateWindowExpiry(long idleNanos) {
            this.idleNanos = idleNanos;
        }

        @Override
        public long expireAfterCreate(String key, RateWindow value, long currentTime) {
            return Math.max(idleNanos, value.windowNanos);
        }

        @Override
        public long expireAfterUpdate(String key, RateWindow value, long currentTime, long currentDuration) {
            return Math.max(idleNanos, value.windowNanos);
        }

        @Override
        public long expireAfterRead(String key, RateWindow value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
