package com.church.chms.util;

import com.church.chms.config.ChmsProperties;
import com.church.chms.exception.RateLimitExceededException;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * 令牌桶限流器 (Bucket4j，内存实现)
 * <p>
 * 每个标识一个桶：容量 maxAttempts，每 windowSeconds 整体补满一次。
 * 桶的时间来自注入的 {@link Clock}，测试中可以拨动时间。
 */
@Slf4j
@Component
public class RateLimiter {

    private final ConcurrentMap<String, Entry> buckets = new ConcurrentHashMap<>();
    private final Clock clock;
    private final TimeMeter timeMeter;
    private final ChmsProperties.RateLimit settings;

    public RateLimiter(Clock clock, ChmsProperties properties) {
        this.clock = clock;
        this.timeMeter = new ClockTimeMeter(clock);
        this.settings = properties.getRateLimit();
    }

    public boolean check(String identifier) {
        return check(identifier, settings.getMaxAttempts(), settings.getWindowSeconds());
    }

    /**
     * 消耗一个令牌；被拒绝的尝试不消耗
     *
     * @return true 表示未超限
     */
    public boolean check(String identifier, int maxAttempts, long windowSeconds) {
        return tryConsume(identifier, maxAttempts, windowSeconds).isConsumed();
    }

    public void clear(String identifier) {
        buckets.remove(identifier);
    }

    public int getRemaining(String identifier) {
        return getRemaining(identifier, settings.getMaxAttempts(), settings.getWindowSeconds());
    }

    public int getRemaining(String identifier, int maxAttempts, long windowSeconds) {
        Entry entry = buckets.get(identifier);
        if (entry == null || !entry.matches(maxAttempts, windowSeconds)) {
            return maxAttempts;
        }
        return (int) Math.max(0, entry.bucket.getAvailableTokens());
    }

    /**
     * 桶重新补满的时间点 (epoch 秒)；没有记录或桶是满的时返回 0
     */
    public long getResetTime(String identifier) {
        return getResetTime(identifier, settings.getWindowSeconds());
    }

    public long getResetTime(String identifier, long windowSeconds) {
        Entry entry = buckets.get(identifier);
        if (entry == null || entry.windowSeconds != windowSeconds) {
            return 0;
        }
        long waitNanos = entry.bucket.estimateAbilityToConsume(entry.maxAttempts).getNanosToWaitForRefill();
        if (waitNanos <= 0) {
            return 0;
        }
        return nowSeconds() + toSeconds(waitNanos);
    }

    public void enforce(String identifier) {
        enforce(identifier, settings.getMaxAttempts(), settings.getWindowSeconds());
    }

    /**
     * 超限时抛出 429，提示剩余等待分钟数 (向上取整)
     */
    public void enforce(String identifier, int maxAttempts, long windowSeconds) {
        ConsumptionProbe consumption = tryConsume(identifier, maxAttempts, windowSeconds);
        if (consumption.isConsumed()) {
            return;
        }
        long retryAfter = Math.max(1, toSeconds(consumption.getNanosToWaitForRefill()));
        long minutes = (long) Math.ceil(retryAfter / 60.0);
        log.warn("限流触发: {} 需等待 {} 秒", identifier, retryAfter);
        throw new RateLimitExceededException(
                "Too many requests. Please try again in " + minutes + " minute(s).", retryAfter);
    }

    /**
     * 距离下一个令牌可用还需等待的秒数，至少为 1
     */
    public long retryAfterSeconds(String identifier, long windowSeconds) {
        Entry entry = buckets.get(identifier);
        if (entry == null || entry.windowSeconds != windowSeconds) {
            return 1;
        }
        return Math.max(1, toSeconds(entry.bucket.estimateAbilityToConsume(1).getNanosToWaitForRefill()));
    }

    /**
     * 清理最后一次尝试早于 maxAgeSeconds 的标识，返回清理数量
     */
    public int cleanup(long maxAgeSeconds) {
        long threshold = clock.millis() - TimeUnit.SECONDS.toMillis(maxAgeSeconds);
        int before = buckets.size();
        buckets.values().removeIf(entry -> entry.lastSeenMillis < threshold);
        return before - buckets.size();
    }

    int trackedIdentifiers() {
        return buckets.size();
    }

    private ConsumptionProbe tryConsume(String identifier, int maxAttempts, long windowSeconds) {
        Entry entry = buckets.compute(identifier, (key, current) -> {
            Entry resolved = current != null && current.matches(maxAttempts, windowSeconds)
                    ? current
                    : new Entry(newBucket(maxAttempts, windowSeconds), maxAttempts, windowSeconds);
            resolved.lastSeenMillis = clock.millis();
            return resolved;
        });
        return entry.bucket.tryConsumeAndReturnRemaining(1);
    }

    private Bucket newBucket(int maxAttempts, long windowSeconds) {
        Bandwidth limit = Bandwidth.classic(maxAttempts,
                Refill.intervally(maxAttempts, Duration.ofSeconds(windowSeconds)));
        return Bucket.builder()
                .addLimit(limit)
                .withCustomTimePrecision(timeMeter)
                .build();
    }

    private long nowSeconds() {
        return clock.millis() / 1000;
    }

    private static long toSeconds(long nanos) {
        return (nanos + TimeUnit.SECONDS.toNanos(1) - 1) / TimeUnit.SECONDS.toNanos(1);
    }

    private static final class Entry {

        private final Bucket bucket;
        private final int maxAttempts;
        private final long windowSeconds;
        private volatile long lastSeenMillis;

        private Entry(Bucket bucket, int maxAttempts, long windowSeconds) {
            this.bucket = bucket;
            this.maxAttempts = maxAttempts;
            this.windowSeconds = windowSeconds;
        }

        private boolean matches(int maxAttempts, long windowSeconds) {
            return this.maxAttempts == maxAttempts && this.windowSeconds == windowSeconds;
        }
    }

    /**
     * 以 {@link Clock} 为时间源的 TimeMeter
     */
    private static final class ClockTimeMeter implements TimeMeter {

        private final Clock clock;

        private ClockTimeMeter(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long currentTimeNanos() {
            return TimeUnit.MILLISECONDS.toNanos(clock.millis());
        }

        public boolean isWallClockBased() {
            return true;
        }
    }
}
