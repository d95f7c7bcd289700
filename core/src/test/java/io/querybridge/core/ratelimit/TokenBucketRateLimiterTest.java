package io.querybridge.core.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.querybridge.core.error.RateLimitExceededException;
import io.querybridge.core.testing.MutableClock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@DisplayName("TokenBucketRateLimiter")
class TokenBucketRateLimiterTest {

    private final MutableClock clock = MutableClock.startingAt(1_700_000_000_000L);

    @Nested
    @DisplayName("bucket")
    class Bucket {

        @Test
        @DisplayName("burst tokens are spent then refilled over time")
        void refills() {
            TokenBucketRateLimiter limiter =
                    new TokenBucketRateLimiter(RateLimitConfig.perMinute(60).withBurstLimit(3), clock);

            assertThat(limiter.tryAcquire()).isTrue();
            assertThat(limiter.tryAcquire()).isTrue();
            assertThat(limiter.tryAcquire()).isTrue();
            assertThat(limiter.tryAcquire()).isFalse();
            assertThat(limiter.getStatus().shouldQueue()).isTrue();

            clock.advanceMillis(1_000);

            assertThat(limiter.tryAcquire()).isTrue();
            assertThat(limiter.tryAcquire()).isFalse();
        }

        @Test
        @DisplayName("status reports capacity and time until full")
        void status() {
            TokenBucketRateLimiter limiter =
                    new TokenBucketRateLimiter(RateLimitConfig.perMinute(120).withBurstLimit(4), clock);
            limiter.tryAcquire();
            limiter.tryAcquire();

            RateLimitStatus status = limiter.getStatus();

            assertThat(status.remaining()).isEqualTo(2);
            assertThat(status.limit()).isEqualTo(4);
            assertThat(status.resetAtMs()).isEqualTo(clock.millis() + 1_000);
            assertThat(status.queueLength()).isZero();
            assertThat(status.backoffMultiplier()).isEqualTo(1);
        }

        @Test
        @DisplayName("server headers cap the local bucket")
        void headersCapBucket() {
            TokenBucketRateLimiter limiter =
                    new TokenBucketRateLimiter(RateLimitConfig.perMinute(600).withBurstLimit(10), clock);

            limiter.updateFromHeaders(Map.of("X-RateLimit-Limit", "5", "X-RateLimit-Remaining", "2"));

            RateLimitStatus status = limiter.getStatus();
            assertThat(status.limit()).isEqualTo(5);
            assertThat(status.remaining()).isEqualTo(2);
        }

        @Test
        @DisplayName("exhausted server quota blocks refill until the reset time")
        void resetHeaderDefersRefill() {
            TokenBucketRateLimiter limiter =
                    new TokenBucketRateLimiter(RateLimitConfig.perMinute(600).withBurstLimit(10), clock);

            limiter.updateFromHeaders(Map.of("x-ratelimit-remaining", "0", "x-ratelimit-reset", "30"));
            clock.advanceMillis(20_000);

            assertThat(limiter.tryAcquire()).isFalse();

            clock.advanceMillis(11_000);

            assertThat(limiter.tryAcquire()).isTrue();
        }

        @Test
        @DisplayName("non-numeric headers are ignored")
        void ignoresGarbageHeaders() {
            TokenBucketRateLimiter limiter =
                    new TokenBucketRateLimiter(RateLimitConfig.perMinute(60).withBurstLimit(2), clock);

            limiter.updateFromHeaders(Map.of("x-ratelimit-remaining", "soon"));

            assertThat(limiter.getStatus().remaining()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("violations and queueing")
    class Violations {

        @Test
        @DisplayName("violations double the backoff multiplier up to the cap and reset clears it")
        void backoffMultiplier() {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(RateLimitConfig.perMinute(60), clock);

            limiter.reportViolation(null);
            assertThat(limiter.getStatus().backoffMultiplier()).isEqualTo(2);
            for (int i = 0; i < 5; i++) {
                limiter.reportViolation(null);
            }
            assertThat(limiter.getStatus().backoffMultiplier()).isEqualTo(10);

            limiter.reset();

            assertThat(limiter.getStatus().backoffMultiplier()).isEqualTo(1);
            assertThat(limiter.tryAcquire()).isTrue();
        }

        @Test
        @DisplayName("a full queue fails fast")
        void queueFull() {
            TokenBucketRateLimiter limiter =
                    new TokenBucketRateLimiter(RateLimitConfig.perMinute(60).withQueueSize(0), clock);
            limiter.waitForPermission();

            assertThatThrownBy(limiter::waitForPermission)
                    .isInstanceOf(RateLimitExceededException.class)
                    .hasMessage("Rate limit queue is full");
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("clearing the queue fails waiting callers")
        void clearQueueFailsWaiters() throws Exception {
            TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(RateLimitConfig.perMinute(1));
            limiter.waitForPermission();

            CompletableFuture<Void> waiter = CompletableFuture.runAsync(limiter::waitForPermission);
            while (limiter.getQueueLength() == 0) {
                Thread.sleep(5);
            }
            limiter.clearQueue();

            assertThatThrownBy(waiter::get)
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(RateLimitExceededException.class)
                    .hasRootCauseMessage("Request queue cleared");
        }

        @Test
        @Timeout(value = 10, unit = TimeUnit.SECONDS)
        @DisplayName("a queued caller proceeds once a token refills")
        void waiterProceeds() throws Exception {
            TokenBucketRateLimiter limiter =
                    new TokenBucketRateLimiter(RateLimitConfig.perMinute(60).withRequestsPerSecond(20));
            limiter.waitForPermission();

            long start = System.nanoTime();
            limiter.waitForPermission(5);

            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(5_000);
            assertThat(limiter.getQueueLength()).isZero();
        }
    }

    @Test
    @DisplayName("config derives rate and burst from the per-minute quota")
    void configDefaults() {
        RateLimitConfig config = RateLimitConfig.perMinute(120);

        assertThat(config.requestsPerSecond()).isEqualTo(2.0);
        assertThat(config.burstLimit()).isEqualTo(2);
        assertThat(RateLimitConfig.perMinute(30).burstLimit()).isEqualTo(1);
        assertThatThrownBy(() -> RateLimitConfig.perMinute(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("backoff strategies grow as documented and are capped")
    void backoffStrategies() {
        assertThat(BackoffStrategy.EXPONENTIAL.delay(1_000, 4, 2, 30_000)).isEqualTo(4_000);
        assertThat(BackoffStrategy.LINEAR.delay(1_000, 4, 3, 30_000)).isEqualTo(3_000);
        assertThat(BackoffStrategy.FIXED.delay(1_000, 4, 3, 30_000)).isEqualTo(1_000);
        assertThat(BackoffStrategy.EXPONENTIAL.delay(1_000, 64, 6, 30_000)).isEqualTo(30_000);
        assertThat(BackoffStrategy.fromId("Linear")).isEqualTo(BackoffStrategy.LINEAR);
        assertThat(BackoffStrategy.fromId(null)).isEqualTo(BackoffStrategy.EXPONENTIAL);
    }

    @Test
    @DisplayName("registry keeps one limiter per endpoint")
    void registry() {
        RateLimiterRegistry registry = new RateLimiterRegistry();

        TokenBucketRateLimiter first = registry.limiterFor("https://api.example.com", RateLimitConfig.perMinute(60));
        TokenBucketRateLimiter second = registry.limiterFor("https://api.example.com", RateLimitConfig.perMinute(5));

        assertThat(second).isSameAs(first);
        assertThat(registry.endpoints()).containsExactly("https://api.example.com");

        registry.remove("https://api.example.com");

        assertThat(registry.find("https://api.example.com")).isEmpty();
    }
}
