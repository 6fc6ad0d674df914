package shipguard.adapter.out.ratelimit.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import shipguard.core.model.ratelimit.RateLimitKey;
import shipguard.core.model.ratelimit.RateLimitPolicy;
import shipguard.core.service.ratelimit.RateLimitPolicyRegistry;
import shipguard.support.MutableClock;

@DisplayName("InMemoryRateLimiter")
class InMemoryRateLimiterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemoryRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        rateLimiter = new InMemoryRateLimiter(clock, true);
    }

    private boolean consume(RateLimitKey key, RateLimitPolicy policy) {
        return rateLimiter.checkAndConsume(key, policy).await().atMost(TIMEOUT).allowed();
    }

    @Nested
    @DisplayName("Basic operations")
    class BasicOperationTests {

        @Test
        @DisplayName("should track separate buckets per client")
        void shouldTrackSeparateBucketsPerClient() {
            var key1 = new RateLimitKey("login", "10.0.0.1");
            var key2 = new RateLimitKey("login", "10.0.0.2");

            for (int i = 0; i < 5; i++) {
                consume(key1, RateLimitPolicy.LOGIN);
            }

            var decision = rateLimiter.checkAndConsume(key2, RateLimitPolicy.LOGIN).await().atMost(TIMEOUT);
            assertTrue(decision.allowed());
            assertEquals(4, decision.remaining());
        }

        @Test
        @DisplayName("should track the same client independently per policy")
        void shouldTrackPoliciesIndependently() {
            var loginKey = new RateLimitKey("login", "10.0.0.1");
            var apiKey = new RateLimitKey("api", "10.0.0.1");

            for (int i = 0; i < 6; i++) {
                consume(loginKey, RateLimitPolicy.LOGIN);
            }

            assertFalse(consume(loginKey, RateLimitPolicy.LOGIN));
            assertTrue(consume(apiKey, RateLimitPolicy.API));
        }

        @Test
        @DisplayName("should lift a block on reset")
        void shouldLiftBlockOnReset() {
            var key = new RateLimitKey("login", "10.0.0.1");
            for (int i = 0; i < 6; i++) {
                consume(key, RateLimitPolicy.LOGIN);
            }

            rateLimiter.reset(key).await().atMost(TIMEOUT);

            var decision = rateLimiter.checkAndConsume(key, RateLimitPolicy.LOGIN).await().atMost(TIMEOUT);
            assertTrue(decision.allowed());
            assertEquals(4, decision.remaining());
        }

        @Test
        @DisplayName("should report status without consuming")
        void shouldReportStatusWithoutConsuming() {
            var key = new RateLimitKey("api", "10.0.0.1");
            consume(key, RateLimitPolicy.API);

            var first = rateLimiter.getStatus(key, RateLimitPolicy.API).await().atMost(TIMEOUT);
            var second = rateLimiter.getStatus(key, RateLimitPolicy.API).await().atMost(TIMEOUT);

            assertEquals(99, first.remaining());
            assertEquals(99, second.remaining());
        }

        @Test
        @DisplayName("should allow everything when disabled")
        void shouldAllowEverythingWhenDisabled() {
            var disabled = new InMemoryRateLimiter(clock, false);
            var key = new RateLimitKey("login", "10.0.0.1");

            for (int i = 0; i < 20; i++) {
                assertTrue(disabled.checkAndConsume(key, RateLimitPolicy.LOGIN)
                        .await()
                        .atMost(TIMEOUT)
                        .allowed());
            }
            assertEquals(0, disabled.getBucketCount());
        }
    }

    @Nested
    @DisplayName("Time")
    class TimeTests {

        @Test
        @DisplayName("should keep a blocked key blocked after its window and release it after the block")
        void shouldHonourBlockAcrossWindow() {
            var key = new RateLimitKey("login", "10.0.0.1");
            for (int i = 0; i < 6; i++) {
                consume(key, RateLimitPolicy.LOGIN);
            }

            clock.advance(Duration.ofMinutes(20));
            assertFalse(consume(key, RateLimitPolicy.LOGIN));

            clock.advance(Duration.ofMinutes(10));
            assertTrue(consume(key, RateLimitPolicy.LOGIN));
        }

        @Test
        @DisplayName("should evict idle buckets but keep active and blocked ones")
        void shouldEvictIdleBuckets() {
            var idle = new RateLimitKey("api", "10.0.0.1");
            var blocked = new RateLimitKey("login", "10.0.0.2");
            consume(idle, RateLimitPolicy.API);
            for (int i = 0; i < 6; i++) {
                consume(blocked, RateLimitPolicy.LOGIN);
            }

            clock.advance(Duration.ofMinutes(3));
            var active = new RateLimitKey("api", "10.0.0.3");
            consume(active, RateLimitPolicy.API);

            var registry = RateLimitPolicyRegistry.defaults();
            var evicted = rateLimiter.evictIdle(name -> registry.find(name).orElse(null));

            assertEquals(1, evicted);
            assertEquals(2, rateLimiter.getBucketCount());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should never allow more than the policy's points under concurrent consumption")
        void shouldBeAtomicPerKey() throws InterruptedException {
            var key = new RateLimitKey("api", "10.0.0.1");
            var threads = 16;
            var attemptsPerThread = 25;
            var allowed = new AtomicInteger();
            var start = new CountDownLatch(1);
            var done = new CountDownLatch(threads);
            var executor = Executors.newFixedThreadPool(threads);

            try {
                for (int t = 0; t < threads; t++) {
                    executor.submit(() -> {
                        try {
                            start.await();
                            for (int i = 0; i < attemptsPerThread; i++) {
                                if (consume(key, RateLimitPolicy.API)) {
                                    allowed.incrementAndGet();
                                }
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            done.countDown();
                        }
                    });
                }
                start.countDown();
                assertTrue(done.await(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            assertEquals(100, allowed.get());
        }
    }
}
