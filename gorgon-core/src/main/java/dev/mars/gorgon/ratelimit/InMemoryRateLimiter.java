/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.gorgon.ratelimit;

import dev.mars.gorgon.config.GorgonConfiguration;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Process-local rate limiter.
 * <p>
 * Concurrency is bounded per provider by an {@link AdaptiveLimit}; callers beyond the
 * effective ceiling wait on a condition until a permit is released. Throughput, where a
 * provider is configured with {@code requestsPerPeriod}, is enforced by a Resilience4j
 * rate limiter registered under the provider name.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class InMemoryRateLimiter implements RateLimiter {

    private static final Logger logger = Logger.getLogger(InMemoryRateLimiter.class.getName());

    // Waiters re-check the ceiling at least this often so recovery is noticed without a release.
    private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private static final Duration UNBOUNDED_THROUGHPUT_WAIT = Duration.ofDays(1);

    private final Function<String, ProviderLimits> limitsResolver;
    private final Clock clock;
    private final RateLimiterRegistry throughputRegistry;
    private final Map<String, ProviderState> providers = new ConcurrentHashMap<>();

    public InMemoryRateLimiter(GorgonConfiguration configuration) {
        this(provider -> ProviderLimits.fromConfiguration(configuration, provider), Clock.systemUTC());
    }

    public InMemoryRateLimiter(Function<String, ProviderLimits> limitsResolver, Clock clock) {
        this.limitsResolver = Objects.requireNonNull(limitsResolver, "Limits resolver cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.throughputRegistry = RateLimiterRegistry.ofDefaults();
    }

    @Override
    public Permit acquire(String provider, Duration maxWait) throws InterruptedException, RateLimitExceededException {
        Objects.requireNonNull(provider, "Provider cannot be null");
        ProviderState state = stateFor(provider);
        boolean bounded = maxWait != null;
        long deadline = bounded ? System.nanoTime() + maxWait.toNanos() : 0L;

        state.lock.lockInterruptibly();
        try {
            while (state.inFlight >= state.adaptive.current()) {
                long wait = WAIT_SLICE_NANOS;
                if (bounded) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        throw new RateLimitExceededException(provider,
                                "no permit available within " + maxWait.toMillis() + "ms");
                    }
                    wait = Math.min(wait, remaining);
                }
                state.released.awaitNanos(wait);
            }
            state.inFlight++;
        } finally {
            state.lock.unlock();
        }

        // The concurrency slot is held from here on and must be handed back if throughput refuses.
        boolean acquired = false;
        try {
            awaitThroughput(state, bounded, deadline);
            acquired = true;
            return new Permit(provider, clock.instant());
        } finally {
            if (!acquired) {
                releaseSlot(state);
            }
        }
    }

    @Override
    public void release(Permit permit) {
        Objects.requireNonNull(permit, "Permit cannot be null");
        if (!permit.markReleased()) {
            return;
        }
        ProviderState state = providers.get(permit.getProvider());
        if (state == null) {
            logger.warning("Release for unknown provider " + permit.getProvider());
            return;
        }
        releaseSlot(state);
    }

    @Override
    public void reportThrottled(String provider) {
        stateFor(provider).adaptive.onThrottled();
    }

    @Override
    public int getEffectiveLimit(String provider) {
        return stateFor(provider).adaptive.current();
    }

    @Override
    public int getInFlight(String provider) {
        ProviderState state = stateFor(provider);
        state.lock.lock();
        try {
            return state.inFlight;
        } finally {
            state.lock.unlock();
        }
    }

    private static void releaseSlot(ProviderState state) {
        state.lock.lock();
        try {
            state.inFlight = Math.max(0, state.inFlight - 1);
            state.released.signalAll();
        } finally {
            state.lock.unlock();
        }
    }

    /**
     * Reserves a throughput slot only when it falls within the caller's remaining wait, so a
     * refused caller never holds a future cycle. The timeout of the shared Resilience4j limiter
     * is set per call under the provider's throughput lock.
     */
    private void awaitThroughput(ProviderState state, boolean bounded, long deadline)
            throws InterruptedException, RateLimitExceededException {
        if (state.throughput == null) {
            return;
        }
        long nanosToWait;
        state.throughputLock.lockInterruptibly();
        try {
            Duration budget = bounded
                    ? Duration.ofNanos(Math.max(0L, deadline - System.nanoTime()))
                    : UNBOUNDED_THROUGHPUT_WAIT;
            state.throughput.changeTimeoutDuration(budget);
            nanosToWait = state.throughput.reservePermission();
        } finally {
            state.throughputLock.unlock();
        }
        if (nanosToWait < 0) {
            throw new RateLimitExceededException(state.provider, "throughput limit reached", state.limits.getPeriod());
        }
        if (nanosToWait > 0) {
            logger.fine("Waiting " + TimeUnit.NANOSECONDS.toMillis(nanosToWait) + "ms for throughput on " + state.provider);
            TimeUnit.NANOSECONDS.sleep(nanosToWait);
        }
    }

    private ProviderState stateFor(String provider) {
        return providers.computeIfAbsent(provider, this::createState);
    }

    private ProviderState createState(String provider) {
        ProviderLimits limits = limitsResolver.apply(provider);
        io.github.resilience4j.ratelimiter.RateLimiter throughput = null;
        if (limits.isThroughputLimited()) {
            RateLimiterConfig config = RateLimiterConfig.custom()
                    .limitForPeriod(limits.getRequestsPerPeriod())
                    .limitRefreshPeriod(limits.getPeriod())
                    .timeoutDuration(limits.getPeriod())
                    .build();
            throughput = throughputRegistry.rateLimiter(provider, config);
        }
        logger.info("Registered provider " + provider + " with " + limits);
        return new ProviderState(provider, limits, new AdaptiveLimit(provider, limits, clock), throughput);
    }

    private static final class ProviderState {
        private final String provider;
        private final ProviderLimits limits;
        private final AdaptiveLimit adaptive;
        private final io.github.resilience4j.ratelimiter.RateLimiter throughput;
        private final ReentrantLock lock = new ReentrantLock(true);
        private final Condition released = lock.newCondition();
        private final ReentrantLock throughputLock = new ReentrantLock();
        private int inFlight;

        private ProviderState(String provider, ProviderLimits limits, AdaptiveLimit adaptive,
                              io.github.resilience4j.ratelimiter.RateLimiter throughput) {
            this.provider = provider;
            this.limits = limits;
            this.adaptive = adaptive;
            this.throughput = throughput;
        }
    }
}
