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

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Rate limiter whose in-flight counts, request windows and throttle signals live in a
 * {@link CounterStore}, so that every process sharing the store respects one ceiling.
 * <p>
 * In-flight counters carry a lease so that permits held by a crashed process eventually
 * expire. Waiting callers poll the store.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class DistributedRateLimiter implements RateLimiter {

    private static final Logger logger = Logger.getLogger(DistributedRateLimiter.class.getName());

    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(25);
    private static final Duration DEFAULT_LEASE = Duration.ofMinutes(10);

    private final CounterStore store;
    private final FixedWindowCounter windowCounter;
    private final Function<String, ProviderLimits> limitsResolver;
    private final Duration pollInterval;
    private final Duration lease;
    private final Clock clock;
    private final Map<String, ProviderState> providers = new ConcurrentHashMap<>();

    public DistributedRateLimiter(CounterStore store, GorgonConfiguration configuration) {
        this(store, provider -> ProviderLimits.fromConfiguration(configuration, provider),
                DEFAULT_POLL_INTERVAL, DEFAULT_LEASE, Clock.systemUTC());
    }

    public DistributedRateLimiter(CounterStore store, Function<String, ProviderLimits> limitsResolver,
                                  Duration pollInterval, Duration lease, Clock clock) {
        this.store = Objects.requireNonNull(store, "Counter store cannot be null");
        this.limitsResolver = Objects.requireNonNull(limitsResolver, "Limits resolver cannot be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "Poll interval cannot be null");
        this.lease = Objects.requireNonNull(lease, "Lease cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.windowCounter = new FixedWindowCounter(store, clock);
    }

    @Override
    public Permit acquire(String provider, Duration maxWait) throws InterruptedException, RateLimitExceededException {
        Objects.requireNonNull(provider, "Provider cannot be null");
        ProviderState state = stateFor(provider);
        boolean bounded = maxWait != null;
        long deadline = bounded ? System.nanoTime() + maxWait.toNanos() : 0L;

        if (state.limits.isThroughputLimited()) {
            awaitWindow(state, bounded, deadline);
        }

        String inFlightKey = inFlightKey(provider);
        while (true) {
            syncThrottles(state);
            long inFlight = store.increment(inFlightKey, lease);
            if (inFlight <= state.adaptive.current()) {
                return new Permit(provider, clock.instant());
            }
            store.decrement(inFlightKey);
            sleepUntilNextPoll(provider, bounded, deadline, maxWait);
        }
    }

    @Override
    public void release(Permit permit) {
        Objects.requireNonNull(permit, "Permit cannot be null");
        if (permit.markReleased()) {
            store.decrement(inFlightKey(permit.getProvider()));
        }
    }

    @Override
    public void reportThrottled(String provider) {
        ProviderState state = stateFor(provider);
        long signals = store.increment(throttleKey(provider), state.limits.getRecoveryWindow());
        synchronized (state) {
            state.adaptive.onThrottled();
            state.lastSeenThrottles = signals;
        }
    }

    @Override
    public int getEffectiveLimit(String provider) {
        ProviderState state = stateFor(provider);
        syncThrottles(state);
        return state.adaptive.current();
    }

    @Override
    public int getInFlight(String provider) {
        return (int) store.get(inFlightKey(provider));
    }

    private void awaitWindow(ProviderState state, boolean bounded, long deadline)
            throws InterruptedException, RateLimitExceededException {
        ProviderLimits limits = state.limits;
        while (true) {
            RateLimitResult result = windowCounter.acquire(throughputKey(state.provider),
                    limits.getRequestsPerPeriod(), limits.getPeriod());
            if (result.isAllowed()) {
                return;
            }
            Duration retryAfter = result.getRetryAfter().orElse(pollInterval);
            if (bounded && System.nanoTime() + retryAfter.toNanos() > deadline) {
                throw new RateLimitExceededException(state.provider, "request window exhausted", retryAfter);
            }
            logger.fine("Request window for " + state.provider + " exhausted, waiting " + retryAfter.toMillis() + "ms");
            TimeUnit.NANOSECONDS.sleep(Math.max(retryAfter.toNanos(), 1));
        }
    }

    // Applies throttle signals reported by other processes to the local adaptive limit.
    private void syncThrottles(ProviderState state) {
        long signals = store.get(throttleKey(state.provider));
        synchronized (state) {
            boolean newSignal = signals > state.lastSeenThrottles
                    || (signals > 0 && signals < state.lastSeenThrottles);
            if (newSignal) {
                state.adaptive.onThrottled();
            }
            state.lastSeenThrottles = signals;
        }
    }

    private void sleepUntilNextPoll(String provider, boolean bounded, long deadline, Duration maxWait)
            throws InterruptedException, RateLimitExceededException {
        long sleep = pollInterval.toNanos();
        if (bounded) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new RateLimitExceededException(provider,
                        "no permit available within " + maxWait.toMillis() + "ms");
            }
            sleep = Math.min(sleep, remaining);
        }
        TimeUnit.NANOSECONDS.sleep(sleep);
    }

    private ProviderState stateFor(String provider) {
        return providers.computeIfAbsent(provider, p -> {
            ProviderLimits limits = limitsResolver.apply(p);
            return new ProviderState(p, limits, new AdaptiveLimit(p, limits, clock));
        });
    }

    private static String inFlightKey(String provider) {
        return "inflight:" + provider;
    }

    private static String throttleKey(String provider) {
        return "throttled:" + provider;
    }

    private static String throughputKey(String provider) {
        return "requests:" + provider;
    }

    private static final class ProviderState {
        private final String provider;
        private final ProviderLimits limits;
        private final AdaptiveLimit adaptive;
        private long lastSeenThrottles;

        private ProviderState(String provider, ProviderLimits limits, AdaptiveLimit adaptive) {
            this.provider = provider;
            this.limits = limits;
            this.adaptive = adaptive;
        }
    }
}
