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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fixed-window request counting over a {@link CounterStore}.
 * <p>
 * Windows are aligned to multiples of the window length since the epoch, so every process
 * sharing a store counts into the same bucket. Denied requests are counted too.
 */
public class FixedWindowCounter {

    private final CounterStore store;
    private final Clock clock;

    public FixedWindowCounter(CounterStore store) {
        this(store, Clock.systemUTC());
    }

    public FixedWindowCounter(CounterStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "Counter store cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public RateLimitResult acquire(String key, long limit, Duration window) {
        Objects.requireNonNull(key, "Key cannot be null");
        long windowMs = requirePositive(window);
        long now = clock.millis();
        long windowStart = now - Math.floorMod(now, windowMs);
        Instant resetAt = Instant.ofEpochMilli(windowStart + windowMs);

        long count = store.increment(bucket(key, windowStart), window);
        boolean allowed = count <= limit;
        Duration retryAfter = allowed ? null : Duration.ofMillis(windowStart + windowMs - now);
        return new RateLimitResult(allowed, count, limit, resetAt, retryAfter);
    }

    public long getCurrent(String key, Duration window) {
        long windowMs = requirePositive(window);
        long now = clock.millis();
        return store.get(bucket(key, now - Math.floorMod(now, windowMs)));
    }

    public void reset(String key, Duration window) {
        long windowMs = requirePositive(window);
        long now = clock.millis();
        store.reset(bucket(key, now - Math.floorMod(now, windowMs)));
    }

    private static String bucket(String key, long windowStart) {
        return "window:" + key + ":" + windowStart;
    }

    private static long requirePositive(Duration window) {
        Objects.requireNonNull(window, "Window cannot be null");
        long windowMs = window.toMillis();
        if (windowMs <= 0) {
            throw new IllegalArgumentException("Window must be positive: " + window);
        }
        return windowMs;
    }
}
