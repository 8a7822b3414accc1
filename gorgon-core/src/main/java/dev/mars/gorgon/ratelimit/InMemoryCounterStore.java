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
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counter store held in a {@link ConcurrentHashMap}; visible to this process only.
 */
public class InMemoryCounterStore implements CounterStore {

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCounterStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCounterStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public long increment(String key, Duration ttl) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(ttl, "TTL cannot be null");
        Instant now = clock.instant();
        Counter updated = counters.compute(key, (k, existing) -> {
            long base = existing == null || existing.isExpired(now) ? 0 : existing.value;
            return new Counter(base + 1, now.plus(ttl));
        });
        return updated.value;
    }

    @Override
    public long decrement(String key) {
        Instant now = clock.instant();
        Counter updated = counters.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                return null;
            }
            return new Counter(Math.max(0, existing.value - 1), existing.expiresAt);
        });
        return updated == null ? 0 : updated.value;
    }

    @Override
    public long get(String key) {
        Counter counter = counters.get(key);
        if (counter == null || counter.isExpired(clock.instant())) {
            return 0;
        }
        return counter.value;
    }

    @Override
    public void reset(String key) {
        counters.remove(key);
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<String, Counter>> iterator = counters.entrySet().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getValue().isExpired(now)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    private static final class Counter {
        private final long value;
        private final Instant expiresAt;

        private Counter(long value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
