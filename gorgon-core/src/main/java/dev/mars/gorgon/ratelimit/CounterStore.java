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

import java.time.Duration;

/**
 * Atomic named counters with expiry, the shared state behind {@link DistributedRateLimiter}
 * and {@link FixedWindowCounter}.
 * <p>
 * Expired counters read as zero. Implementations backed by shared storage let several
 * processes coordinate on the same provider limits.
 */
public interface CounterStore {

    /**
     * Increments the counter and refreshes its expiry.
     *
     * @param key the counter name
     * @param ttl how long the counter lives after this increment
     * @return the value after incrementing
     */
    long increment(String key, Duration ttl);

    /**
     * Decrements the counter, never below zero.
     *
     * @return the value after decrementing
     */
    long decrement(String key);

    long get(String key);

    void reset(String key);

    /**
     * Removes expired counters.
     *
     * @return the number of counters removed
     */
    int purgeExpired();
}
