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
 * Per-provider concurrency and throughput control consulted before every external call.
 * <p>
 * Implementations must be safe to share between concurrently running executions. A caller
 * that obtains a {@link Permit} must hand it back through {@link #release(Permit)} once the
 * call has finished, whatever its outcome.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public interface RateLimiter {

    /**
     * Acquires a permit for the provider, blocking until one is available.
     *
     * @param provider the provider name, e.g. {@code openai}
     * @return the permit
     * @throws InterruptedException if the calling thread is interrupted while waiting
     * @throws RateLimitExceededException if the limiter refuses the request outright
     */
    default Permit acquire(String provider) throws InterruptedException, RateLimitExceededException {
        return acquire(provider, null);
    }

    /**
     * Acquires a permit for the provider, waiting at most {@code maxWait}.
     *
     * @param provider the provider name
     * @param maxWait the maximum time to wait, or null to wait indefinitely
     * @return the permit
     * @throws InterruptedException if the calling thread is interrupted while waiting
     * @throws RateLimitExceededException if no permit became available in time
     */
    Permit acquire(String provider, Duration maxWait) throws InterruptedException, RateLimitExceededException;

    /**
     * Returns a permit. Releasing the same permit twice has no effect.
     */
    void release(Permit permit);

    /**
     * Signals that the provider answered with a rate-limit response. The effective
     * concurrency ceiling for the provider shrinks and recovers gradually afterwards.
     */
    void reportThrottled(String provider);

    /**
     * Gets the concurrency ceiling currently enforced for the provider.
     */
    int getEffectiveLimit(String provider);

    /**
     * Gets the number of permits currently held for the provider.
     */
    int getInFlight(String provider);
}
