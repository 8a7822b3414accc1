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
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a fixed-window admission check.
 */
public final class RateLimitResult {

    private final boolean allowed;
    private final long currentCount;
    private final long limit;
    private final Instant resetAt;
    private final Duration retryAfter;

    public RateLimitResult(boolean allowed, long currentCount, long limit, Instant resetAt, Duration retryAfter) {
        this.allowed = allowed;
        this.currentCount = currentCount;
        this.limit = limit;
        this.resetAt = Objects.requireNonNull(resetAt, "Reset time cannot be null");
        this.retryAfter = retryAfter;
    }

    public boolean isAllowed() {
        return allowed;
    }

    public long getCurrentCount() {
        return currentCount;
    }

    public long getLimit() {
        return limit;
    }

    public long getRemaining() {
        return Math.max(0, limit - currentCount);
    }

    public Instant getResetAt() {
        return resetAt;
    }

    /**
     * Time until the window resets; present only when the request was denied.
     */
    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public String toString() {
        return "RateLimitResult{" +
               "allowed=" + allowed +
               ", currentCount=" + currentCount +
               ", limit=" + limit +
               ", resetAt=" + resetAt +
               ", retryAfter=" + retryAfter +
               '}';
    }
}
