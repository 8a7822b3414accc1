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
import java.util.logging.Logger;

/**
 * Effective concurrency ceiling for one provider that shrinks multiplicatively on
 * throttle signals and grows back by one slot per elapsed recovery window.
 * <p>
 * The ceiling never rises within {@code recoveryWindow} of the last adjustment, and
 * never leaves the range {@code [1, maxLimit]}.
 */
public class AdaptiveLimit {

    private static final Logger logger = Logger.getLogger(AdaptiveLimit.class.getName());

    private final String provider;
    private final int maxLimit;
    private final double decreaseFactor;
    private final Duration recoveryWindow;
    private final Clock clock;

    private int effectiveLimit;
    private Instant lastAdjustment;
    private long throttleCount;

    public AdaptiveLimit(String provider, ProviderLimits limits, Clock clock) {
        this.provider = provider;
        this.maxLimit = limits.getMaxConcurrent();
        this.decreaseFactor = limits.getDecreaseFactor();
        this.recoveryWindow = limits.getRecoveryWindow();
        this.clock = clock;
        this.effectiveLimit = maxLimit;
        this.lastAdjustment = Instant.MIN;
    }

    public synchronized int current() {
        recover();
        return effectiveLimit;
    }

    public synchronized void onThrottled() {
        int reduced = Math.max(1, (int) Math.floor(effectiveLimit * decreaseFactor));
        throttleCount++;
        lastAdjustment = clock.instant();
        if (reduced < effectiveLimit) {
            logger.warning("Provider " + provider + " throttled, effective limit " + effectiveLimit + " -> " + reduced);
            effectiveLimit = reduced;
        } else {
            logger.fine("Provider " + provider + " throttled at minimum limit " + effectiveLimit);
        }
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public synchronized long getThrottleCount() {
        return throttleCount;
    }

    private void recover() {
        if (effectiveLimit >= maxLimit) {
            return;
        }
        Instant now = clock.instant();
        if (!now.isBefore(lastAdjustment.plus(recoveryWindow))) {
            effectiveLimit++;
            lastAdjustment = now;
            logger.fine("Provider " + provider + " recovering, effective limit now " + effectiveLimit);
        }
    }
}
