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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AdaptiveLimitTest {

    private MutableClock clock;
    private AdaptiveLimit limit;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-09-01T00:00:00Z"));
        ProviderLimits limits = ProviderLimits.builder()
                .maxConcurrent(8)
                .decreaseFactor(0.5)
                .recoveryWindow(Duration.ofSeconds(10))
                .build();
        limit = new AdaptiveLimit("openai", limits, clock);
    }

    @Test
    @DisplayName("Starts at the configured ceiling")
    void startsAtMax() {
        assertThat(limit.current()).isEqualTo(8);
    }

    @Test
    @DisplayName("Throttle halves the ceiling but never below one")
    void throttleDecreasesMultiplicatively() {
        limit.onThrottled();
        assertThat(limit.current()).isEqualTo(4);
        limit.onThrottled();
        limit.onThrottled();
        limit.onThrottled();
        limit.onThrottled();
        assertThat(limit.current()).isEqualTo(1);
        assertThat(limit.getThrottleCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("Ceiling does not rise inside the recovery window")
    void noIncreaseWithinRecoveryWindow() {
        limit.onThrottled();
        clock.advance(Duration.ofSeconds(9));
        assertThat(limit.current()).isEqualTo(4);
    }

    @Test
    @DisplayName("Ceiling recovers by one slot per recovery window up to the maximum")
    void recoversGradually() {
        limit.onThrottled();
        clock.advance(Duration.ofSeconds(10));
        assertThat(limit.current()).isEqualTo(5);
        assertThat(limit.current()).isEqualTo(5);
        for (int i = 0; i < 10; i++) {
            clock.advance(Duration.ofSeconds(10));
            limit.current();
        }
        assertThat(limit.current()).isEqualTo(8);
    }
}
