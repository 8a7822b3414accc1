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
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DistributedRateLimiterTest {

    @TempDir
    Path tempDir;

    private Function<String, ProviderLimits> limits;

    @BeforeEach
    void setUp() {
        limits = provider -> ProviderLimits.builder()
                .maxConcurrent(2)
                .recoveryWindow(Duration.ofHours(1))
                .build();
    }

    private DistributedRateLimiter limiterOn(CounterStore store) {
        return new DistributedRateLimiter(store, limits, Duration.ofMillis(10), Duration.ofMinutes(5), Clock.systemUTC());
    }

    @Test
    @DisplayName("Two limiters sharing a store respect one ceiling")
    void sharedCeiling() throws Exception {
        Path file = tempDir.resolve("limits.json");
        DistributedRateLimiter first = limiterOn(new FileCounterStore(file));
        DistributedRateLimiter second = limiterOn(new FileCounterStore(file));

        Permit a = first.acquire("openai", Duration.ZERO);
        second.acquire("openai", Duration.ZERO);

        assertThatThrownBy(() -> first.acquire("openai", Duration.ofMillis(50)))
                .isInstanceOf(RateLimitExceededException.class);

        second.release(a);
        assertThat(first.acquire("openai", Duration.ofMillis(200))).isNotNull();
        assertThat(first.getInFlight("openai")).isEqualTo(2);
    }

    @Test
    @DisplayName("Throttle reported by one limiter lowers the ceiling seen by another")
    void throttlePropagates() {
        InMemoryCounterStore store = new InMemoryCounterStore();
        DistributedRateLimiter first = limiterOn(store);
        DistributedRateLimiter second = limiterOn(store);

        first.reportThrottled("openai");

        assertThat(first.getEffectiveLimit("openai")).isEqualTo(1);
        assertThat(second.getEffectiveLimit("openai")).isEqualTo(1);
    }

    @Test
    @DisplayName("Request window limits throughput across limiters")
    void requestWindow() throws Exception {
        limits = provider -> ProviderLimits.builder()
                .maxConcurrent(10)
                .requestsPerPeriod(1)
                .period(Duration.ofMinutes(1))
                .build();
        InMemoryCounterStore store = new InMemoryCounterStore();
        DistributedRateLimiter limiter = limiterOn(store);

        limiter.release(limiter.acquire("openai", Duration.ZERO));

        assertThatThrownBy(() -> limiterOn(store).acquire("openai", Duration.ofMillis(20)))
                .isInstanceOf(RateLimitExceededException.class)
                .satisfies(e -> assertThat(((RateLimitExceededException) e).getRetryAfter()).isPresent());
    }
}
