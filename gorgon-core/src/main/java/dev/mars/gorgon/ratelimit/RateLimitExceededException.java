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

import dev.mars.gorgon.core.exceptions.GorgonException;

import java.time.Duration;
import java.util.Optional;

/**
 * Thrown when a permit for a provider could not be obtained within the allowed wait.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-02
 * @version 1.0
 */
public class RateLimitExceededException extends GorgonException {

    private final String provider;
    private final Duration retryAfter;

    public RateLimitExceededException(String provider, String message) {
        this(provider, message, null);
    }

    public RateLimitExceededException(String provider, String message, Duration retryAfter) {
        super(message);
        this.provider = provider;
        this.retryAfter = retryAfter;
    }

    public String getProvider() {
        return provider;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public String getMessage() {
        return String.format("Rate limit for provider %s: %s", provider, super.getMessage());
    }
}
