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

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A slot granted by a {@link RateLimiter} for one in-flight provider call.
 */
public final class Permit {

    private final String permitId;
    private final String provider;
    private final Instant acquiredAt;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public Permit(String provider, Instant acquiredAt) {
        this.permitId = UUID.randomUUID().toString();
        this.provider = Objects.requireNonNull(provider, "Provider cannot be null");
        this.acquiredAt = Objects.requireNonNull(acquiredAt, "Acquired time cannot be null");
    }

    public String getPermitId() {
        return permitId;
    }

    public String getProvider() {
        return provider;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Marks the permit released.
     *
     * @return true only for the first call
     */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Permit permit = (Permit) o;
        return permitId.equals(permit.permitId);
    }

    @Override
    public int hashCode() {
        return permitId.hashCode();
    }

    @Override
    public String toString() {
        return "Permit{" +
               "provider='" + provider + '\'' +
               ", permitId='" + permitId + '\'' +
               ", acquiredAt=" + acquiredAt +
               '}';
    }
}
