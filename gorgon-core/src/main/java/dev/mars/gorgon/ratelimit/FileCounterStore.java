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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Counter store persisted as a JSON document in a single file.
 * <p>
 * Every operation reads, updates and rewrites the file under an exclusive {@link FileLock},
 * so separate processes pointing at the same file share counters. Threads of one JVM are
 * serialized through a per-path lock first, since file locks are held per process.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-03
 * @version 1.0
 */
public class FileCounterStore implements CounterStore {

    private static final Logger logger = Logger.getLogger(FileCounterStore.class.getName());

    private static final Map<Path, ReentrantLock> JVM_LOCKS = new ConcurrentHashMap<>();
    private static final TypeReference<TreeMap<String, CounterEntry>> COUNTERS_TYPE = new TypeReference<>() {};

    private final Path file;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FileCounterStore(Path file) {
        this(file, Clock.systemUTC());
    }

    public FileCounterStore(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "File cannot be null").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        try {
            Path parent = this.file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory for counter file " + this.file, e);
        }
    }

    @Override
    public long increment(String key, Duration ttl) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(ttl, "TTL cannot be null");
        return update(counters -> {
            long now = clock.millis();
            CounterEntry entry = counters.get(key);
            long base = entry == null || entry.isExpired(now) ? 0 : entry.getValue();
            CounterEntry updated = new CounterEntry(base + 1, now + ttl.toMillis());
            counters.put(key, updated);
            return updated.getValue();
        });
    }

    @Override
    public long decrement(String key) {
        return update(counters -> {
            CounterEntry entry = counters.get(key);
            if (entry == null) {
                return 0L;
            }
            if (entry.isExpired(clock.millis())) {
                counters.remove(key);
                return 0L;
            }
            CounterEntry updated = new CounterEntry(Math.max(0, entry.getValue() - 1), entry.getExpiresAt());
            counters.put(key, updated);
            return updated.getValue();
        });
    }

    @Override
    public long get(String key) {
        return update(counters -> {
            CounterEntry entry = counters.get(key);
            return entry == null || entry.isExpired(clock.millis()) ? 0L : entry.getValue();
        });
    }

    @Override
    public void reset(String key) {
        update(counters -> {
            counters.remove(key);
            return 0L;
        });
    }

    @Override
    public int purgeExpired() {
        return update(counters -> {
            long now = clock.millis();
            int before = counters.size();
            counters.values().removeIf(entry -> entry.isExpired(now));
            return (long) (before - counters.size());
        }).intValue();
    }

    public Path getFile() {
        return file;
    }

    private Long update(Function<TreeMap<String, CounterEntry>, Long> mutation) {
        ReentrantLock jvmLock = JVM_LOCKS.computeIfAbsent(file, p -> new ReentrantLock());
        jvmLock.lock();
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            TreeMap<String, CounterEntry> counters = read(channel);
            Long result = mutation.apply(counters);
            write(channel, counters);
            return result;
        } catch (IOException e) {
            logger.severe("Counter file " + file + " could not be updated: " + e.getMessage());
            throw new UncheckedIOException("Failed to update counter file " + file, e);
        } finally {
            jvmLock.unlock();
        }
    }

    private TreeMap<String, CounterEntry> read(FileChannel channel) throws IOException {
        long size = channel.size();
        if (size == 0) {
            return new TreeMap<>();
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) size);
        channel.position(0);
        int read;
        do {
            read = channel.read(buffer);
        } while (read > 0 && buffer.hasRemaining());
        return objectMapper.readValue(buffer.array(), 0, buffer.position(), COUNTERS_TYPE);
    }

    private void write(FileChannel channel, TreeMap<String, CounterEntry> counters) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(counters);
        channel.truncate(0);
        channel.position(0);
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        channel.force(false);
    }

    /**
     * Persisted counter value with its absolute expiry in epoch milliseconds.
     */
    public static final class CounterEntry {
        private long value;
        private long expiresAt;

        public CounterEntry() {
        }

        public CounterEntry(long value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        public long getValue() {
            return value;
        }

        public void setValue(long value) {
            this.value = value;
        }

        public long getExpiresAt() {
            return expiresAt;
        }

        public void setExpiresAt(long expiresAt) {
            this.expiresAt = expiresAt;
        }

        boolean isExpired(long nowMillis) {
            return nowMillis >= expiresAt;
        }
    }
}
