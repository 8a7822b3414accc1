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

package dev.mars.gorgon.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The mutable variable store threaded through one execution.
 * <p>
 * The scheduler owns the context: it hands steps immutable {@link #snapshot() snapshots}
 * and writes step outputs back through {@link #merge(Map)}, which applies a whole binding
 * set atomically with respect to other merges and snapshots. Values are treated as
 * immutable once bound.
 */
public class VariableContext {

    private final Map<String, Object> variables;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public VariableContext() {
        this.variables = new LinkedHashMap<>();
    }

    public VariableContext(Map<String, ?> initial) {
        this.variables = new LinkedHashMap<>();
        if (initial != null) {
            this.variables.putAll(initial);
        }
    }

    /**
     * Gets a read-only copy of the current bindings.
     */
    public Map<String, Object> snapshot() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Applies a set of bindings as one critical section.
     */
    public void merge(Map<String, ?> bindings) {
        if (bindings == null || bindings.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            variables.putAll(bindings);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void put(String name, Object value) {
        lock.writeLock().lock();
        try {
            variables.put(name, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Object> get(String name) {
        lock.readLock().lock();
        try {
            return VariableResolver.lookup(variables, name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String name) {
        lock.readLock().lock();
        try {
            return variables.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Creates an independent context seeded with this context's bindings plus {@code extra}.
     */
    public VariableContext child(Map<String, ?> extra) {
        VariableContext child = new VariableContext(snapshot());
        child.merge(extra);
        return child;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return variables.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "VariableContext{variables=" + snapshot().keySet() + '}';
    }
}
