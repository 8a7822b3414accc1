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

package dev.mars.gorgon.workflow.observability;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffers events and delivers them to listeners on a single daemon thread.
 * <p>
 * {@link #publish(ExecutionEvent)} never blocks: when the buffer is full the event is
 * dropped and counted. Listener failures are logged and do not stop delivery.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-09
 * @version 1.0
 */
public class AsyncEventDispatcher implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(AsyncEventDispatcher.class.getName());

    public static final int DEFAULT_CAPACITY = 10_000;

    private final BlockingQueue<ExecutionEvent> queue;
    private final List<ExecutionEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong dropped = new AtomicLong();
    private final Thread worker;
    private volatile boolean running = true;

    public AsyncEventDispatcher() {
        this(DEFAULT_CAPACITY);
    }

    public AsyncEventDispatcher(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.worker = new Thread(this::drain, "gorgon-event-dispatcher");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    public void addListener(ExecutionEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ExecutionEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(ExecutionEvent event) {
        if (!running || !queue.offer(event)) {
            long count = dropped.incrementAndGet();
            if (count == 1 || count % 1000 == 0) {
                logger.warning("Dropped " + count + " execution events; dispatcher is full or closed");
            }
        }
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    private void drain() {
        while (running || !queue.isEmpty()) {
            ExecutionEvent event;
            try {
                event = queue.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event != null) {
                deliver(event);
            }
        }
    }

    private void deliver(ExecutionEvent event) {
        for (ExecutionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Event listener " + listener.getClass().getSimpleName()
                        + " failed on " + event.getType() + ": " + e.getMessage());
                if (logger.isLoggable(Level.FINE)) {
                    logger.log(Level.FINE, "Event listener failure details", e);
                }
            }
        }
    }

    /**
     * Stops accepting events and waits briefly for buffered ones to be delivered.
     */
    @Override
    public void close() {
        running = false;
        try {
            worker.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
