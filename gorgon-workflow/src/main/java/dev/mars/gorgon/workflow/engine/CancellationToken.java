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

package dev.mars.gorgon.workflow.engine;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal. Cancelling a token cancels every child created from it;
 * long-running handlers poll {@link #isCancelled()} or register a callback.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<OnceCallback> callbacks = new CopyOnWriteArrayList<>();
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            children.forEach(CancellationToken::cancel);
            callbacks.forEach(OnceCallback::fire);
        }
    }

    /**
     * Registers a callback run once on cancellation, immediately if already cancelled.
     */
    public void onCancel(Runnable callback) {
        OnceCallback once = new OnceCallback(callback);
        callbacks.add(once);
        // cancel() may be iterating concurrently; whichever side fires first wins
        if (cancelled.get()) {
            once.fire();
        }
    }

    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        children.add(child);
        if (cancelled.get()) {
            child.cancel();
        }
        return child;
    }

    /**
     * Detaches a finished child so long-running parents do not accumulate them.
     */
    public void release(CancellationToken child) {
        children.remove(child);
    }

    private static final class OnceCallback {
        private final Runnable callback;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        OnceCallback(Runnable callback) {
            this.callback = callback;
        }

        void fire() {
            if (fired.compareAndSet(false, true)) {
                callback.run();
            }
        }
    }
}
