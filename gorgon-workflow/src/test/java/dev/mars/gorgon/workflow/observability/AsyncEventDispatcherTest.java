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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class AsyncEventDispatcherTest {

    private AsyncEventDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    @Test
    void deliversEventsInPublishOrder() {
        dispatcher = new AsyncEventDispatcher();
        List<String> seen = new CopyOnWriteArrayList<>();
        dispatcher.addListener(event -> seen.add(event.getStepId().orElse("?")));

        for (int i = 0; i < 50; i++) {
            dispatcher.publish(stepStarted("s" + i));
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 50);
        assertThat(seen).startsWith("s0", "s1", "s2").endsWith("s49");
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        dispatcher = new AsyncEventDispatcher();
        List<ExecutionEvent> seen = new CopyOnWriteArrayList<>();
        dispatcher.addListener(event -> {
            throw new IllegalStateException("listener broke");
        });
        dispatcher.addListener(seen::add);

        dispatcher.publish(stepStarted("a"));
        dispatcher.publish(stepStarted("b"));

        await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 2);
    }

    @Test
    void fullBufferDropsWithoutBlocking() throws Exception {
        dispatcher = new AsyncEventDispatcher(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch first = new CountDownLatch(1);
        dispatcher.addListener(event -> {
            first.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        dispatcher.publish(stepStarted("held"));
        assertThat(first.await(5, TimeUnit.SECONDS)).isTrue();
        dispatcher.publish(stepStarted("queued"));
        dispatcher.publish(stepStarted("dropped-1"));
        dispatcher.publish(stepStarted("dropped-2"));

        assertThat(dispatcher.getDroppedCount()).isEqualTo(2);
        release.countDown();
    }

    @Test
    void closeFlushesBufferedEventsAndRejectsNewOnes() {
        dispatcher = new AsyncEventDispatcher();
        List<ExecutionEvent> seen = new CopyOnWriteArrayList<>();
        dispatcher.addListener(seen::add);
        dispatcher.publish(stepStarted("a"));

        dispatcher.close();
        dispatcher.publish(stepStarted("late"));

        assertThat(seen).extracting(event -> event.getStepId().orElse(null)).containsExactly("a");
        assertThat(dispatcher.getDroppedCount()).isEqualTo(1);
    }

    @Test
    void removedListenerStopsReceiving() {
        dispatcher = new AsyncEventDispatcher();
        List<ExecutionEvent> removed = new CopyOnWriteArrayList<>();
        List<ExecutionEvent> kept = new CopyOnWriteArrayList<>();
        ExecutionEventListener listener = removed::add;
        dispatcher.addListener(listener);
        dispatcher.addListener(kept::add);
        dispatcher.removeListener(listener);

        dispatcher.publish(stepStarted("a"));

        await().atMost(Duration.ofSeconds(5)).until(() -> kept.size() == 1);
        assertThat(removed).isEmpty();
    }

    private static ExecutionEvent stepStarted(String stepId) {
        return ExecutionEvent.builder(ExecutionEvent.Type.STEP_STARTED, "exec", "wf")
                .step(stepId, null)
                .build();
    }
}
