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

package dev.mars.quill.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SimpleEventBusTest {

    private SimpleEventBus bus;

    @BeforeEach
    void setUp() {
        bus = new SimpleEventBus(new EventHistory(100));
    }

    @Test
    void deliversToMatchingSubscribersOnly() {
        List<JobEvent> jobA = new ArrayList<>();
        List<JobEvent> failures = new ArrayList<>();
        bus.subscribe(EventFilter.forJob("a"), jobA::add);
        bus.subscribe(EventFilter.forTypes(EventType.JOB_FAILED, EventType.STEP_FAILED), failures::add);

        bus.publish(JobEvent.of(EventType.JOB_STARTED, "a"));
        bus.publish(JobEvent.of(EventType.JOB_FAILED, "b"));
        bus.publish(JobEvent.forStep(EventType.STEP_FAILED, "a", "s1", Map.of("error", "boom")));

        assertEquals(2, jobA.size());
        assertEquals(2, failures.size());
        assertEquals("s1", jobA.get(1).getStepId().orElseThrow());
    }

    @Test
    void throwingListenerDoesNotAffectOthers() {
        List<JobEvent> received = new ArrayList<>();
        bus.subscribe(EventFilter.all(), event -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe(EventFilter.all(), received::add);

        JobEvent published = bus.publish(JobEvent.of(EventType.JOB_CREATED, "a"));

        assertEquals(1, received.size());
        assertEquals(published.getSequence(), received.get(0).getSequence());
    }

    @Test
    void closedSubscriptionStopsDelivery() {
        List<JobEvent> received = new ArrayList<>();
        EventSubscription subscription = bus.subscribe(EventFilter.all(), received::add);

        bus.publish(JobEvent.of(EventType.JOB_CREATED, "a"));
        subscription.close();
        bus.publish(JobEvent.of(EventType.JOB_STARTED, "a"));

        assertFalse(subscription.isActive());
        assertEquals(1, received.size());
        assertEquals(0, bus.getSubscriberCount());
    }

    @Test
    void lateSubscriberOnlySeesLaterEventsButReplayHasAll() {
        bus.publish(JobEvent.of(EventType.JOB_CREATED, "a"));
        List<JobEvent> received = new ArrayList<>();
        bus.subscribe(EventFilter.forJob("a"), received::add);
        bus.publish(JobEvent.of(EventType.JOB_STARTED, "a"));

        assertEquals(1, received.size());
        assertThat(bus.replay("a"))
                .extracting(JobEvent::getType)
                .containsExactly(EventType.JOB_CREATED, EventType.JOB_STARTED);
    }

    @Test
    void releaseDropsHistoryAndRestartsSequence() {
        bus.publish(JobEvent.of(EventType.JOB_CREATED, "a"));
        bus.publish(JobEvent.of(EventType.JOB_STARTED, "a"));
        bus.publish(JobEvent.of(EventType.JOB_CREATED, "b"));

        bus.release("a");

        assertTrue(bus.replay("a").isEmpty());
        assertEquals(1, bus.replay("b").size());
        assertEquals(1, bus.getChannelCount());
        assertEquals(1L, bus.publish(JobEvent.of(EventType.JOB_CREATED, "a")).getSequence());
    }

    @Test
    void sequencesArePerJobAndStrictlyIncreasingUnderConcurrency() throws Exception {
        List<JobEvent> received = Collections.synchronizedList(new ArrayList<>());
        bus.subscribe(EventFilter.forJob("a"), received::add);

        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < threads; i++) {
            pool.submit(() -> {
                start.await();
                for (int j = 0; j < perThread; j++) {
                    bus.publish(JobEvent.of(EventType.STEP_STARTED, "a"));
                    bus.publish(JobEvent.of(EventType.STEP_STARTED, "b"));
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(threads * perThread, received.size());
        for (int i = 0; i < received.size(); i++) {
            assertEquals(i + 1, received.get(i).getSequence(), "delivery order must follow sequence");
        }
        assertEquals(threads * perThread, bus.replay("b").get(threads * perThread - 1).getSequence());
    }
}
