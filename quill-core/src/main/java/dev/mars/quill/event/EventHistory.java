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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded in-memory log of published events per job, used for replay.
 */
public class EventHistory {

    private final int maxEventsPerJob;
    private final Map<String, Deque<JobEvent>> eventsByJob = new ConcurrentHashMap<>();

    public EventHistory(int maxEventsPerJob) {
        this.maxEventsPerJob = maxEventsPerJob;
    }

    public void record(JobEvent event) {
        if (maxEventsPerJob <= 0) {
            return;
        }
        Deque<JobEvent> events = eventsByJob.computeIfAbsent(event.getJobId(), id -> new ArrayDeque<>());
        synchronized (events) {
            events.addLast(event);
            while (events.size() > maxEventsPerJob) {
                events.removeFirst();
            }
        }
    }

    public List<JobEvent> replay(String jobId) {
        Deque<JobEvent> events = eventsByJob.get(jobId);
        if (events == null) {
            return List.of();
        }
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public void clear(String jobId) {
        eventsByJob.remove(jobId);
    }

    public int getTrackedJobCount() {
        return eventsByJob.size();
    }
}
