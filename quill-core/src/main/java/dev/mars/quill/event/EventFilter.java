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

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Selects which events a subscriber receives.
 */
public final class EventFilter {

    private static final EventFilter ALL = new EventFilter(null, EnumSet.allOf(EventType.class));

    private final String jobId;
    private final Set<EventType> types;

    private EventFilter(String jobId, Set<EventType> types) {
        this.jobId = jobId;
        this.types = types.isEmpty() ? EnumSet.noneOf(EventType.class) : EnumSet.copyOf(types);
    }

    public static EventFilter all() {
        return ALL;
    }

    public static EventFilter forJob(String jobId) {
        return new EventFilter(Objects.requireNonNull(jobId, "Job ID cannot be null"),
                EnumSet.allOf(EventType.class));
    }

    public static EventFilter forTypes(EventType first, EventType... rest) {
        return new EventFilter(null, EnumSet.of(first, rest));
    }

    public EventFilter withTypes(EventType first, EventType... rest) {
        return new EventFilter(jobId, EnumSet.of(first, rest));
    }

    public boolean matches(JobEvent event) {
        if (jobId != null && !jobId.equals(event.getJobId())) {
            return false;
        }
        return types.contains(event.getType());
    }

    @Override
    public String toString() {
        return "EventFilter{jobId=" + (jobId != null ? jobId : "*") + ", types=" + types + '}';
    }
}
