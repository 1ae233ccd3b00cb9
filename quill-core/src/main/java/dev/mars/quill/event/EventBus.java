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

import java.util.List;

/**
 * Publishes job lifecycle and progress events to registered subscribers.
 *
 * <p>Delivery is best-effort and at-most-once. A subscriber only sees events
 * published after it subscribed. Events of one job reach every subscriber in
 * the order they were published; there is no ordering across jobs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface EventBus {

    /**
     * Publishes an event, assigning its per-job sequence number.
     *
     * @param event the event to publish
     * @return the event as delivered, carrying its sequence number
     */
    JobEvent publish(JobEvent event);

    /**
     * Registers a listener for events matching the filter.
     *
     * @param filter   which events to deliver
     * @param listener the callback, invoked on the publishing thread
     * @return a handle that cancels the subscription when closed
     */
    EventSubscription subscribe(EventFilter filter, EventListener listener);

    /**
     * Returns the retained history of a job's events, oldest first.
     * Implementations without history return an empty list.
     *
     * @param jobId the job identifier
     * @return the retained events
     */
    List<JobEvent> replay(String jobId);

    /**
     * Drops everything the bus keeps for a job: its retained history and its sequence
     * counter. A later event for the same id starts a new sequence at 1.
     *
     * @param jobId the job identifier
     */
    void release(String jobId);
}
