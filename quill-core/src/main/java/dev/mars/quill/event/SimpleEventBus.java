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
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process {@link EventBus} with synchronous delivery.
 *
 * <p>Each job has its own channel; publishing takes the channel's lock, assigns
 * the next sequence number and delivers to matching subscribers before
 * releasing it. That keeps a job's events in emission order even when they are
 * published from several executor threads, while different jobs never contend.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SimpleEventBus implements EventBus {

    private static final Logger logger = Logger.getLogger(SimpleEventBus.class.getName());

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final Map<String, JobChannel> channels = new ConcurrentHashMap<>();
    private final EventHistory history;

    public SimpleEventBus() {
        this(new EventHistory(1000));
    }

    public SimpleEventBus(EventHistory history) {
        this.history = Objects.requireNonNull(history, "Event history cannot be null");
    }

    @Override
    public JobEvent publish(JobEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        JobChannel channel = channels.computeIfAbsent(event.getJobId(), id -> new JobChannel());

        synchronized (channel) {
            JobEvent sequenced = event.withSequence(++channel.lastSequence);
            history.record(sequenced);

            for (Registration registration : registrations) {
                if (registration.active && registration.filter.matches(sequenced)) {
                    deliver(registration, sequenced);
                }
            }
            return sequenced;
        }
    }

    @Override
    public EventSubscription subscribe(EventFilter filter, EventListener listener) {
        Registration registration = new Registration(
                Objects.requireNonNull(filter, "Filter cannot be null"),
                Objects.requireNonNull(listener, "Listener cannot be null"));
        registrations.add(registration);
        logger.fine("Subscriber registered with " + filter);
        return registration;
    }

    @Override
    public List<JobEvent> replay(String jobId) {
        return history.replay(jobId);
    }

    @Override
    public void release(String jobId) {
        channels.remove(Objects.requireNonNull(jobId, "Job ID cannot be null"));
        history.clear(jobId);
        logger.fine("Released event channel for job " + jobId);
    }

    public int getSubscriberCount() {
        return registrations.size();
    }

    public int getChannelCount() {
        return channels.size();
    }

    private void deliver(Registration registration, JobEvent event) {
        try {
            registration.listener.onEvent(event);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Event listener failed for " + event.getType()
                    + " on job " + event.getJobId() + ": " + e.getMessage());
            if (logger.isLoggable(Level.FINE)) {
                logger.log(Level.FINE, "Event listener exception details", e);
            }
        }
    }

    private static final class JobChannel {
        private long lastSequence;
    }

    private final class Registration implements EventSubscription {
        private final EventFilter filter;
        private final EventListener listener;
        private volatile boolean active = true;

        private Registration(EventFilter filter, EventListener listener) {
            this.filter = filter;
            this.listener = listener;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void close() {
            active = false;
            registrations.remove(this);
        }
    }
}
