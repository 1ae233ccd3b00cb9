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

package dev.mars.quill.workflow.step;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Explicit mapping from step ref to a factory producing {@link Step} instances.
 *
 * <p>A fresh instance is created for every dispatch so steps may keep per-run state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StepRegistry {

    private static final Logger logger = Logger.getLogger(StepRegistry.class.getName());

    private final Map<String, Supplier<? extends Step>> factories = new ConcurrentHashMap<>();

    public StepRegistry register(String ref, Supplier<? extends Step> factory) {
        Objects.requireNonNull(ref, "Step ref cannot be null");
        Objects.requireNonNull(factory, "Step factory cannot be null");
        if (factories.putIfAbsent(ref, factory) != null) {
            throw new IllegalStateException("Step ref already registered: " + ref);
        }
        logger.fine("Registered step ref: " + ref);
        return this;
    }

    /**
     * Registers a stateless step shared across dispatches.
     */
    public StepRegistry registerInstance(String ref, Step step) {
        Objects.requireNonNull(step, "Step cannot be null");
        return register(ref, () -> step);
    }

    public boolean contains(String ref) {
        return factories.containsKey(ref);
    }

    /**
     * @throws IllegalArgumentException if nothing is registered under {@code ref}
     */
    public Step create(String ref) {
        Supplier<? extends Step> factory = factories.get(ref);
        if (factory == null) {
            throw new IllegalArgumentException("No step registered for ref: " + ref);
        }
        return Objects.requireNonNull(factory.get(), "Step factory returned null for ref: " + ref);
    }

    public Set<String> getRefs() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }
}
