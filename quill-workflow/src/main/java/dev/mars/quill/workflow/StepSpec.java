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

package dev.mars.quill.workflow;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Declaration of a single step within a workflow.
 *
 * <p>Instances are immutable and created through {@link #builder(String, String)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class StepSpec {

    private final String id;
    private final String ref;
    private final Set<String> dependsOn;
    private final Duration timeout;
    private final int retries;
    private final boolean continueOnError;
    private final boolean parallel;
    private final String exclusiveTag;
    private final StepCondition condition;
    private final Map<String, Object> params;

    private StepSpec(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Step ID cannot be null");
        this.ref = Objects.requireNonNull(builder.ref, "Step ref cannot be null");
        this.dependsOn = Collections.unmodifiableSet(new TreeSet<>(builder.dependsOn));
        this.timeout = builder.timeout;
        this.retries = builder.retries;
        this.continueOnError = builder.continueOnError;
        this.parallel = builder.parallel;
        this.exclusiveTag = builder.exclusiveTag;
        this.condition = builder.condition;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
    }

    public static Builder builder(String id, String ref) {
        return new Builder(id, ref);
    }

    public String getId() {
        return id;
    }

    public String getRef() {
        return ref;
    }

    public Set<String> getDependsOn() {
        return dependsOn;
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * @return additional attempts after the first one
     */
    public int getRetries() {
        return retries;
    }

    public boolean isContinueOnError() {
        return continueOnError;
    }

    public boolean isParallel() {
        return parallel;
    }

    public Optional<String> getExclusiveTag() {
        return Optional.ofNullable(exclusiveTag);
    }

    public Optional<StepCondition> getCondition() {
        return Optional.ofNullable(condition);
    }

    public Map<String, Object> getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepSpec stepSpec = (StepSpec) o;
        return retries == stepSpec.retries &&
               continueOnError == stepSpec.continueOnError &&
               parallel == stepSpec.parallel &&
               id.equals(stepSpec.id) &&
               ref.equals(stepSpec.ref) &&
               dependsOn.equals(stepSpec.dependsOn) &&
               Objects.equals(timeout, stepSpec.timeout) &&
               Objects.equals(exclusiveTag, stepSpec.exclusiveTag) &&
               Objects.equals(condition, stepSpec.condition) &&
               params.equals(stepSpec.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, ref, dependsOn, timeout, retries, continueOnError, parallel,
                exclusiveTag, condition, params);
    }

    @Override
    public String toString() {
        return "StepSpec{" +
               "id='" + id + '\'' +
               ", ref='" + ref + '\'' +
               ", dependsOn=" + dependsOn +
               ", retries=" + retries +
               ", continueOnError=" + continueOnError +
               ", parallel=" + parallel +
               (exclusiveTag != null ? ", exclusiveTag='" + exclusiveTag + '\'' : "") +
               '}';
    }

    public static final class Builder {
        private final String id;
        private final String ref;
        private final Set<String> dependsOn = new TreeSet<>();
        private Duration timeout;
        private int retries;
        private boolean continueOnError;
        private boolean parallel = true;
        private String exclusiveTag;
        private StepCondition condition;
        private final Map<String, Object> params = new LinkedHashMap<>();

        private Builder(String id, String ref) {
            this.id = id;
            this.ref = ref;
        }

        public Builder dependsOn(String... stepIds) {
            for (String stepId : stepIds) {
                dependsOn.add(Objects.requireNonNull(stepId, "Dependency cannot be null"));
            }
            return this;
        }

        public Builder dependsOn(Iterable<String> stepIds) {
            for (String stepId : stepIds) {
                dependsOn.add(Objects.requireNonNull(stepId, "Dependency cannot be null"));
            }
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("Timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder retries(int retries) {
            if (retries < 0) {
                throw new IllegalArgumentException("Retries cannot be negative: " + retries);
            }
            this.retries = retries;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder exclusiveTag(String exclusiveTag) {
            this.exclusiveTag = exclusiveTag;
            return this;
        }

        public Builder condition(StepCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder param(String key, Object value) {
            params.put(key, value);
            return this;
        }

        public Builder params(Map<String, Object> values) {
            if (values != null) {
                params.putAll(values);
            }
            return this;
        }

        public StepSpec build() {
            return new StepSpec(this);
        }
    }
}
