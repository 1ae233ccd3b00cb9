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
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Immutable per-attempt view handed to a {@link Step}.
 *
 * <p>Holds the job inputs and the outputs of every step completed before the
 * current level. The maps are unmodifiable snapshots, so no step can observe or
 * change another step's view.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class StepContext {

    private final String jobId;
    private final String stepId;
    private final int attempt;
    private final Map<String, Object> params;
    private final Map<String, Object> inputs;
    private final Map<String, Object> outputs;
    private final BooleanSupplier cancelled;

    private StepContext(Builder builder) {
        this.jobId = Objects.requireNonNull(builder.jobId, "Job ID cannot be null");
        this.stepId = Objects.requireNonNull(builder.stepId, "Step ID cannot be null");
        this.attempt = builder.attempt;
        this.params = snapshot(builder.params);
        this.inputs = snapshot(builder.inputs);
        this.outputs = snapshot(builder.outputs);
        this.cancelled = builder.cancelled;
    }

    public static Builder builder(String jobId, String stepId) {
        return new Builder(jobId, stepId);
    }

    public String getJobId() {
        return jobId;
    }

    public String getStepId() {
        return stepId;
    }

    /**
     * @return 1 for the first attempt, incremented for each retry
     */
    public int getAttempt() {
        return attempt;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public Optional<Object> getOutput(String stepId) {
        return Optional.ofNullable(outputs.get(stepId));
    }

    public Optional<Object> getInput(String key) {
        return Optional.ofNullable(inputs.get(key));
    }

    public boolean isCancelled() {
        return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    /**
     * Copies this context for another attempt of the same step.
     */
    public StepContext forAttempt(int nextAttempt, BooleanSupplier cancellation) {
        return new Builder(jobId, stepId)
                .attempt(nextAttempt)
                .params(params)
                .inputs(inputs)
                .outputs(outputs)
                .cancelled(cancellation)
                .build();
    }

    private static Map<String, Object> snapshot(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new HashMap<>(source));
    }

    @Override
    public String toString() {
        return "StepContext{jobId='" + jobId + "', stepId='" + stepId + "', attempt=" + attempt + '}';
    }

    public static final class Builder {
        private final String jobId;
        private final String stepId;
        private int attempt = 1;
        private Map<String, Object> params = Map.of();
        private Map<String, Object> inputs = Map.of();
        private Map<String, Object> outputs = Map.of();
        private BooleanSupplier cancelled = () -> false;

        private Builder(String jobId, String stepId) {
            this.jobId = jobId;
            this.stepId = stepId;
        }

        public Builder attempt(int attempt) {
            if (attempt < 1) {
                throw new IllegalArgumentException("Attempt must be at least 1: " + attempt);
            }
            this.attempt = attempt;
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder inputs(Map<String, Object> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder cancelled(BooleanSupplier cancelled) {
            this.cancelled = Objects.requireNonNull(cancelled, "Cancellation supplier cannot be null");
            return this;
        }

        public StepContext build() {
            return new StepContext(this);
        }
    }
}
