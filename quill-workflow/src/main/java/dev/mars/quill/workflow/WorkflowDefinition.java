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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable declarative workflow: an identifier, a version and an ordered list of steps.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowDefinition {

    private final String id;
    private final String version;
    private final String description;
    private final List<StepSpec> steps;

    public WorkflowDefinition(String id, String version, String description, List<StepSpec> steps) {
        this.id = Objects.requireNonNull(id, "Workflow ID cannot be null");
        this.version = Objects.requireNonNull(version, "Workflow version cannot be null");
        this.description = description;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public WorkflowDefinition(String id, String version, List<StepSpec> steps) {
        this(id, version, null, steps);
    }

    public String getId() {
        return id;
    }

    public String getVersion() {
        return version;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public List<StepSpec> getSteps() {
        return steps;
    }

    public Optional<StepSpec> getStep(String stepId) {
        return steps.stream().filter(s -> s.getId().equals(stepId)).findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowDefinition that = (WorkflowDefinition) o;
        return id.equals(that.id) &&
               version.equals(that.version) &&
               Objects.equals(description, that.description) &&
               steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, description, steps);
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "id='" + id + '\'' +
               ", version='" + version + '\'' +
               ", steps=" + steps.size() +
               '}';
    }
}
