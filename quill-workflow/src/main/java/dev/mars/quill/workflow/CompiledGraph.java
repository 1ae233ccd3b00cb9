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

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Executable plan derived from a {@link WorkflowDefinition}.
 *
 * <p>The graph is acyclic and every step belongs to exactly one {@link ExecutionLevel},
 * placed strictly after the levels of all its dependencies. Instances are immutable
 * and only produced by {@link WorkflowCompiler}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class CompiledGraph {

    private final String workflowId;
    private final String version;
    private final Map<String, StepSpec> steps;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;
    private final List<ExecutionLevel> levels;
    private final Map<String, Integer> levelIndex;

    CompiledGraph(String workflowId, String version, Map<String, StepSpec> steps,
                  Map<String, Set<String>> dependencies, List<ExecutionLevel> levels) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.version = Objects.requireNonNull(version, "Workflow version cannot be null");
        this.steps = Collections.unmodifiableMap(new TreeMap<>(steps));
        this.levels = List.copyOf(levels);

        Map<String, Set<String>> deps = new TreeMap<>();
        Map<String, Set<String>> reverse = new TreeMap<>();
        for (String stepId : this.steps.keySet()) {
            reverse.put(stepId, new TreeSet<>());
        }
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            deps.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
            for (String dependency : entry.getValue()) {
                reverse.get(dependency).add(entry.getKey());
            }
        }
        reverse.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.dependencies = Collections.unmodifiableMap(deps);
        this.dependents = Collections.unmodifiableMap(reverse);

        Map<String, Integer> index = new TreeMap<>();
        for (ExecutionLevel level : this.levels) {
            for (String stepId : level.getStepIds()) {
                index.put(stepId, level.getIndex());
            }
        }
        this.levelIndex = Collections.unmodifiableMap(index);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getVersion() {
        return version;
    }

    public List<ExecutionLevel> getLevels() {
        return levels;
    }

    public ExecutionLevel getLevel(int index) {
        return levels.get(index);
    }

    public int levelCount() {
        return levels.size();
    }

    public int totalSteps() {
        return steps.size();
    }

    public Set<String> getStepIds() {
        return steps.keySet();
    }

    public boolean containsStep(String stepId) {
        return steps.containsKey(stepId);
    }

    public StepSpec getStep(String stepId) {
        StepSpec step = steps.get(stepId);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step '" + stepId + "' in workflow " + workflowId);
        }
        return step;
    }

    /**
     * Returns the index of the level containing the step.
     *
     * @throws IllegalArgumentException if the step is not part of this graph
     */
    public int levelOf(String stepId) {
        Integer index = levelIndex.get(stepId);
        if (index == null) {
            throw new IllegalArgumentException("Unknown step '" + stepId + "' in workflow " + workflowId);
        }
        return index;
    }

    public Set<String> getDependencies(String stepId) {
        return dependencies.getOrDefault(stepId, Set.of());
    }

    public Set<String> getDependents(String stepId) {
        return dependents.getOrDefault(stepId, Set.of());
    }

    /**
     * Collects every step that depends on the given step directly or indirectly.
     *
     * @param stepId the root step
     * @return sorted set of dependent step ids, excluding the root
     */
    public Set<String> transitiveDependents(String stepId) {
        Set<String> result = new TreeSet<>();
        Deque<String> pending = new ArrayDeque<>(getDependents(stepId));
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (result.add(current)) {
                pending.addAll(getDependents(current));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CompiledGraph that = (CompiledGraph) o;
        return workflowId.equals(that.workflowId) &&
               version.equals(that.version) &&
               steps.equals(that.steps) &&
               dependencies.equals(that.dependencies) &&
               levels.equals(that.levels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, version, steps, dependencies, levels);
    }

    @Override
    public String toString() {
        return "CompiledGraph{" +
               "workflow='" + workflowId + '@' + version + '\'' +
               ", levels=" + levels +
               '}';
    }
}
