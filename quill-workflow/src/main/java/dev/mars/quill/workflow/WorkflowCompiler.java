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

import dev.mars.quill.workflow.step.StepRegistry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Compiles a {@link WorkflowDefinition} into a {@link CompiledGraph}.
 *
 * <p>Compilation validates step ids, dependencies and (when a {@link StepRegistry} is
 * supplied) step refs, detects cycles by depth-first traversal and then assigns levels
 * with a layered topological sort. The compiler is stateless: compiling the same
 * definition twice yields equal graphs.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowCompiler {

    private static final Logger logger = Logger.getLogger(WorkflowCompiler.class.getName());

    private final StepRegistry stepRegistry;

    public WorkflowCompiler() {
        this(null);
    }

    /**
     * @param stepRegistry registry used to verify step refs, or {@code null} to skip the check
     */
    public WorkflowCompiler(StepRegistry stepRegistry) {
        this.stepRegistry = stepRegistry;
    }

    public CompiledGraph compile(WorkflowDefinition definition) throws CompileException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        String workflowId = definition.getId();

        ValidationResult validation = validate(definition);
        if (!validation.isValid()) {
            throw new CompileException(workflowId, validation);
        }

        Map<String, StepSpec> steps = new TreeMap<>();
        Map<String, Set<String>> dependencies = new TreeMap<>();
        for (StepSpec step : definition.getSteps()) {
            steps.put(step.getId(), step);
            dependencies.put(step.getId(), new TreeSet<>(step.getDependsOn()));
        }

        List<String> cycle = findCycle(dependencies);
        if (cycle != null) {
            validation.addError("steps." + cycle.get(0) + ".dependsOn",
                    "Circular dependency: " + String.join(" -> ", cycle));
            throw new CycleException(workflowId, cycle, validation);
        }

        List<ExecutionLevel> levels = assignLevels(dependencies);
        CompiledGraph graph = new CompiledGraph(workflowId, definition.getVersion(), steps, dependencies, levels);
        logger.fine("Compiled workflow " + workflowId + "@" + definition.getVersion()
                + " into " + levels.size() + " levels");
        return graph;
    }

    /**
     * Checks the structural rules that do not require graph traversal.
     */
    public ValidationResult validate(WorkflowDefinition definition) {
        ValidationResult result = new ValidationResult();

        if (definition.getSteps().isEmpty()) {
            result.addWarning("steps", "Workflow defines no steps");
        }

        Set<String> ids = new HashSet<>();
        for (StepSpec step : definition.getSteps()) {
            if (step.getId().isBlank()) {
                result.addError("steps", "Step id cannot be blank");
            } else if (!ids.add(step.getId())) {
                result.addError("steps." + step.getId(), "Duplicate step id: " + step.getId());
            }
        }

        for (StepSpec step : definition.getSteps()) {
            for (String dependency : step.getDependsOn()) {
                if (!ids.contains(dependency)) {
                    result.addError("steps." + step.getId() + ".dependsOn",
                            "Dependency '" + dependency + "' not found");
                }
            }
            if (stepRegistry != null && !stepRegistry.contains(step.getRef())) {
                result.addError("steps." + step.getId() + ".ref",
                        "No step registered for ref '" + step.getRef() + "'");
            }
            if (!step.isParallel() && step.getExclusiveTag().isEmpty()) {
                result.addWarning("steps." + step.getId() + ".parallel",
                        "Non-parallel step without exclusive tag runs alone in its level");
            }
        }
        return result;
    }

    /**
     * Depth-first search along dependency edges, visiting steps in id order.
     *
     * @return the cycle path closed on its first step, or {@code null} if the graph is acyclic
     */
    private List<String> findCycle(Map<String, Set<String>> dependencies) {
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        List<String> path = new ArrayList<>();

        for (String stepId : dependencies.keySet()) {
            if (!visited.contains(stepId)) {
                List<String> cycle = visit(stepId, dependencies, visited, onStack, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        return null;
    }

    private List<String> visit(String stepId, Map<String, Set<String>> dependencies,
                               Set<String> visited, Set<String> onStack, List<String> path) {
        visited.add(stepId);
        onStack.add(stepId);
        path.add(stepId);

        for (String dependency : dependencies.get(stepId)) {
            if (onStack.contains(dependency)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                return cycle;
            }
            if (!visited.contains(dependency)) {
                List<String> cycle = visit(dependency, dependencies, visited, onStack, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }

        onStack.remove(stepId);
        path.remove(path.size() - 1);
        return null;
    }

    private List<ExecutionLevel> assignLevels(Map<String, Set<String>> dependencies) {
        Map<String, Integer> remaining = new HashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            remaining.put(entry.getKey(), entry.getValue().size());
            for (String dependency : entry.getValue()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(entry.getKey());
            }
        }

        List<ExecutionLevel> levels = new ArrayList<>();
        Set<String> current = new TreeSet<>();
        for (Map.Entry<String, Integer> entry : remaining.entrySet()) {
            if (entry.getValue() == 0) {
                current.add(entry.getKey());
            }
        }

        while (!current.isEmpty()) {
            levels.add(new ExecutionLevel(levels.size(), new ArrayList<>(current)));
            Set<String> next = new TreeSet<>();
            for (String stepId : current) {
                for (String dependent : dependents.getOrDefault(stepId, List.of())) {
                    if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                        next.add(dependent);
                    }
                }
            }
            current = next;
        }
        return levels;
    }
}
