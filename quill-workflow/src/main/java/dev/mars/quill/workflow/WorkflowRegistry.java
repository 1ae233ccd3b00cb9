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

import dev.mars.quill.core.exceptions.WorkflowNotFoundException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Stores workflow definitions and caches their compiled graphs per {@code (id, version)}.
 *
 * <p>Registration compiles the definition first; a definition that fails to compile
 * is never stored. Re-registering an existing version replaces it. The most recently
 * registered version of a workflow is its current version.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowRegistry {

    private static final Logger logger = Logger.getLogger(WorkflowRegistry.class.getName());

    private final WorkflowCompiler compiler;
    private final Map<String, Map<String, Entry>> workflows = new HashMap<>();
    private long registrationCounter;

    public WorkflowRegistry(WorkflowCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "Compiler cannot be null");
    }

    /**
     * Compiles and stores the definition.
     *
     * @return the compiled graph
     * @throws CompileException if compilation fails; the registry is left unchanged
     */
    public synchronized CompiledGraph register(WorkflowDefinition definition) throws CompileException {
        CompiledGraph graph = compiler.compile(definition);
        workflows.computeIfAbsent(definition.getId(), k -> new LinkedHashMap<>())
                .put(definition.getVersion(), new Entry(definition, graph, ++registrationCounter));
        logger.info("Registered workflow " + definition.getId() + "@" + definition.getVersion()
                + " (" + graph.totalSteps() + " steps, " + graph.levelCount() + " levels)");
        return graph;
    }

    public synchronized WorkflowDefinition latest(String workflowId) throws WorkflowNotFoundException {
        return current(workflowId).definition;
    }

    public synchronized WorkflowDefinition definition(String workflowId, String version)
            throws WorkflowNotFoundException {
        return entry(workflowId, version).definition;
    }

    public synchronized CompiledGraph graph(String workflowId, String version) throws WorkflowNotFoundException {
        return entry(workflowId, version).graph;
    }

    public synchronized CompiledGraph currentGraph(String workflowId) throws WorkflowNotFoundException {
        return current(workflowId).graph;
    }

    /**
     * @return registered versions, oldest registration first
     */
    public synchronized List<String> versions(String workflowId) {
        Map<String, Entry> versions = workflows.get(workflowId);
        if (versions == null) {
            return List.of();
        }
        List<Entry> entries = new ArrayList<>(versions.values());
        entries.sort(Comparator.comparingLong(e -> e.order));
        return entries.stream().map(e -> e.definition.getVersion()).toList();
    }

    public synchronized boolean contains(String workflowId) {
        return workflows.containsKey(workflowId);
    }

    private Entry current(String workflowId) throws WorkflowNotFoundException {
        Map<String, Entry> versions = workflows.get(workflowId);
        if (versions == null || versions.isEmpty()) {
            throw new WorkflowNotFoundException(workflowId);
        }
        return versions.values().stream()
                .max(Comparator.comparingLong(e -> e.order))
                .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    private Entry entry(String workflowId, String version) throws WorkflowNotFoundException {
        Map<String, Entry> versions = workflows.get(workflowId);
        Entry entry = versions != null ? versions.get(version) : null;
        if (entry == null) {
            throw new WorkflowNotFoundException(workflowId, version);
        }
        return entry;
    }

    private static final class Entry {
        private final WorkflowDefinition definition;
        private final CompiledGraph graph;
        private final long order;

        private Entry(WorkflowDefinition definition, CompiledGraph graph, long order) {
            this.definition = definition;
            this.graph = graph;
            this.order = order;
        }
    }
}
