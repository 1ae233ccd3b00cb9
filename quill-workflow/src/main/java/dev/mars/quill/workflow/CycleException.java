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

/**
 * Compile failure caused by a circular dependency.
 *
 * <p>{@link #getCycle()} lists the step ids along the cycle, starting and ending
 * with the same step, e.g. {@code [a, b, a]}. A self-dependency yields {@code [a, a]}.</p>
 */
public class CycleException extends CompileException {

    private final List<String> cycle;

    public CycleException(String workflowId, List<String> cycle, ValidationResult validationResult) {
        super(workflowId, "Workflow '" + workflowId + "' contains circular dependency: "
                + String.join(" -> ", cycle), validationResult);
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
