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

package dev.mars.quill.workflow.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Per-step results of one executed level, keyed and ordered by step id.
 */
public final class LevelResult {

    private final int levelIndex;
    private final Map<String, StepResult> results;

    public LevelResult(int levelIndex, Map<String, StepResult> results) {
        this.levelIndex = levelIndex;
        this.results = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(results)));
    }

    public int getLevelIndex() {
        return levelIndex;
    }

    public Map<String, StepResult> getResults() {
        return results;
    }

    public StepResult get(String stepId) {
        return results.get(stepId);
    }

    public List<StepResult> getSucceeded() {
        return results.values().stream().filter(StepResult::isSuccessful).toList();
    }

    public List<StepResult> getFailed() {
        return results.values().stream().filter(r -> r.getStatus().isFailure()).toList();
    }

    public int getSuccessCount() {
        return getSucceeded().size();
    }

    public int getFailureCount() {
        return getFailed().size();
    }

    public boolean isSuccessful() {
        return getFailureCount() == 0;
    }

    /**
     * Outputs of the successful steps, keyed by step id. Values may be {@code null}.
     */
    public Map<String, Object> getOutputs() {
        Map<String, Object> outputs = new LinkedHashMap<>();
        for (StepResult result : getSucceeded()) {
            outputs.put(result.getStepId(), result.getOutput());
        }
        return outputs;
    }

    @Override
    public String toString() {
        return "LevelResult{" +
               "level=" + levelIndex +
               ", succeeded=" + getSuccessCount() +
               ", failed=" + getFailureCount() +
               '}';
    }
}
