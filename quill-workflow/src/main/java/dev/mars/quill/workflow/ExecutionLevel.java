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

/**
 * A set of mutually independent steps dispatched together. Step ids are sorted.
 */
public final class ExecutionLevel {

    private final int index;
    private final List<String> stepIds;

    public ExecutionLevel(int index, List<String> stepIds) {
        if (index < 0) {
            throw new IllegalArgumentException("Level index cannot be negative: " + index);
        }
        this.index = index;
        this.stepIds = stepIds.stream().sorted().toList();
    }

    public int getIndex() {
        return index;
    }

    public List<String> getStepIds() {
        return stepIds;
    }

    public int size() {
        return stepIds.size();
    }

    public boolean contains(String stepId) {
        return stepIds.contains(stepId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionLevel that = (ExecutionLevel) o;
        return index == that.index && stepIds.equals(that.stepIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, stepIds);
    }

    @Override
    public String toString() {
        return "Level" + index + stepIds;
    }
}
