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

package dev.mars.quill.checkpoint;

import java.util.List;

/**
 * Outcome of pruning a job's checkpoints.
 */
public final class CleanupResult {

    private final int kept;
    private final List<String> deletedIds;

    public CleanupResult(int kept, List<String> deletedIds) {
        this.kept = kept;
        this.deletedIds = deletedIds != null ? List.copyOf(deletedIds) : List.of();
    }

    public int getKept() {
        return kept;
    }

    public int getDeleted() {
        return deletedIds.size();
    }

    /**
     * Identifiers of the deleted checkpoints, in deletion order (oldest first).
     */
    public List<String> getDeletedIds() {
        return deletedIds;
    }

    @Override
    public String toString() {
        return "CleanupResult{kept=" + kept + ", deleted=" + deletedIds.size() + '}';
    }
}
