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

package dev.mars.quill.core.exceptions;

import java.util.List;

/**
 * Thrown when a checkpoint snapshot cannot be applied to the graph currently
 * compiled for its workflow.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class VersionMismatchException extends QuillException {

    private final String checkpointId;
    private final String snapshotVersion;
    private final String currentVersion;
    private final List<String> problems;

    public VersionMismatchException(String checkpointId, String snapshotVersion,
                                    String currentVersion, List<String> problems) {
        super(String.format("Checkpoint %s (workflow version %s) is incompatible with version %s: %s",
                checkpointId, snapshotVersion, currentVersion, problems));
        this.checkpointId = checkpointId;
        this.snapshotVersion = snapshotVersion;
        this.currentVersion = currentVersion;
        this.problems = problems != null ? List.copyOf(problems) : List.of();
    }

    public String getCheckpointId() {
        return checkpointId;
    }

    public String getSnapshotVersion() {
        return snapshotVersion;
    }

    public String getCurrentVersion() {
        return currentVersion;
    }

    public List<String> getProblems() {
        return problems;
    }
}
