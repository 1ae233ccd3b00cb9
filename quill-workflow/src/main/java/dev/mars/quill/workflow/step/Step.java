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

/**
 * An executable unit of work referenced by {@code StepSpec.ref}.
 *
 * <p>Implementations must treat the supplied context as read-only and report their
 * result through the return value. Long-running steps should check
 * {@link StepContext#isCancelled()} or respond to thread interruption, since a
 * timed-out attempt is cancelled by interrupting its thread.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@FunctionalInterface
public interface Step {

    /**
     * Runs one attempt of the step.
     *
     * @param context read-only view of the job for this attempt
     * @return the step output, recorded under the step id; may be {@code null}
     * @throws Exception any failure; the attempt is retried if budget remains
     */
    Object execute(StepContext context) throws Exception;
}
