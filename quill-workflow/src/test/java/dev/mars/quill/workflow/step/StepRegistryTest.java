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

import dev.mars.quill.workflow.TestSteps;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StepRegistryTest {

    @Test
    void createsFreshInstancePerCall() {
        AtomicInteger created = new AtomicInteger();
        StepRegistry registry = new StepRegistry().register("counter", () -> {
            created.incrementAndGet();
            return TestSteps.constant("x");
        });

        assertNotSame(registry.create("counter"), registry.create("counter"));
        assertEquals(2, created.get());
    }

    @Test
    void sharedInstanceIsReused() {
        Step step = TestSteps.constant("x");
        StepRegistry registry = new StepRegistry().registerInstance("shared", step);

        assertSame(step, registry.create("shared"));
    }

    @Test
    void duplicateRefIsRejected() {
        StepRegistry registry = new StepRegistry().registerInstance("echo", TestSteps.echo());

        assertThrows(IllegalStateException.class, () -> registry.registerInstance("echo", TestSteps.echo()));
    }

    @Test
    void unknownRefIsRejected() {
        StepRegistry registry = new StepRegistry();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> registry.create("nope"));
        assertTrue(e.getMessage().contains("nope"));
        assertFalse(registry.contains("nope"));
    }

    @Test
    void refsAreSorted() {
        StepRegistry registry = new StepRegistry()
                .registerInstance("writer", TestSteps.echo())
                .registerInstance("outline", TestSteps.echo());

        assertEquals(Set.of("outline", "writer"), registry.getRefs());
        assertEquals("outline", registry.getRefs().iterator().next());
    }

    @Test
    void contextMapsAreReadOnly() {
        StepContext context = StepContext.builder("job-1", "draft")
                .inputs(new HashMap<>(Map.of("topic", "java")))
                .build();

        assertEquals(1, context.getAttempt());
        assertEquals("java", context.getInput("topic").orElseThrow());
        assertThrows(UnsupportedOperationException.class, () -> context.getOutputs().put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> context.getInputs().put("x", 1));
    }
}
