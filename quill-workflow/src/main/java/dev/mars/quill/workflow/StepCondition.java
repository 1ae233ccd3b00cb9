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

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Guard evaluated against the job context before a step is dispatched.
 *
 * <p>The context is the job inputs overlaid with the outputs of completed steps,
 * keyed by step id. A step whose condition evaluates to {@code false} is skipped.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class StepCondition {

    public enum Type {
        /** Run when the key is present and truthy. */
        IF,
        /** Run when the key is absent or falsy. */
        UNLESS,
        /** Run when every key is present. */
        REQUIRES;

        public static Type fromString(String value) {
            Objects.requireNonNull(value, "Condition type cannot be null");
            return Type.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final Type type;
    private final List<String> keys;

    private StepCondition(Type type, List<String> keys) {
        this.type = Objects.requireNonNull(type, "Condition type cannot be null");
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("Condition requires at least one key");
        }
        this.keys = List.copyOf(keys);
    }

    public static StepCondition ifTrue(String key) {
        return new StepCondition(Type.IF, List.of(key));
    }

    public static StepCondition unless(String key) {
        return new StepCondition(Type.UNLESS, List.of(key));
    }

    public static StepCondition requires(String... keys) {
        return new StepCondition(Type.REQUIRES, List.of(keys));
    }

    public static StepCondition of(Type type, List<String> keys) {
        return new StepCondition(type, keys);
    }

    public Type getType() {
        return type;
    }

    public List<String> getKeys() {
        return keys;
    }

    public boolean evaluate(Map<String, Object> context) {
        switch (type) {
            case IF:
                return isTruthy(context.get(keys.get(0)));
            case UNLESS:
                return !isTruthy(context.get(keys.get(0)));
            case REQUIRES:
                for (String key : keys) {
                    if (!context.containsKey(key) || context.get(key) == null) {
                        return false;
                    }
                }
                return true;
            default:
                throw new IllegalStateException("Unknown condition type: " + type);
        }
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            return !s.isEmpty() && !s.equalsIgnoreCase("false") && !s.equals("0");
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepCondition that = (StepCondition) o;
        return type == that.type && keys.equals(that.keys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, keys);
    }

    @Override
    public String toString() {
        return type.name().toLowerCase(Locale.ROOT) + keys;
    }
}
