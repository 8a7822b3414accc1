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

package dev.mars.gorgon.workflow;

import java.util.Objects;
import java.util.Optional;

/**
 * A declared workflow input. A required input with no default must be supplied by the caller.
 */
public final class InputSpec {

    private final String name;
    private final boolean required;
    private final Object defaultValue;
    private final String description;

    public InputSpec(String name, boolean required, Object defaultValue, String description) {
        this.name = Objects.requireNonNull(name, "Input name cannot be null");
        this.required = required;
        this.defaultValue = defaultValue;
        this.description = description;
    }

    public static InputSpec required(String name) {
        return new InputSpec(name, true, null, null);
    }

    public static InputSpec optional(String name, Object defaultValue) {
        return new InputSpec(name, false, defaultValue, null);
    }

    public String getName() {
        return name;
    }

    public boolean isRequired() {
        return required;
    }

    public Optional<Object> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InputSpec inputSpec = (InputSpec) o;
        return required == inputSpec.required &&
               name.equals(inputSpec.name) &&
               Objects.equals(defaultValue, inputSpec.defaultValue) &&
               Objects.equals(description, inputSpec.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, required, defaultValue, description);
    }

    @Override
    public String toString() {
        return "InputSpec{name='" + name + "', required=" + required + ", default=" + defaultValue + '}';
    }
}
