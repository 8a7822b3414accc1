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

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A field/operator/value predicate evaluated against the variable context.
 * Used both by condition steps and as a guard on any step.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-04
 * @version 1.0
 */
public final class ConditionSpec {

    public enum Operator {
        EQUALS("equals"),
        NOT_EQUALS("not_equals"),
        CONTAINS("contains"),
        GREATER_THAN("greater_than"),
        LESS_THAN("less_than");

        private final String value;

        Operator(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        public static Operator fromValue(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Condition operator cannot be null");
            }
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Operator operator : values()) {
                if (operator.value.equals(normalized)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("Unknown condition operator: " + value);
        }
    }

    private final String field;
    private final Operator operator;
    private final Object value;

    public ConditionSpec(String field, Operator operator, Object value) {
        this.field = Objects.requireNonNull(field, "Condition field cannot be null");
        this.operator = Objects.requireNonNull(operator, "Condition operator cannot be null");
        this.value = value;
    }

    /**
     * Builds a predicate from a {@code field}/{@code operator}/{@code value} map.
     *
     * @throws IllegalArgumentException if the field or operator is missing or unknown
     */
    public static ConditionSpec fromMap(Map<String, ?> data) {
        if (data == null) {
            throw new IllegalArgumentException("Condition cannot be empty");
        }
        Object field = data.get("field");
        if (field == null || field.toString().isBlank()) {
            throw new IllegalArgumentException("Condition field is required");
        }
        Object operator = data.get("operator");
        return new ConditionSpec(field.toString(),
                Operator.fromValue(operator != null ? operator.toString() : "equals"),
                data.get("value"));
    }

    public String getField() {
        return field;
    }

    public Operator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Evaluates the predicate. The field is looked up with {@link VariableResolver#lookup}.
     *
     * @throws IllegalArgumentException if an ordering comparison meets a non-numeric operand
     */
    public boolean evaluate(Map<String, Object> variables) {
        Object actual = VariableResolver.lookup(variables, field).orElse(null);
        switch (operator) {
            case EQUALS:
                return valuesEqual(actual, value);
            case NOT_EQUALS:
                return !valuesEqual(actual, value);
            case CONTAINS:
                return contains(actual, value);
            case GREATER_THAN:
                return compare(actual, value) > 0;
            case LESS_THAN:
                return compare(actual, value) < 0;
            default:
                throw new IllegalStateException("Unhandled operator " + operator);
        }
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        return actual.toString().equals(expected.toString());
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Collection) {
            for (Object element : (Collection<?>) actual) {
                if (valuesEqual(element, expected)) {
                    return true;
                }
            }
            return false;
        }
        if (actual instanceof Map) {
            return ((Map<?, ?>) actual).containsKey(expected.toString());
        }
        return actual.toString().contains(expected.toString());
    }

    private int compare(Object actual, Object expected) {
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left == null || right == null) {
            throw new IllegalArgumentException("Operator " + operator.getValue() +
                    " needs numeric operands, got '" + actual + "' and '" + expected + "'");
        }
        return left.compareTo(right);
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof Number || value instanceof String) {
            try {
                return new BigDecimal(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConditionSpec that = (ConditionSpec) o;
        return field.equals(that.field) && operator == that.operator && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return field + " " + operator.getValue() + " " + value;
    }
}
