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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Issues found while checking a parsed workflow definition, in the order they were found.
 * Errors make the definition unrunnable; warnings do not.
 */
public class ValidationResult {

    private final List<ValidationIssue> issues = new ArrayList<>();

    public void addError(String message) {
        addError(null, message);
    }

    public void addError(String fieldPath, String message) {
        issues.add(new ValidationIssue(ValidationIssue.Severity.ERROR, fieldPath, message));
    }

    public void addWarning(String fieldPath, String message) {
        issues.add(new ValidationIssue(ValidationIssue.Severity.WARNING, fieldPath, message));
    }

    public List<ValidationIssue> getErrors() {
        return filter(ValidationIssue.Severity.ERROR);
    }

    public List<ValidationIssue> getWarnings() {
        return filter(ValidationIssue.Severity.WARNING);
    }

    public boolean isValid() {
        return issues.stream().noneMatch(ValidationIssue::isError);
    }

    public boolean hasWarnings() {
        return issues.stream().anyMatch(issue -> !issue.isError());
    }

    public Optional<ValidationIssue> firstError() {
        return issues.stream().filter(ValidationIssue::isError).findFirst();
    }

    /**
     * Raises the first error, with the total error count in the message, when the definition
     * is not runnable.
     */
    public void throwIfInvalid(String workflowId) throws WorkflowParseException {
        Optional<ValidationIssue> first = firstError();
        if (first.isPresent()) {
            int count = getErrors().size();
            String message = count == 1
                    ? first.get().getMessage()
                    : first.get().getMessage() + " (and " + (count - 1) + " more)";
            throw new WorkflowParseException(workflowId, first.get().getFieldPath(), message, null);
        }
    }

    private List<ValidationIssue> filter(ValidationIssue.Severity severity) {
        return issues.stream()
                .filter(issue -> issue.getSeverity() == severity)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() + ", issues=" + issues + '}';
    }

    /**
     * One finding, tied to a field path such as {@code steps[2].params.input} when known.
     */
    public static final class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final String fieldPath;
        private final String message;

        public ValidationIssue(Severity severity, String fieldPath, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.fieldPath = fieldPath;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Severity getSeverity() {
            return severity;
        }

        public boolean isError() {
            return severity == Severity.ERROR;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ValidationIssue)) return false;
            ValidationIssue other = (ValidationIssue) o;
            return severity == other.severity
                    && Objects.equals(fieldPath, other.fieldPath)
                    && message.equals(other.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, fieldPath, message);
        }

        @Override
        public String toString() {
            return fieldPath == null ? severity + ": " + message : severity + " " + fieldPath + ": " + message;
        }
    }
}
