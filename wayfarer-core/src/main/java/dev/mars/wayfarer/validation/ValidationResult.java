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

package dev.mars.wayfarer.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Issues found while checking a workflow definition, each tied to the path of the offending
 * field ({@code startPoints[0]}, {@code transitions[2].to}, {@code nodes.pick.choices}).
 * Errors block registration, warnings are informational.
 */
public class ValidationResult {

    /** Path used for issues about the definition as a whole. */
    public static final String ROOT_PATH = "$";

    private final List<ValidationIssue> issues = new ArrayList<>();

    public ValidationResult error(String fieldPath, String message) {
        issues.add(new ValidationIssue(Severity.ERROR, fieldPath, message));
        return this;
    }

    public ValidationResult warning(String fieldPath, String message) {
        issues.add(new ValidationIssue(Severity.WARNING, fieldPath, message));
        return this;
    }

    public List<ValidationIssue> getIssues() {
        return List.copyOf(issues);
    }

    public List<ValidationIssue> getErrors() {
        return bySeverity(Severity.ERROR);
    }

    public List<ValidationIssue> getWarnings() {
        return bySeverity(Severity.WARNING);
    }

    /**
     * Issues reported on the given path or below it, so {@code transitions[1]} also
     * matches {@code transitions[1].to}.
     */
    public List<ValidationIssue> getIssuesAt(String fieldPath) {
        return issues.stream()
                .filter(issue -> issue.isAt(fieldPath))
                .collect(Collectors.toUnmodifiableList());
    }

    public boolean isValid() {
        return getErrorCount() == 0;
    }

    public boolean hasWarnings() {
        return getWarningCount() > 0;
    }

    public int getErrorCount() {
        return getErrors().size();
    }

    public int getWarningCount() {
        return getWarnings().size();
    }

    /**
     * One line per error, e.g. {@code [transitions[0].to] Transition target 'x' is not declared}.
     */
    public String describeErrors() {
        return getErrors().stream()
                .map(ValidationIssue::toString)
                .collect(Collectors.joining("; "));
    }

    private List<ValidationIssue> bySeverity(Severity severity) {
        return issues.stream()
                .filter(issue -> issue.getSeverity() == severity)
                .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid() +
                ", errors=" + getErrorCount() +
                ", warnings=" + getWarningCount() + "}";
    }

    public enum Severity {
        ERROR, WARNING
    }

    public static final class ValidationIssue {

        private final Severity severity;
        private final String fieldPath;
        private final String message;

        ValidationIssue(Severity severity, String fieldPath, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.fieldPath = Objects.requireNonNull(fieldPath, "Field path cannot be null");
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Severity getSeverity() {
            return severity;
        }

        public String getFieldPath() {
            return fieldPath;
        }

        public String getMessage() {
            return message;
        }

        boolean isAt(String path) {
            return fieldPath.equals(path)
                    || fieldPath.startsWith(path + ".")
                    || fieldPath.startsWith(path + "[");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity && fieldPath.equals(that.fieldPath) && message.equals(that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, fieldPath, message);
        }

        @Override
        public String toString() {
            return "[" + fieldPath + "] " + message;
        }
    }
}
