package com.example.carstock.application.validation;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of request validation: field name to first error message.
 */
public record ValidationResult(
    boolean passed,
    Map<String, String> errors
) {
    public static ValidationResult pass() {
        return new ValidationResult(true, Map.of());
    }

    public static ValidationResult fail(Map<String, String> errors) {
        return new ValidationResult(false, Collections.unmodifiableMap(new TreeMap<>(errors)));
    }

    /**
     * Builder for accumulating errors.
     */
    public static class Builder {
        private final Map<String, String> errors = new TreeMap<>();

        public Builder addError(String field, String message) {
            errors.putIfAbsent(field, message);
            return this;
        }

        public ValidationResult build() {
            return errors.isEmpty() ? pass() : fail(errors);
        }
    }
}
