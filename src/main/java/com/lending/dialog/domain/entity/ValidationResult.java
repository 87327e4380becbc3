package com.lending.dialog.domain.entity;

import com.lending.dialog.domain.valueobject.ValidationError;

/**
 * Outcome of validating one raw input: a typed value or an error, never both.
 */
public final class ValidationResult {

    private final Object value;
    private final ValidationError error;

    private ValidationResult(Object value, ValidationError error) {
        this.value = value;
        this.error = error;
    }

    public static ValidationResult ok(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("ok result requires a value");
        }
        return new ValidationResult(value, null);
    }

    public static ValidationResult invalid(ValidationError error) {
        if (error == null) {
            throw new IllegalArgumentException("invalid result requires an error");
        }
        return new ValidationResult(null, error);
    }

    public boolean isValid() {
        return error == null;
    }

    public Object getValue() {
        if (!isValid()) {
            throw new IllegalStateException("No value on invalid result: " + error);
        }
        return value;
    }

    /**
     * Typed access to the parsed value.
     *
     * @throws IllegalStateException if the result is invalid
     * @throws ClassCastException    if the value is not of the requested type
     */
    public <T> T getValue(Class<T> type) {
        return type.cast(getValue());
    }

    public ValidationError getError() {
        return error;
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{ok=" + value + "}" : "ValidationResult{error=" + error + "}";
    }
}
