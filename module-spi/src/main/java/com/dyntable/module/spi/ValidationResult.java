package com.dyntable.module.spi;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of validating a single value against a column type.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(true, null, null);

    boolean valid;
    String error;
    String suggestion;

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult failure(String error) {
        return new ValidationResult(false, error, null);
    }

    /**
     * @param error      reason shown next to the offending field
     * @param suggestion optional hint on how to fix the value
     */
    public static ValidationResult failure(String error, String suggestion) {
        return new ValidationResult(false, error, suggestion);
    }
}
