package com.example.examSchedulerBackend.model;

import lombok.Value;

import java.util.List;

/**
 * Structural errors block allocation; warnings are advisory only.
 */
@Value
public class ValidationResult {
    List<ValidationError> errors;
    List<String> warnings;

    public boolean isValid() {
        return errors.isEmpty();
    }
}
