package com.dadtutor.exception;

import com.dadtutor.validation.ValidationError;

import java.util.List;

public class ValidationFailedException extends RuntimeException {
    private final List<ValidationError> errors;

    public ValidationFailedException(List<ValidationError> errors) {
        super("Validation failed: " + errors.size() + " error(s)");
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
