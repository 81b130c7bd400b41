package com.example.carstock.application.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Checks a request body against the constraints declared on its class and
 * reports every violated field. Called by the controllers before any store access.
 */
@Component
@RequiredArgsConstructor
public class RequestValidator {

    private final Validator validator;

    public ValidationResult validate(Object request) {
        if (request == null) {
            return new ValidationResult.Builder().addError("body", "Request body is required.").build();
        }
        ValidationResult.Builder result = new ValidationResult.Builder();
        for (ConstraintViolation<Object> violation : validator.validate(request)) {
            result.addError(violation.getPropertyPath().toString(), violation.getMessage());
        }
        return result.build();
    }
}
