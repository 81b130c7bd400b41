package com.example.carstock.application.dto;

import com.example.carstock.application.validation.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

@Getter
@AllArgsConstructor
public class ValidationErrorResponse {
    private String message;
    private Map<String, String> errors;

    public static ValidationErrorResponse from(ValidationResult result) {
        return new ValidationErrorResponse("Validation failed", result.errors());
    }
}
