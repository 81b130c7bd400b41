package com.example.carstock.auth;

/**
 * Outcome of checking a token. {@code dealerId} is set only when {@code valid}.
 */
public record TokenValidationResult(
    boolean valid,
    Integer dealerId,
    String reason
) {
    public static TokenValidationResult accepted(int dealerId) {
        return new TokenValidationResult(true, dealerId, null);
    }

    public static TokenValidationResult rejected(String reason) {
        return new TokenValidationResult(false, null, reason);
    }
}
