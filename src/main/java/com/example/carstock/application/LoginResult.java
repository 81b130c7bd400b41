package com.example.carstock.application;

/**
 * Outcome of a credential check. Failures carry one generic message whatever the cause.
 */
public record LoginResult(
    boolean success,
    String token,
    String message
) {
    public static LoginResult authenticated(String token) {
        return new LoginResult(true, token, "Logged in successfully");
    }

    public static LoginResult invalidCredentials() {
        return new LoginResult(false, null, "Invalid username or password");
    }
}
