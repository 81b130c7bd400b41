package com.example.carstock.auth;

/**
 * The authenticated caller, as resolved from the token cookie.
 */
public record DealerPrincipal(int dealerId) {
}
