package com.example.carstock.auth;

import org.springframework.http.ResponseCookie;

public final class AuthCookies {

    public static final String TOKEN_COOKIE = "jwt";

    private AuthCookies() {
    }

    public static ResponseCookie tokenCookie(String token) {
        return ResponseCookie.from(TOKEN_COOKIE, token)
                .httpOnly(true)
                .secure(true)
                .sameSite("Strict")
                .path("/")
                .maxAge(DealerTokenService.TOKEN_TTL)
                .build();
    }
}
