package com.example.carstock.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token signing settings. Binding fails, and the application does not start,
 * when any of them is missing.
 *
 * @param key      HMAC-SHA256 secret, at least 32 bytes of UTF-8
 * @param issuer   value written to and required in the {@code iss} claim
 * @param audience value written to and required in the {@code aud} claim
 */
@Validated
@ConfigurationProperties(prefix = "jwt")
public record JwtProperties(
    @NotBlank String key,
    @NotBlank String issuer,
    @NotBlank String audience
) {
}
