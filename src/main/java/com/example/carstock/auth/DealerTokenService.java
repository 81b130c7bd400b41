package com.example.carstock.auth;

import com.example.carstock.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and checks the HS256 tokens that carry a dealer id between requests.
 * Tokens are not stored; a token is good until its {@code exp} passes.
 */
@Slf4j
@Component
public class DealerTokenService {

    public static final String DEALER_ID_CLAIM = "dealerId";
    public static final Duration TOKEN_TTL = Duration.ofHours(1);

    private final JwtProperties properties;
    private final Clock clock;
    private final Key signingKey;
    private final JwtParser parser;

    /**
     * @throws io.jsonwebtoken.security.WeakKeyException if the configured key is shorter than 256 bits
     */
    public DealerTokenService(JwtProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.signingKey = Keys.hmacShaKeyFor(properties.key().getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .requireIssuer(properties.issuer())
                .requireAudience(properties.audience())
                .setAllowedClockSkewSeconds(0)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    public String issue(int dealerId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .claim(DEALER_ID_CLAIM, String.valueOf(dealerId))
                .setId(UUID.randomUUID().toString())
                .setIssuer(properties.issuer())
                .setAudience(properties.audience())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(TOKEN_TTL)))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    public TokenValidationResult validate(String token) {
        if (!StringUtils.hasText(token)) {
            return TokenValidationResult.rejected("token missing");
        }

        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            return TokenValidationResult.rejected(e.getClass().getSimpleName());
        }

        Object dealerIdClaim = claims.get(DEALER_ID_CLAIM);
        if (dealerIdClaim == null) {
            log.debug("Rejected token {}: no {} claim", claims.getId(), DEALER_ID_CLAIM);
            return TokenValidationResult.rejected("dealerId claim missing");
        }
        try {
            return TokenValidationResult.accepted(Integer.parseInt(dealerIdClaim.toString()));
        } catch (NumberFormatException e) {
            log.debug("Rejected token {}: non-numeric {} claim", claims.getId(), DEALER_ID_CLAIM);
            return TokenValidationResult.rejected("dealerId claim malformed");
        }
    }
}
