package com.govledger.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * JWT token lifecycle management.
 *
 * Issues signed tokens on login and validates them on every request.
 * Secret and expiry are externalized to application properties.
 *
 * Token contains:
 *  - subject  : member address (the ledger identity)
 *  - memberId : member's database ID (custom claim)
 *  - iat      : issued-at
 *  - exp      : expiry
 */
@Component
public class JwtTokenProvider {

    private final SecretKey secretKey;
    private final long      expiryMs;

    public JwtTokenProvider(
            @Value("${govledger.jwt.secret}") String secret,
            @Value("${govledger.jwt.expiry-ms:86400000}") long expiryMs) {

        if (secret == null || secret.length() < 32) {
            throw new IllegalStateException(
                "govledger.jwt.secret must be at least 32 characters");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiryMs  = expiryMs;
    }

    /** Generate a signed JWT for the given member. */
    public String generateToken(Long memberId, String address) {
        Date now    = new Date();
        Date expiry = new Date(now.getTime() + expiryMs);

        return Jwts.builder()
                .subject(address)
                .claim("memberId", memberId)
                .issuedAt(now)
                .expiration(expiry)
                .signWith(secretKey)
                .compact();
    }

    /** Extract the address (subject) from a valid token. */
    public String extractAddress(String token) {
        return parseClaims(token).getSubject();
    }

    public long getExpiryMs() {
        return expiryMs;
    }

    /**
     * Validate token signature and expiry.
     * Returns false instead of throwing; the caller decides how to respond.
     */
    public boolean isValid(String token) {
        try {
            parseClaims(token);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
