package com.flaggame.dailychallenge.security;

import com.flaggame.dailychallenge.exception.InvalidAuthorizationException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Reads the user id out of access tokens issued by the identity service.
 */
@Component
public class JwtUtil {

    static final String USER_ID_CLAIM = "user_id";

    private final SecretKey secretKey;

    public JwtUtil(@Value("${jwt.secret}") String secret) {
        // HMAC key shared with the identity service
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Extract user ID from JWT token
     *
     * @throws InvalidAuthorizationException if the token is invalid, expired or has no usable user id
     */
    public Long extractUserId(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidAuthorizationException("Invalid access token", e);
        }

        Object userIdObj = claims.get(USER_ID_CLAIM);
        if (userIdObj instanceof Number) {
            return ((Number) userIdObj).longValue();
        } else if (userIdObj instanceof String) {
            try {
                return Long.parseLong((String) userIdObj);
            } catch (NumberFormatException e) {
                throw new InvalidAuthorizationException("Invalid user_id claim in token", e);
            }
        }

        throw new InvalidAuthorizationException("Invalid user_id claim in token");
    }
}
