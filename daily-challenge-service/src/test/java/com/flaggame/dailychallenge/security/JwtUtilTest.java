package com.flaggame.dailychallenge.security;

import com.flaggame.dailychallenge.exception.InvalidAuthorizationException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JwtUtilTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-test-secret";

    private final JwtUtil jwtUtil = new JwtUtil(SECRET);
    private final SecretKey key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));

    @Test
    void numericUserId() {
        String token = Jwts.builder().claim("user_id", 15).signWith(key).compact();
        assertEquals(15L, jwtUtil.extractUserId(token));
    }

    @Test
    void stringUserId() {
        String token = Jwts.builder().claim("user_id", "16").signWith(key).compact();
        assertEquals(16L, jwtUtil.extractUserId(token));
    }

    @Test
    void missingClaim() {
        String token = Jwts.builder().subject("someone").signWith(key).compact();
        assertThrows(InvalidAuthorizationException.class, () -> jwtUtil.extractUserId(token));
    }

    @Test
    void expiredToken() {
        String token = Jwts.builder()
                .claim("user_id", 15)
                .expiration(new Date(System.currentTimeMillis() - 60_000))
                .signWith(key)
                .compact();
        assertThrows(InvalidAuthorizationException.class, () -> jwtUtil.extractUserId(token));
    }

    @Test
    void wrongKey() {
        SecretKey other = Keys.hmacShaKeyFor("another-secret-another-secret-another-secret!!".getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder().claim("user_id", 15).signWith(other).compact();
        assertThrows(InvalidAuthorizationException.class, () -> jwtUtil.extractUserId(token));
    }

    @Test
    void garbage() {
        assertThrows(InvalidAuthorizationException.class, () -> jwtUtil.extractUserId("not-a-token"));
    }
}
