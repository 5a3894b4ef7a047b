package com.foodtruck.common.security;

import com.foodtruck.user.entity.Role;
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
 * Issues and verifies HMAC-SHA signed access tokens.
 *
 * <p>The subject is the user id and the {@code role} claim carries the
 * {@link Role}; nothing else is put in the token. The secret must be at least
 * 256 bits long.</p>
 */
@Component
public class JwtTokenProvider {

    static final String ROLE_CLAIM = "role";

    private final SecretKey key;
    private final long expiration;

    public JwtTokenProvider(
            @Value("${jwt.secret:foodTruckDevelopmentSecretKeyThatIsLongEnoughForHs256}") String secret,
            @Value("${jwt.expiration:1800000}") long expiration) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expiration = expiration;
    }

    public String createToken(Long userId, Role role) {
        Date now = new Date();
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim(ROLE_CLAIM, role.name())
                .issuedAt(now)
                .expiration(new Date(now.getTime() + expiration))
                .signWith(key)
                .compact();
    }

    public AuthenticatedUser getAuthentication(String token) {
        return toAuthenticatedUser(parseClaims(token));
    }

    /**
     * Signature, expiry and claim shape are all checked; any failure yields false.
     */
    public boolean validateToken(String token) {
        try {
            toAuthenticatedUser(parseClaims(token));
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    public long getExpirationSeconds() {
        return expiration / 1000;
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    private AuthenticatedUser toAuthenticatedUser(Claims claims) {
        Long userId = Long.parseLong(claims.getSubject());
        Role role = Role.from(claims.get(ROLE_CLAIM, String.class));
        return new AuthenticatedUser(userId, role);
    }
}
