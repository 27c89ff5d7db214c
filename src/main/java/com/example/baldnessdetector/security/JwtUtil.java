package com.example.baldnessdetector.security;

import com.example.baldnessdetector.config.AppProperties;
import com.example.baldnessdetector.exception.ExpiredTokenException;
import com.example.baldnessdetector.exception.InvalidTokenException;
import com.example.baldnessdetector.exception.MalformedTokenException;
import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.util.Date;

/**
 * Issues and validates the stateless session tokens handed out at login.
 * <p>
 * A token carries the user id as subject plus the email, and is valid while its
 * signature verifies and the clock is before its expiry. There is no refresh and
 * no revocation: clients re-authenticate once a token expires.
 */
@Component
public class JwtUtil {

    private final Key key;
    private final SignatureAlgorithm algorithm;
    private final long accessExpirationMillis;
    private final Clock clock;

    public JwtUtil(AppProperties properties, Clock clock) {
        String secret = resolveSecret(properties);
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.algorithm = SignatureAlgorithm.forName(properties.getJwt().getAlgorithm());
        this.accessExpirationMillis = properties.getJwt().getExpirationHours() * 3_600_000L;
        this.clock = clock;
    }

    public String generateAccessToken(Long userId, String email) {
        Date now = Date.from(clock.instant());
        Date exp = new Date(now.getTime() + accessExpirationMillis);
        return Jwts.builder()
                .setSubject(String.valueOf(userId))
                .claim("email", email)
                .setIssuedAt(now)
                .setExpiration(exp)
                .signWith(key, algorithm)
                .compact();
    }

    /**
     * @return the user id the token was issued for
     * @throws ExpiredTokenException   if the token is past its expiry
     * @throws InvalidTokenException   if the signature does not verify
     * @throws MalformedTokenException if the token cannot be parsed or has no numeric subject
     */
    public Long validateToken(String token) {
        Claims claims;
        try {
            claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (ExpiredJwtException ex) {
            throw new ExpiredTokenException("Token has expired", ex);
        } catch (SignatureException ex) {
            throw new InvalidTokenException("Token signature is invalid", ex);
        } catch (MalformedJwtException | UnsupportedJwtException | IllegalArgumentException ex) {
            throw new MalformedTokenException("Token is malformed", ex);
        } catch (JwtException ex) {
            throw new InvalidTokenException("Token is invalid", ex);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new MalformedTokenException("Token has no subject");
        }
        try {
            return Long.parseLong(subject);
        } catch (NumberFormatException ex) {
            throw new MalformedTokenException("Token subject is not a user id", ex);
        }
    }

    public long getExpiresInSeconds() {
        return accessExpirationMillis / 1000;
    }

    private static String resolveSecret(AppProperties properties) {
        String secret = properties.getJwt().getSecretKey();
        if (secret == null || secret.isBlank()) {
            secret = properties.getSecretKey();
        }
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("app.jwt.secret-key (or app.secret-key) must be configured");
        }
        return secret;
    }
}
