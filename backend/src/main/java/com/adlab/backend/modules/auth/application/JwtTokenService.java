package com.adlab.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.adlab.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies access tokens. Sessions are owned by the identity provider; a token only
 * names the user and, optionally, the workspace the user is acting in. Roles are never taken from
 * the token.
 */
@Service
public class JwtTokenService {

    static final String WORKSPACE_CLAIM = "ws";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlSeconds;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.access-token-ttl-seconds:900}") long accessTokenTtlSeconds,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlSeconds = accessTokenTtlSeconds;
        this.clock = clock;
    }

    public String issueAccessToken(UUID userId, UUID workspaceId) {
        Instant now = clock.instant();
        SecretKey key = tokenProvider.getSecretKey();

        JwtBuilder builder = Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusSeconds(accessTokenTtlSeconds)));
        if (workspaceId != null) {
            builder.claim(WORKSPACE_CLAIM, workspaceId.toString());
        }
        return builder.signWith(key, SIG.HS256).compact();
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String workspaceClaim = claims.get(WORKSPACE_CLAIM, String.class);
            UUID workspaceId = workspaceClaim == null ? null : UUID.fromString(workspaceClaim);
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : clock.instant();

            return new ParsedToken(userId, workspaceId, OffsetDateTime.ofInstant(expiresAt, clock.getZone()));
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(UUID userId, UUID workspaceId, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
