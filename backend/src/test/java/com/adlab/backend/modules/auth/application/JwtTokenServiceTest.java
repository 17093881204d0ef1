package com.adlab.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import com.adlab.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.adlab.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.adlab.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-for-hs256";
    private static final Instant ISSUED_AT = Instant.parse("2025-03-01T09:00:00Z");

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);

    @Test
    void tokenCarriesUserAndWorkspace() {
        JwtTokenService service = service(Clock.fixed(ISSUED_AT, ZoneOffset.UTC));
        UUID userId = UUID.randomUUID();
        UUID workspaceId = UUID.randomUUID();

        ParsedToken parsed = service.parseAccessToken(service.issueAccessToken(userId, workspaceId));

        assertThat(parsed.userId()).isEqualTo(userId);
        assertThat(parsed.workspaceId()).isEqualTo(workspaceId);
        assertThat(parsed.expiresAt().toInstant()).isEqualTo(ISSUED_AT.plusSeconds(900));
    }

    @Test
    void workspaceClaimIsOptional() {
        JwtTokenService service = service(Clock.fixed(ISSUED_AT, ZoneOffset.UTC));

        ParsedToken parsed = service.parseAccessToken(service.issueAccessToken(UUID.randomUUID(), null));

        assertThat(parsed.workspaceId()).isNull();
    }

    @Test
    void expiredTokenIsRejected() {
        String token = service(Clock.fixed(ISSUED_AT, ZoneOffset.UTC)).issueAccessToken(UUID.randomUUID(), null);
        JwtTokenService later = service(Clock.fixed(ISSUED_AT.plusSeconds(3600), ZoneOffset.UTC));

        assertThatThrownBy(() -> later.parseAccessToken(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tamperedTokenIsRejected() {
        JwtTokenService service = service(Clock.fixed(ISSUED_AT, ZoneOffset.UTC));
        String token = service.issueAccessToken(UUID.randomUUID(), UUID.randomUUID());

        assertThatThrownBy(() -> service.parseAccessToken(token + "x")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> service.parseAccessToken("not-a-jwt")).isInstanceOf(InvalidTokenException.class);
    }

    private JwtTokenService service(Clock clock) {
        return new JwtTokenService(provider, 900, clock);
    }
}
