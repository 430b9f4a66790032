package com.lendingmarket.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.lendingmarket.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.lendingmarket.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.lendingmarket.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.lendingmarket.backend.modules.auth.presentation.dto.TokenResponse;
import com.lendingmarket.backend.support.LedgerFixtures;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "test-jwt-secret-key-with-at-least-32-bytes";
    private static final long TTL_MILLIS = 900_000L;

    private final Clock issueClock = Clock.fixed(LedgerFixtures.NOW.toInstant(), ZoneOffset.UTC);

    @Test
    void issuedTokenParsesBackToSameIdentity() {
        JwtTokenService service = new JwtTokenService(new JwtTokenProvider(SECRET), TTL_MILLIS, issueClock);
        UUID userId = UUID.randomUUID();

        TokenResponse tokens = service.issueAccessToken(userId, "a@example.com", List.of("BORROWER", "LENDER"));
        ParsedToken parsed = service.parseAccessToken(tokens.accessToken());

        assertThat(tokens.tokenType()).isEqualTo("Bearer");
        assertThat(tokens.expiresIn()).isEqualTo(900L);
        assertThat(parsed.userId()).isEqualTo(userId);
        assertThat(parsed.email()).isEqualTo("a@example.com");
        assertThat(parsed.capabilities()).containsExactly("BORROWER", "LENDER");
        assertThat(parsed.expiresAt()).isEqualTo(LedgerFixtures.NOW.plusMinutes(15));
    }

    @Test
    void expiredTokenIsRejected() {
        JwtTokenService issuer = new JwtTokenService(new JwtTokenProvider(SECRET), TTL_MILLIS, issueClock);
        String token = issuer.issueAccessToken(UUID.randomUUID(), "a@example.com", List.of()).accessToken();

        Clock later = Clock.offset(issueClock, Duration.ofMinutes(16));
        JwtTokenService verifier = new JwtTokenService(new JwtTokenProvider(SECRET), TTL_MILLIS, later);

        assertThrows(InvalidTokenException.class, () -> verifier.parseAccessToken(token));
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        JwtTokenService issuer = new JwtTokenService(
                new JwtTokenProvider("another-secret-key-that-is-also-32-bytes-long"), TTL_MILLIS, issueClock);
        String token = issuer.issueAccessToken(UUID.randomUUID(), "a@example.com", List.of()).accessToken();

        JwtTokenService verifier = new JwtTokenService(new JwtTokenProvider(SECRET), TTL_MILLIS, issueClock);

        assertThrows(InvalidTokenException.class, () -> verifier.parseAccessToken(token));
        assertThrows(InvalidTokenException.class, () -> verifier.parseAccessToken("not-a-jwt"));
    }
}
