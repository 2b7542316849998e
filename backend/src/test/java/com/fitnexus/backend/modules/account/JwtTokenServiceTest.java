package com.fitnexus.backend.modules.account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import com.fitnexus.backend.modules.account.application.JwtTokenService;
import com.fitnexus.backend.modules.account.application.JwtTokenService.InvalidTokenException;
import com.fitnexus.backend.modules.account.application.JwtTokenService.ParsedToken;
import com.fitnexus.backend.modules.account.domain.GymRole;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.account.infrastructure.jwt.JwtTokenProvider;
import com.fitnexus.backend.modules.account.presentation.dto.TokenResponse;
import com.fitnexus.backend.support.TestEntities;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-fitnexus-secret-0123456789abcdef";
    private static final Instant NOW = Instant.parse("2024-06-01T06:00:00Z");
    private static final long TTL_MILLIS = 3_600_000L;

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);

    @Test
    void issuedTokenCarriesRoleAndBranch() {
        JwtTokenService service = new JwtTokenService(provider, TTL_MILLIS, Clock.fixed(NOW, ZoneOffset.UTC));
        GymUser trainer = TestEntities.user(UUID.randomUUID(), GymRole.TRAINER, "Pune Branch");

        TokenResponse token = service.issueAccessToken(trainer);
        ParsedToken parsed = service.parseAccessToken(token.accessToken());

        assertThat(token.tokenType()).isEqualTo("Bearer");
        assertThat(token.expiresIn()).isEqualTo(3600L);
        assertThat(parsed.userId()).isEqualTo(trainer.getId());
        assertThat(parsed.role()).isEqualTo(GymRole.TRAINER);
        assertThat(parsed.branch()).isEqualTo("Pune Branch");
        assertThat(parsed.loginId()).isEqualTo(trainer.getEmail());
    }

    @Test
    void userWithoutBranchGetsNoBranchClaim() {
        JwtTokenService service = new JwtTokenService(provider, TTL_MILLIS, Clock.fixed(NOW, ZoneOffset.UTC));
        GymUser superadmin = TestEntities.user(UUID.randomUUID(), GymRole.SUPERADMIN, null);

        ParsedToken parsed = service.parseAccessToken(service.issueAccessToken(superadmin).accessToken());

        assertThat(parsed.branch()).isNull();
    }

    @Test
    void expiredTokenIsRejected() {
        JwtTokenService issuer = new JwtTokenService(provider, TTL_MILLIS, Clock.fixed(NOW, ZoneOffset.UTC));
        JwtTokenService later = new JwtTokenService(provider, TTL_MILLIS,
                Clock.fixed(NOW.plusSeconds(7200), ZoneOffset.UTC));
        String token = issuer.issueAccessToken(TestEntities.user(UUID.randomUUID(), GymRole.MEMBER, "Pune Branch"))
                .accessToken();

        assertThatThrownBy(() -> later.parseAccessToken(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService service = new JwtTokenService(provider, TTL_MILLIS, Clock.fixed(NOW, ZoneOffset.UTC));
        JwtTokenService foreign = new JwtTokenService(
                new JwtTokenProvider("another-fitnexus-secret-0123456789abcdefgh"), TTL_MILLIS,
                Clock.fixed(NOW, ZoneOffset.UTC));
        String token = foreign.issueAccessToken(TestEntities.user(UUID.randomUUID(), GymRole.MEMBER, "Pune Branch"))
                .accessToken();

        assertThatThrownBy(() -> service.parseAccessToken(token)).isInstanceOf(InvalidTokenException.class);
    }
}
