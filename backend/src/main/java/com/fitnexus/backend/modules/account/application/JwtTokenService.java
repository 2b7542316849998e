package com.fitnexus.backend.modules.account.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.fitnexus.backend.modules.account.domain.GymRole;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.account.infrastructure.jwt.JwtTokenProvider;
import com.fitnexus.backend.modules.account.presentation.dto.TokenResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String CLAIM_LOGIN_ID = "loginId";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_BRANCH = "branch";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:3600000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    /**
     * Issues an access token carrying the user's role and branch, so each request can be
     * authorized without another account lookup.
     */
    public TokenResponse issueAccessToken(GymUser user) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);

        JwtBuilder builder = Jwts.builder()
                .subject(user.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_LOGIN_ID, user.getEmail())
                .claim(CLAIM_ROLE, user.getRole().name());
        if (user.getBranch() != null) {
            builder.claim(CLAIM_BRANCH, user.getBranch());
        }
        String accessToken = builder
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new TokenResponse(
                accessToken,
                TokenResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtlMillis / 1000L,
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
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
            String roleClaim = claims.get(CLAIM_ROLE, String.class);
            if (roleClaim == null) {
                throw new InvalidTokenException("Access token has no role claim", null);
            }
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : clock.instant();

            return new ParsedToken(
                    userId,
                    claims.get(CLAIM_LOGIN_ID, String.class),
                    GymRole.valueOf(roleClaim),
                    claims.get(CLAIM_BRANCH, String.class),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public record ParsedToken(UUID userId, String loginId, GymRole role, String branch, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
