package com.caf.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.caf.backend.modules.access.domain.Actor;
import com.caf.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    private static final String CLAIM_ROLE = "role";
    private static final String CLAIM_OFFICE_ID = "officeId";
    private static final String CLAIM_DEPARTMENT = "department";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    /**
     * Issues an access token in the format the identity service uses. Production tokens come from
     * that service; this exists for operator tooling and tests.
     */
    public String issueAccessToken(Actor actor) {
        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
                .subject(actor.id().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(accessTokenTtlMillis)))
                .claim(CLAIM_ROLE, actor.roleCode());
        if (actor.officeId() != null) {
            builder.claim(CLAIM_OFFICE_ID, actor.officeId().toString());
        }
        if (actor.department() != null) {
            builder.claim(CLAIM_DEPARTMENT, actor.department());
        }
        return builder.signWith(tokenProvider.getSecretKey(), SIG.HS256).compact();
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
            String role = claims.get(CLAIM_ROLE, String.class);
            String officeClaim = claims.get(CLAIM_OFFICE_ID, String.class);
            UUID officeId = officeClaim == null ? null : UUID.fromString(officeClaim);
            String department = claims.get(CLAIM_DEPARTMENT, String.class);
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : clock.instant();

            return new ParsedToken(
                    userId,
                    role,
                    officeId,
                    department,
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(UUID userId, String role, UUID officeId, String department, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
