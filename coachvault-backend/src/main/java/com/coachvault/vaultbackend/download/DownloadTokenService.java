package com.coachvault.vaultbackend.download;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies short-lived signed download tokens. Nothing is stored
 * server side, so a token stays valid for its whole window once issued.
 */
@Service
@Slf4j
public class DownloadTokenService {

    public static final Duration DOWNLOAD_TOKEN_TTL = Duration.ofMinutes(10);

    static final String CLAIM_PRODUCT_ID = "productId";
    static final String CLAIM_TYPE = "typ";
    static final String TOKEN_TYPE = "download";

    // HS256 needs a 256-bit key
    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final Clock clock;
    private final JwtParser parser;

    public DownloadTokenService(@Value("${security.download-token.secret}") String secret, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("security.download-token.secret must be set");
        }
        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "security.download-token.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = Keys.hmacShaKeyFor(secretBytes);
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(key)
                .setClock(() -> Date.from(clock.instant()))
                .setAllowedClockSkewSeconds(0)
                .build();
    }

    public IssuedDownloadToken issue(String userId, Long resourceId) {
        if (userId == null || userId.isBlank()) throw new IllegalArgumentException("userId is required");
        if (resourceId == null) throw new IllegalArgumentException("resourceId is required");

        // JWT timestamps carry whole seconds
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(DOWNLOAD_TOKEN_TTL);

        String token = Jwts.builder()
                .setId(UUID.randomUUID().toString())
                .setSubject(userId)
                .claim(CLAIM_PRODUCT_ID, resourceId.toString())
                .claim(CLAIM_TYPE, TOKEN_TYPE)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(expiresAt))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();

        return new IssuedDownloadToken(token, expiresAt);
    }

    /**
     * Returns the grant for a well-formed, correctly signed, unexpired token and
     * empty for everything else, without saying which check failed.
     */
    public Optional<DownloadGrant> verify(String token) {
        if (token == null || token.isBlank()) return Optional.empty();

        try {
            Claims claims = parser.parseClaimsJws(token).getBody();

            if (!TOKEN_TYPE.equals(claims.get(CLAIM_TYPE, String.class))) return Optional.empty();

            String userId = claims.getSubject();
            if (userId == null || userId.isBlank()) return Optional.empty();

            String productId = claims.get(CLAIM_PRODUCT_ID, String.class);
            if (productId == null) return Optional.empty();
            Long resourceId = Long.valueOf(productId);

            // Freshness is enforced here as well as by the parser
            Date exp = claims.getExpiration();
            if (exp == null || !exp.toInstant().isAfter(clock.instant())) return Optional.empty();

            return Optional.of(new DownloadGrant(userId, resourceId, exp.toInstant(), claims.getId()));
        } catch (JwtException | IllegalArgumentException e) {
            // IllegalArgumentException also covers a non-numeric productId
            log.debug("Rejected download token: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }
}
