package com.warden.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and validates HS256-signed access and refresh tokens.
 * <p>
 * Access tokens are stateless: validation needs only the signing key and the clock. Refresh
 * tokens are backed by a {@link RefreshTokenRecord} and rotate on every redemption; the old
 * record is revoked in the same repository call that records the replacement, so a refresh
 * token is redeemable at most once even under concurrent requests.
 * <p>
 * The signing key is derived once in the constructor and never changes.
 */
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    static final String CLAIM_TYPE = "typ";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_PRIVILEGE = "priv";
    static final String TYPE_ACCESS = "access";
    static final String TYPE_REFRESH = "refresh";

    private final TokenConfig config;
    private final RefreshTokenRepository refreshTokens;
    private final IdentityLookup identities;
    private final Clock clock;
    private final SecretKey signingKey;
    private final JwtParser parser;

    public TokenService(TokenConfig config,
                        RefreshTokenRepository refreshTokens,
                        IdentityLookup identities,
                        Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.refreshTokens = Objects.requireNonNull(refreshTokens, "refreshTokens");
        this.identities = Objects.requireNonNull(identities, "identities");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.signingKey = deriveKey(config.signingSecret());
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .requireIssuer(config.issuer())
                .setClock(() -> Date.from(clock.instant()))
                .build();
        log.info("TokenService initialized with issuer={}, accessTokenTtl={}, refreshTokenTtl={}",
                config.issuer(), config.accessTokenTtl(), config.refreshTokenTtl());
    }

    public AccessToken issueAccessToken(Identity identity) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(config.accessTokenTtl()).truncatedTo(ChronoUnit.SECONDS);
        String jwt = Jwts.builder()
                .setIssuer(config.issuer())
                .setSubject(identity.userId())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(expiresAt))
                .claim(CLAIM_TYPE, TYPE_ACCESS)
                .claim(CLAIM_EMAIL, identity.email())
                .claim(CLAIM_PRIVILEGE, identity.privilege().value())
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
        return new AccessToken(jwt, expiresAt);
    }

    /**
     * Issues a refresh token and records it so it can later be rotated or revoked.
     */
    public RefreshToken issueRefreshToken(Identity identity) {
        RefreshTokenRecord record = newRecord(identity.userId(), clock.instant());
        refreshTokens.save(record);
        return sign(record);
    }

    /** Convenience for login: a fresh access token and refresh token for {@code identity}. */
    public TokenPair issueTokenPair(Identity identity) {
        return new TokenPair(issueAccessToken(identity), issueRefreshToken(identity));
    }

    /**
     * Validates an access token.
     *
     * @return the identity asserted by the token
     * @throws TokenException with {@code EXPIRED} or {@code BAD_SIGNATURE}
     */
    public Identity validateAccessToken(String token) {
        Claims claims = parse(token);
        Integer privilege = claims.get(CLAIM_PRIVILEGE, Integer.class);
        if (!TYPE_ACCESS.equals(claims.get(CLAIM_TYPE, String.class))
                || claims.getSubject() == null
                || privilege == null
                || privilege < 0) {
            throw new TokenException(TokenException.TokenFailure.BAD_SIGNATURE);
        }
        return new Identity(claims.getSubject(), claims.get(CLAIM_EMAIL, String.class), PrivilegeLevel.of(privilege));
    }

    /**
     * Redeems a refresh token for a new access token and a new refresh token.
     *
     * @throws TokenException with {@code EXPIRED}, {@code BAD_SIGNATURE} or {@code REVOKED}
     */
    public TokenPair redeemRefreshToken(String token) {
        Claims claims = parseRefresh(token);
        String tokenId = claims.getId();
        String userId = claims.getSubject();
        Instant now = clock.instant();

        Optional<Identity> identity = identities.findActiveIdentity(userId);
        if (identity.isEmpty()) {
            refreshTokens.revoke(tokenId, now);
            log.info("Refresh token {} rejected: user {} is missing or disabled", tokenId, userId);
            throw new TokenException(TokenException.TokenFailure.REVOKED);
        }

        RefreshTokenRecord replacement = newRecord(userId, now);
        if (!refreshTokens.rotate(tokenId, replacement, now)) {
            log.info("Refresh token {} rejected: already redeemed or revoked", tokenId);
            throw new TokenException(TokenException.TokenFailure.REVOKED);
        }
        log.debug("Rotated refresh token {} -> {} for user {}", tokenId, replacement.tokenId(), userId);
        return new TokenPair(issueAccessToken(identity.get()), sign(replacement));
    }

    /**
     * Revokes a refresh token (logout). Expired tokens are already unusable and are ignored.
     *
     * @return true if an active token was revoked by this call
     * @throws TokenException with {@code BAD_SIGNATURE} for tokens that were not issued here
     */
    public boolean revokeRefreshToken(String token) {
        Claims claims;
        try {
            claims = parseRefresh(token);
        } catch (TokenException e) {
            if (e.failure() == TokenException.TokenFailure.EXPIRED) {
                return false;
            }
            throw e;
        }
        return refreshTokens.revoke(claims.getId(), clock.instant());
    }

    public int revokeAllRefreshTokens(String userId) {
        int revoked = refreshTokens.revokeAllForUser(userId, clock.instant());
        log.info("Revoked {} refresh token(s) for user {}", revoked, userId);
        return revoked;
    }

    private Claims parseRefresh(String token) {
        Claims claims = parse(token);
        if (!TYPE_REFRESH.equals(claims.get(CLAIM_TYPE, String.class))
                || claims.getId() == null
                || claims.getSubject() == null) {
            throw new TokenException(TokenException.TokenFailure.BAD_SIGNATURE);
        }
        return claims;
    }

    private Claims parse(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenException(TokenException.TokenFailure.BAD_SIGNATURE);
        }
        try {
            return parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            log.debug("Token expired at {}", e.getClaims().getExpiration());
            throw new TokenException(TokenException.TokenFailure.EXPIRED, e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getClass().getSimpleName());
            throw new TokenException(TokenException.TokenFailure.BAD_SIGNATURE, e);
        }
    }

    private RefreshTokenRecord newRecord(String userId, Instant now) {
        return new RefreshTokenRecord(
                UUID.randomUUID().toString(),
                userId,
                now,
                now.plus(config.refreshTokenTtl()).truncatedTo(ChronoUnit.SECONDS),
                null);
    }

    private RefreshToken sign(RefreshTokenRecord record) {
        String jwt = Jwts.builder()
                .setIssuer(config.issuer())
                .setSubject(record.userId())
                .setId(record.tokenId())
                .setIssuedAt(Date.from(record.issuedAt()))
                .setExpiration(Date.from(record.expiresAt()))
                .claim(CLAIM_TYPE, TYPE_REFRESH)
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
        return new RefreshToken(jwt, record.tokenId(), record.expiresAt());
    }

    private static SecretKey deriveKey(String secret) {
        try {
            return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        } catch (WeakKeyException e) {
            throw new SigningKeyException("Token signing secret is too weak for HS256", e);
        }
    }
}
