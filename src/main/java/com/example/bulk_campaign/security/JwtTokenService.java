package com.example.bulk_campaign.security;

import java.nio.charset.StandardCharsets;
import java.util.Date;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;

/**
 * WordPress (JWT Auth プラグイン) が発行したトークンを検証する。
 * 発行は WordPress 側で行うので、このサービスは検証のみ。
 */
@Service
public class JwtTokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);
    private static final int MINIMUM_SECRET_LENGTH = 32;
    private static final String DEFAULT_SECRET_PREFIX = "default-secret";
    public static final String USER_ID_CLAIM = "user_id";

    @Value("${wordpress.jwt.secret:default-secret-key-change-in-production-at-least-32-bytes}")
    private String jwtSecret;

    @Value("${spring.profiles.active:dev}")
    private String activeProfile;

    private SecretKey key;
    private boolean usingDefaultSecret = false;

    @PostConstruct
    public void init() {
        if (jwtSecret == null || jwtSecret.isBlank() || jwtSecret.startsWith(DEFAULT_SECRET_PREFIX)) {
            usingDefaultSecret = true;
            if ("prod".equals(activeProfile) || "real".equals(activeProfile)) {
                throw new IllegalStateException(
                        "Default JWT secret is not allowed in " + activeProfile + " profile. Set WORDPRESS_JWT_SECRET.");
            }
            log.warn("======================================");
            log.warn("WARNING: Using default JWT secret!");
            log.warn("Tokens issued by WordPress will not validate.");
            log.warn("Set WORDPRESS_JWT_SECRET environment variable.");
            log.warn("======================================");
        }

        // HS256 には32バイト以上が必要
        byte[] keyBytes = jwtSecret == null ? new byte[0] : jwtSecret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MINIMUM_SECRET_LENGTH) {
            log.error("JWT secret is too short! Minimum {} bytes required, got {}.",
                    MINIMUM_SECRET_LENGTH, keyBytes.length);
            throw new IllegalStateException(
                    "JWT secret must be at least " + MINIMUM_SECRET_LENGTH + " bytes. " +
                            "Set WORDPRESS_JWT_SECRET environment variable with a secure value.");
        }

        this.key = Keys.hmacShaKeyFor(keyBytes);
        log.info("JWT service initialized (profile: {})", activeProfile);
    }

    /**
     * トークンを検証し、認証済みかどうかとユーザーIDを返す。
     * 期限切れ・署名不正・形式不正はすべて未認証。
     */
    public AuthSession checkSession(String token) {
        if (token == null || token.isBlank()) {
            return AuthSession.anonymous();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (claims.getExpiration() != null && claims.getExpiration().before(new Date())) {
                return AuthSession.anonymous();
            }

            Object userId = claims.get(USER_ID_CLAIM);
            String resolved = userId != null ? String.valueOf(userId) : claims.getSubject();
            if (resolved == null || resolved.isBlank()) {
                log.warn("JWT has no user id claim");
                return AuthSession.anonymous();
            }
            return AuthSession.of(resolved);

        } catch (ExpiredJwtException e) {
            log.warn("Session expired: {}", e.getMessage());
            return AuthSession.anonymous();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid token rejected: {}", e.getMessage());
            return AuthSession.anonymous();
        }
    }

    public boolean isTokenValid(String token) {
        return checkSession(token).authenticated();
    }

    public boolean isUsingDefaultSecret() {
        return usingDefaultSecret;
    }
}
