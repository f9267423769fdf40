package com.chatsync.auth.service;

import com.chatsync.auth.config.AuthProperties;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

    static final String SECRET = "test-secret-test-secret-test-secret-0123456789";
    static final String ISSUER = "chat-sync";

    static String token(String issuer, Object uid, String typ, long ttlMs) {
        return Jwts.builder()
                .issuer(issuer)
                .claim(JwtService.CLAIM_USER_ID, uid)
                .claim(JwtService.CLAIM_TOKEN_TYPE, typ)
                .issuedAt(new Date())
                .expiration(new Date(System.currentTimeMillis() + ttlMs))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }

    private final JwtService jwt = new JwtService(new AuthProperties(ISSUER, SECRET));

    @Test
    void verifyUserId_ShouldReturnUidOfValidAccessToken() {
        assertThat(jwt.verifyUserId(token(ISSUER, 42L, "access", 60_000))).isEqualTo(42L);
    }

    @Test
    void verifyUserId_ShouldRejectRefreshToken() {
        assertThatThrownBy(() -> jwt.verifyUserId(token(ISSUER, 42L, "refresh", 60_000)))
                .isInstanceOf(JwtException.class)
                .hasMessage("token_type_not_access");
    }

    @Test
    void verifyUserId_ShouldRejectExpiredOrForeignTokens() {
        assertThatThrownBy(() -> jwt.verifyUserId(token(ISSUER, 42L, "access", -60_000)))
                .isInstanceOf(JwtException.class);
        assertThatThrownBy(() -> jwt.verifyUserId(token("someone-else", 42L, "access", 60_000)))
                .isInstanceOf(JwtException.class);
    }

    @Test
    void verifyUserId_ShouldRejectMissingUid() {
        assertThatThrownBy(() -> jwt.verifyUserId(token(ISSUER, 0, "access", 60_000)))
                .isInstanceOf(JwtException.class)
                .hasMessage("missing_uid");
    }
}
