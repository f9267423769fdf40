package com.chatsync.auth.service;

import com.chatsync.auth.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

@Service
public class JwtService {

    public static final String CLAIM_USER_ID = "uid";
    public static final String CLAIM_TOKEN_TYPE = "typ";

    public static final String TOKEN_TYPE_ACCESS = "access";

    private final JwtParser parser;

    public JwtService(AuthProperties props) {
        SecretKey key = Keys.hmacShaKeyFor(props.jwtSecret().getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(props.issuer())
                .build();
    }

    /**
     * 解析并校验 accessToken：签名、issuer、过期时间，以及 typ 必须为 access
     * （防止把 refreshToken 当 accessToken 用）。
     */
    public Jws<Claims> parseAccessToken(String token) {
        Jws<Claims> jws = parser.parseSignedClaims(token);
        String typ = jws.getPayload().get(CLAIM_TOKEN_TYPE, String.class);
        if (!TOKEN_TYPE_ACCESS.equals(typ)) {
            throw new JwtException("token_type_not_access");
        }
        return jws;
    }

    public long getUserId(Claims claims) {
        Number uid = claims.get(CLAIM_USER_ID, Number.class);
        if (uid == null || uid.longValue() <= 0) {
            throw new JwtException("missing_uid");
        }
        return uid.longValue();
    }

    /**
     * 便捷方法：校验 token 并直接返回 userId。
     */
    public long verifyUserId(String token) {
        return getUserId(parseAccessToken(token).getPayload());
    }
}
