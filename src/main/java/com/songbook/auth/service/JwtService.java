package com.songbook.auth.service;

import com.songbook.auth.Actor;
import com.songbook.auth.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

/**
 * accessToken 的签发与校验。登录流程在身份服务里，这里只负责把 token 还原成 {@link Actor}。
 */
@Service
public class JwtService {

    public static final String CLAIM_USER_ID = "uid";
    public static final String CLAIM_TOKEN_TYPE = "typ";
    public static final String CLAIM_ANONYMOUS = "anon";

    public static final String TOKEN_TYPE_ACCESS = "access";

    private final AuthProperties props;
    private final SecretKey key;

    public JwtService(AuthProperties props) {
        this.props = props;
        this.key = Keys.hmacShaKeyFor(props.jwtSecret().getBytes(StandardCharsets.UTF_8));
    }

    public String issueAccessToken(long userId, boolean anonymous) {
        Instant now = Instant.now();
        Instant exp = now.plusSeconds(props.accessTokenTtlSeconds());

        return Jwts.builder()
                .issuer(props.issuer())
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(exp))
                .claims(Map.of(
                        CLAIM_USER_ID, userId,
                        CLAIM_TOKEN_TYPE, TOKEN_TYPE_ACCESS,
                        CLAIM_ANONYMOUS, anonymous
                ))
                .signWith(key)
                .compact();
    }

    /**
     * 解析并校验 accessToken：签名、issuer、typ 三层校验。
     */
    public Jws<Claims> parseAccessToken(String token) {
        JwtParser parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(props.issuer())
                .build();

        Jws<Claims> jws = parser.parseSignedClaims(token);
        String typ = jws.getPayload().get(CLAIM_TOKEN_TYPE, String.class);
        if (!TOKEN_TYPE_ACCESS.equals(typ)) {
            throw new JwtException("token_type_not_access");
        }
        return jws;
    }

    public Actor toActor(Claims claims) {
        Number uid = claims.get(CLAIM_USER_ID, Number.class);
        if (uid == null || uid.longValue() <= 0) {
            throw new JwtException("missing_uid");
        }
        Boolean anon = claims.get(CLAIM_ANONYMOUS, Boolean.class);
        return new Actor(uid.longValue(), Boolean.TRUE.equals(anon));
    }
}
