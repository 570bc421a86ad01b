package org.chatrooms.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.Key;
import java.util.Base64;
import java.util.Date;

/**
 * JWT helper.
 * The secret comes from the "jwt.secret" property (BASE64 encoded key).
 * Example (application.properties):
 *   jwt.secret=BASE64_ENCODED_32_BYTES_KEY
 *   jwt.expiration-ms=86400000
 *
 * Tokens are minted by the auth service; {@link #generateToken} exists for tooling and tests.
 */
@Component
public class JwtUtil {

    public static final String USERNAME_CLAIM = "username";
    public static final String ROLE_CLAIM = "role";

    private Key key;

    @Value("${jwt.secret:}")
    private String jwtSecretBase64;

    @Value("${jwt.expiration-ms:86400000}")
    private long jwtExpirationMs;

    public JwtUtil() {
    }

    public JwtUtil(String jwtSecretBase64, long jwtExpirationMs) {
        this.jwtSecretBase64 = jwtSecretBase64;
        this.jwtExpirationMs = jwtExpirationMs;
        init();
    }

    @PostConstruct
    public void init() {
        if (jwtSecretBase64 == null || jwtSecretBase64.isBlank()) {
            throw new IllegalStateException("jwt.secret must be set (base64).");
        }
        byte[] keyBytes = Base64.getDecoder().decode(jwtSecretBase64);
        this.key = Keys.hmacShaKeyFor(keyBytes);
    }

    public String generateToken(String userId, String username, String role) {
        Date now = new Date();
        return Jwts.builder()
                .setSubject(userId)
                .claim(USERNAME_CLAIM, username)
                .claim(ROLE_CLAIM, role)
                .setIssuedAt(now)
                .setExpiration(new Date(now.getTime() + jwtExpirationMs))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * @throws JwtException when the signature is wrong or the token expired
     */
    public Claims parse(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build()
                .parseClaimsJws(token).getBody();
    }
}
