package com.example.agentdemo.Config.JWT;

import com.example.agentdemo.Enum.UserRole;
import io.jsonwebtoken.*; // JWT 관련 인터페이스/클래스
import io.jsonwebtoken.security.Keys; // 서명 키 생성 유틸
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;

@Component
public class JwtUtil {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";

    private final Key key;
    private final long expirationMs;

    public JwtUtil(
            @Value("${auth.jwt.secret}") String secret,
            @Value("${auth.jwt.exp-ms}") long expirationMs) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationMs = expirationMs;
    }

    /** 토큰 생성: subject=userId, claim=email, role */
    public String generateToken(String userId, String email, UserRole role) {
        return Jwts.builder()
                .setSubject(userId)
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_ROLE, role.name())
                .setIssuedAt(new Date())
                .setExpiration(new Date(System.currentTimeMillis() + expirationMs))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /** 유효성 검증 (서명/만료 실패 시 JwtException) */
    public Jws<Claims> validate(String token) {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token);
    }
}
