package com.example.agentdemo.Config.JWT;

import com.example.agentdemo.Enum.UserRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtUtilTest {

    private static final String SECRET = "test-secret-key-for-agent-demo-0123456789abcdef";

    @Test
    void token_carriesUserIdEmailAndRole() {
        JwtUtil jwt = new JwtUtil(SECRET, 60_000);

        String token = jwt.generateToken("admin", "admin@example.com", UserRole.ADMINISTRATOR);

        Claims claims = jwt.validate(token).getBody();
        assertThat(claims.getSubject()).isEqualTo("admin");
        assertThat(claims.get(JwtUtil.CLAIM_ROLE, String.class)).isEqualTo("ADMINISTRATOR");
        assertThat(claims.get(JwtUtil.CLAIM_EMAIL, String.class)).isEqualTo("admin@example.com");
    }

    @Test
    void expiredToken_isRejected() {
        JwtUtil jwt = new JwtUtil(SECRET, -1_000);

        String token = jwt.generateToken("demo", "demo@example.com", UserRole.DEMO_USER);

        assertThatThrownBy(() -> jwt.validate(token)).isInstanceOf(JwtException.class);
    }

    @Test
    void tokenSignedWithOtherKey_isRejected() {
        String token = new JwtUtil("another-secret-key-for-agent-demo-9876543210zyx", 60_000)
                .generateToken("demo", "demo@example.com", UserRole.DEMO_USER);

        assertThatThrownBy(() -> new JwtUtil(SECRET, 60_000).validate(token)).isInstanceOf(JwtException.class);
    }
}
