package com.example.agentdemo.Service;

import com.example.agentdemo.Config.JWT.JwtUtil;
import com.example.agentdemo.DTO.AuthResponse;
import com.example.agentdemo.DTO.LoginRequest;
import com.example.agentdemo.DTO.SignupRequest;
import com.example.agentdemo.Domain.Users;
import com.example.agentdemo.Enum.UserRole;
import com.example.agentdemo.Repository.UserRepository;
import com.example.agentdemo.Util.CustomException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AuthServiceTest {

    private UserRepository userRepository;
    private final BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(4);
    private final JwtUtil jwtUtil = new JwtUtil("test-secret-key-for-agent-demo-0123456789abcdef", 60_000);
    private AuthService authService;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
        authService = new AuthService(userRepository, jwtUtil, encoder);
    }

    @Test
    void signup_createsDemoUserWithHashedPassword() {
        when(userRepository.save(any(Users.class))).then(returnsFirstArg());
        SignupRequest req = signup("demo", "demo@example.com", "secret1");

        AuthResponse response = authService.signup(req);

        assertThat(response.getRole()).isEqualTo(UserRole.DEMO_USER);
        assertThat(jwtUtil.validate(response.getToken()).getBody().getSubject()).isEqualTo("demo");
        verify(userRepository).save(argThat(u -> encoder.matches("secret1", u.getPassword())));
    }

    @Test
    void signup_duplicateUserIdIsConflict() {
        when(userRepository.existsByUserId("demo")).thenReturn(true);

        assertThatThrownBy(() -> authService.signup(signup("demo", "demo@example.com", "secret1")))
                .isInstanceOf(CustomException.class)
                .extracting(e -> ((CustomException) e).getStatus())
                .isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void login_wrongPasswordAndInactiveUserGetSameError() {
        Users user = user("demo", "secret1");
        when(userRepository.findByUserId("demo")).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> authService.login(new LoginRequest("demo", "nope")))
                .isInstanceOf(CustomException.class)
                .hasMessage("아이디 또는 비밀번호가 올바르지 않습니다.");

        user.setActive(false);
        assertThatThrownBy(() -> authService.login(new LoginRequest("demo", "secret1")))
                .isInstanceOf(CustomException.class)
                .hasMessage("아이디 또는 비밀번호가 올바르지 않습니다.");
    }

    @Test
    void login_updatesLastLoginAndIssuesRoleToken() {
        Users user = user("admin", "secret1");
        user.setRole(UserRole.ADMINISTRATOR);
        when(userRepository.findByUserId("admin")).thenReturn(Optional.of(user));

        AuthResponse response = authService.login(new LoginRequest("admin", "secret1"));

        assertThat(user.getLastLogin()).isNotNull();
        assertThat(jwtUtil.validate(response.getToken()).getBody().get("role", String.class)).isEqualTo("ADMINISTRATOR");
    }

    @Test
    void findActiveUser_missingUserIsUnauthorized() {
        when(userRepository.findByUserId("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.findActiveUser("ghost"))
                .isInstanceOf(CustomException.class)
                .extracting(e -> ((CustomException) e).getStatus())
                .isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    private static SignupRequest signup(String userId, String email, String password) {
        SignupRequest req = new SignupRequest();
        req.setUserId(userId);
        req.setEmail(email);
        req.setName("Demo User");
        req.setPassword(password);
        return req;
    }

    private Users user(String userId, String rawPassword) {
        Users u = new Users();
        u.setUserId(userId);
        u.setEmail(userId + "@example.com");
        u.setName(userId);
        u.setPassword(encoder.encode(rawPassword));
        return u;
    }
}
