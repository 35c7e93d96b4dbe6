package com.example.agentdemo.Service;

import com.example.agentdemo.Config.JWT.JwtUtil;
import com.example.agentdemo.DTO.AuthResponse;
import com.example.agentdemo.DTO.LoginRequest;
import com.example.agentdemo.DTO.SignupRequest;
import com.example.agentdemo.Domain.Users;
import com.example.agentdemo.Enum.UserRole;
import com.example.agentdemo.Repository.UserRepository;
import com.example.agentdemo.Util.CustomException;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private static final String LOGIN_FAILED = "아이디 또는 비밀번호가 올바르지 않습니다.";

    private final UserRepository userRepository;
    private final JwtUtil jwtUtil;
    private final BCryptPasswordEncoder passwordEncoder;

    // 가입은 항상 데모 사용자, 관리자는 AdminAccountEnsurer 로만 생성
    @Transactional
    public AuthResponse signup(SignupRequest req) {
        if (userRepository.existsByUserId(req.getUserId())) {
            throw new CustomException("이미 사용 중인 아이디입니다.", HttpStatus.CONFLICT);
        }
        if (userRepository.existsByEmail(req.getEmail())) {
            throw new CustomException("이미 사용 중인 이메일입니다.", HttpStatus.CONFLICT);
        }

        Users u = new Users();
        u.setUserId(req.getUserId());
        u.setEmail(req.getEmail());
        u.setName(req.getName());
        u.setRole(UserRole.DEMO_USER);
        u.setPassword(passwordEncoder.encode(req.getPassword())); // 해시 저장

        Users saved = userRepository.save(u);
        log.info("회원 가입 완료: userId={}", saved.getUserId());
        return AuthResponse.of(saved, issueToken(saved));
    }

    @Transactional
    public AuthResponse login(LoginRequest req) {
        Users user = userRepository.findByUserId(req.getUserId())
                .orElseThrow(() -> new CustomException(LOGIN_FAILED, HttpStatus.BAD_REQUEST));

        if (!user.isActive() || !passwordEncoder.matches(req.getPassword(), user.getPassword())) {
            throw new CustomException(LOGIN_FAILED, HttpStatus.BAD_REQUEST);
        }

        user.setLastLogin(LocalDateTime.now());
        log.info("로그인: userId={}, role={}", user.getUserId(), user.getRole());
        return AuthResponse.of(user, issueToken(user));
    }

    public AuthResponse me(String userId) {
        return AuthResponse.of(findActiveUser(userId), null);
    }

    /**
     * 토큰의 userId 로 현재 사용자 조회
     * 토큰은 유효해도 계정이 삭제/비활성화된 경우 401
     */
    public Users findActiveUser(String userId) {
        return userRepository.findByUserId(userId)
                .filter(Users::isActive)
                .orElseThrow(() -> new CustomException("사용자를 찾을 수 없습니다.", HttpStatus.UNAUTHORIZED));
    }

    private String issueToken(Users user) {
        return jwtUtil.generateToken(user.getUserId(), user.getEmail(), user.getRole());
    }
}
