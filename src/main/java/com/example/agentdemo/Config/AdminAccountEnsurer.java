package com.example.agentdemo.Config;

import com.example.agentdemo.Domain.Users;
import com.example.agentdemo.Enum.UserRole;
import com.example.agentdemo.Repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * 기동 시 관리자 계정이 없으면 생성
 * (회원 가입으로는 데모 사용자만 만들어진다)
 */
@Slf4j
@Component
public class AdminAccountEnsurer implements ApplicationRunner {

    private final UserRepository userRepository;
    private final BCryptPasswordEncoder passwordEncoder;
    private final String userId;
    private final String email;
    private final String password;

    public AdminAccountEnsurer(UserRepository userRepository,
            BCryptPasswordEncoder passwordEncoder,
            @Value("${auth.bootstrap-admin.user-id}") String userId,
            @Value("${auth.bootstrap-admin.email}") String email,
            @Value("${auth.bootstrap-admin.password}") String password) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.userId = userId;
        this.email = email;
        this.password = password;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (userRepository.existsByUserId(userId)) {
            return;
        }
        Users admin = new Users();
        admin.setUserId(userId);
        admin.setEmail(email);
        admin.setName("Administrator");
        admin.setRole(UserRole.ADMINISTRATOR);
        admin.setPassword(passwordEncoder.encode(password));
        userRepository.save(admin);
        log.info("관리자 계정 생성: userId={}", userId);
    }
}
