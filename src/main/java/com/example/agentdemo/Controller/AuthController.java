package com.example.agentdemo.Controller;

import com.example.agentdemo.DTO.AuthResponse;
import com.example.agentdemo.DTO.LoginRequest;
import com.example.agentdemo.DTO.SignupRequest;
import com.example.agentdemo.Service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {
    private final AuthService authService;

    @PostMapping("/signup")
    @ResponseStatus(HttpStatus.CREATED)
    public AuthResponse signup(@Valid @RequestBody SignupRequest req) {
        log.info("[signup] userId={}, email={}", req.getUserId(), req.getEmail());
        return authService.signup(req);
    }

    @PostMapping("/login")
    public AuthResponse login(@Valid @RequestBody LoginRequest req) {
        log.info("[login] userId={}", req.getUserId());
        return authService.login(req);
    }

    // principal 은 토큰 subject(userId)
    @GetMapping("/me")
    public AuthResponse me(Authentication authentication) {
        return authService.me(authentication.getName());
    }
}
