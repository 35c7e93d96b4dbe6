package com.example.agentdemo.Domain;

import com.example.agentdemo.Enum.UserRole;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Setter
@Getter
@Entity
public class Users {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;  // 내부 참조용 PK

    @Column(unique = true, nullable = false)
    private String userId;  // 로그인 아이디

    @Column(unique = true, nullable = false)
    private String email;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String password;  // BCrypt 해시

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UserRole role = UserRole.DEMO_USER;

    private LocalDateTime lastLogin;

    private boolean active = true;

    public boolean isAdministrator() {
        return role == UserRole.ADMINISTRATOR;
    }
}
