package com.example.agentdemo.DTO;

import com.example.agentdemo.Domain.Users;
import com.example.agentdemo.Enum.UserRole;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {
    @JsonProperty("userId")
    private String userId;

    @JsonProperty("email")
    private String email;

    @JsonProperty("name")
    private String name;

    @JsonProperty("role")
    private UserRole role;

    // /me 응답에서는 null
    @JsonProperty("token")
    private String token;

    public static AuthResponse of(Users user, String token) {
        return new AuthResponse(user.getUserId(), user.getEmail(), user.getName(), user.getRole(), token);
    }
}
