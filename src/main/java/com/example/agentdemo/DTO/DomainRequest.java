package com.example.agentdemo.DTO;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DomainRequest {
    @NotBlank
    @Size(max = 100)
    private String name;

    @Size(max = 2000)
    private String description;

    // 수정 시에만 사용, null 이면 유지
    private Boolean active;
}
