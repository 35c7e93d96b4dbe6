package com.example.agentdemo.DTO;

import com.example.agentdemo.Enum.AgentEnvironment;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AgentRequest {
    @NotBlank
    @Size(max = 100)
    private String name;

    @NotNull
    private AgentEnvironment environment;

    @NotBlank
    @Size(max = 20)
    private String version;

    @NotBlank
    @Size(max = 100)
    private String developedBy;

    private String description;

    @NotNull
    private UUID domainId;
}
