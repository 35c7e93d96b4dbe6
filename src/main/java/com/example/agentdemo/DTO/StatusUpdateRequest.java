package com.example.agentdemo.DTO;

import com.example.agentdemo.Enum.ContentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class StatusUpdateRequest {
    @NotNull(message = "Status must be Draft or Final")
    private ContentStatus status;
}
