package com.example.agentdemo.DTO;

import java.util.UUID;

public record ChatStartResponse(UUID sessionId, UUID agentId, String agentName) {
}
