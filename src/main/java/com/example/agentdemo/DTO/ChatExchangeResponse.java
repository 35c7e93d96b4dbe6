package com.example.agentdemo.DTO;

import java.util.List;

// 사용자 메시지 + 에이전트 응답
public record ChatExchangeResponse(List<ChatMessageDto> messages) {
}
