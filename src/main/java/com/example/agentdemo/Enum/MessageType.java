package com.example.agentdemo.Enum;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

// 채팅 메시지 발신자 구분
public enum MessageType {
    USER,
    AGENT;

    @JsonValue
    public String json() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageType from(String value) {
        return MessageType.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
