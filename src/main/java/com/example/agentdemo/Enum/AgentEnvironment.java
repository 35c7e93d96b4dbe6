package com.example.agentdemo.Enum;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentEnvironment {
    AGENTFORCE("Agentforce"),
    COPILOT("Copilot"),
    CUSTOM("Custom"),
    OTHER("Other");

    private final String label;

    AgentEnvironment(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static AgentEnvironment from(String value) {
        for (AgentEnvironment e : values()) {
            if (e.label.equalsIgnoreCase(value) || e.name().equalsIgnoreCase(value)) {
                return e;
            }
        }
        throw new IllegalArgumentException("Unknown environment: " + value);
    }
}
