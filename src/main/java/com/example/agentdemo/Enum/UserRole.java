package com.example.agentdemo.Enum;

public enum UserRole {
    ADMINISTRATOR,
    DEMO_USER
}
