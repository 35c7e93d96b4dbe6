package com.example.agentdemo.Enum;

public enum AuditAction {
    CREATE,
    UPDATE,
    DELETE,
    UPDATE_STATUS,
    UPDATE_APPROVAL
}
