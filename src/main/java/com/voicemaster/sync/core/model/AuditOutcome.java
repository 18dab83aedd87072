package com.voicemaster.sync.core.model;

public enum AuditOutcome {
    SUCCESS,
    FAILURE
}
