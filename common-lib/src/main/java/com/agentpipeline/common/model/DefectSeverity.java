package com.agentpipeline.common.model;

public enum DefectSeverity {
    MINOR,
    MEDIUM,
    SEVERE,
    CRITICAL
}
