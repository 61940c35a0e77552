package com.agentpipeline.common.model;

public enum LogLevel {
    INFO,
    WARN,
    ERROR,
    THINKING
}
