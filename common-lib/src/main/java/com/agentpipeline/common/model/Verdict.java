package com.agentpipeline.common.model;

/**
 * Final three-level decision of a pipeline run, with the display colour used by clients.
 */
public enum Verdict {
    ONLINE("green"),
    SUPERVISED("orange"),
    RETURN("red");

    private final String color;

    Verdict(String color) {
        this.color = color;
    }

    public String color() {
        return color;
    }
}
