package com.agentpipeline.orchestrator.agent;

/**
 * Names of the agents bundled with the service.
 */
public final class AgentNames {

    private AgentNames() {}

    public static final String GUARDIAN     = "Guardian";
    public static final String HISTORIAN    = "Historian";
    public static final String INSPECTOR    = "Inspector";
    public static final String GEOVALIDATOR = "GeoValidator";
    public static final String STRATEGIST   = "Strategist";
}
