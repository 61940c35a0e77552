package com.agentpipeline.common.model;

/**
 * Well-known keys of {@link AgentResult#details()} read across agent boundaries.
 */
public final class DetailKeys {

    private DetailKeys() {}

    public static final String EFFECTIVE_AGE        = "effectiveAge";
    public static final String CRITICAL_OVERRIDE    = "criticalOverride";

    public static final String EXTERIOR_COUNT       = "exteriorCount";
    public static final String INTERIOR_COUNT       = "interiorCount";
    public static final String FRONT_PHOTO_ID       = "frontPhotoId";

    public static final String VERDICT              = "verdict";
    public static final String VERDICT_COLOR        = "verdictColor";
    public static final String FINAL_CATEGORY       = "finalCategory";
    public static final String TOTAL_WARNINGS       = "totalWarnings";
    public static final String HAS_FAIL             = "hasFail";
    public static final String HUMAN_REPORT         = "humanReport";
    public static final String MATRIX_RESULT        = "matrixResult";
    public static final String AGENT_SUMMARIES      = "agentSummaries";
}
