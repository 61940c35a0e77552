package com.agentpipeline.common.model;

/**
 * Content classification of a single property photo.
 *
 * <p>One photo may carry several categories (a kitchen opening onto the living room is both
 * {@link #INTERIOR_KITCHEN} and {@link #INTERIOR_LIVING_ROOM}).
 */
public enum ImageCategory {
    EXTERIOR_FRONT,
    EXTERIOR_REAR,
    EXTERIOR_SIDE,
    EXTERIOR_DETAIL,
    INTERIOR_KITCHEN,
    INTERIOR_LIVING_ROOM,
    INTERIOR_BEDROOM,
    INTERIOR_BATHROOM,
    INTERIOR_OTHER,
    SURROUNDINGS;

    public boolean isExterior() {
        return name().startsWith("EXTERIOR_");
    }

    public boolean isInterior() {
        return name().startsWith("INTERIOR_");
    }

    public boolean isRearOrSideView() {
        return this == EXTERIOR_REAR || this == EXTERIOR_SIDE;
    }
}
