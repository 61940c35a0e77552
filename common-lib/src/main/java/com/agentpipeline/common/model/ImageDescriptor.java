package com.agentpipeline.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Metadata of one uploaded photo. GPS coordinates and capture time come from EXIF and may be
 * absent; {@code categories} is empty when the photo was never classified.
 */
public record ImageDescriptor(
    @JsonProperty("id") String id,
    @JsonProperty("fileName") String fileName,
    @JsonProperty("categories") List<ImageCategory> categories,
    @JsonProperty("gpsLatitude") Double gpsLatitude,
    @JsonProperty("gpsLongitude") Double gpsLongitude,
    @JsonProperty("dateTaken") Instant dateTaken
) {
    public ImageDescriptor {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public boolean hasGps() {
        return gpsLatitude != null && gpsLongitude != null;
    }
}
