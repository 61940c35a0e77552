package com.agentpipeline.orchestrator.agent;

import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.AgentStatus;
import com.agentpipeline.common.model.DetailKeys;
import com.agentpipeline.common.model.ImageDescriptor;
import com.agentpipeline.common.model.LogLevel;
import com.agentpipeline.common.model.PipelineContext;
import com.agentpipeline.common.model.PipelineInput;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Verifies that the photos were taken at the property and recently.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>Photo GPS more than {@value #DISTANCE_WARN_METERS} m from the property is a warning,
 *       more than {@value #DISTANCE_FAIL_METERS} m an error.</li>
 *   <li>Photos taken more than {@value #MAX_PHOTO_AGE_DAYS} days ago are an error.</li>
 *   <li>Most photos lacking GPS is a warning.</li>
 * </ul>
 *
 * <p>Runs after {@link GuardianAgent} so it can report the distance of the street-facing
 * photo the completeness check selected.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Order(60)
public class GeoValidatorAgent extends PipelineAgent {

    static final double DISTANCE_WARN_METERS = 500;
    static final double DISTANCE_FAIL_METERS = 2000;
    static final long   MAX_PHOTO_AGE_DAYS   = 90;

    private static final double EARTH_RADIUS_METERS = 6_371_000;

    private static final String PROMPT = """
        Verify that every photo was taken at the declared property location \
        and that the photo set is no older than three months.""";

    private final Clock clock;

    public GeoValidatorAgent(Clock clock) {
        super(AgentNames.GEOVALIDATOR, "Photo location and freshness verification", PROMPT);
        this.clock = clock;
    }

    @Override
    public Set<String> dependsOn() {
        return Set.of(AgentNames.GUARDIAN);
    }

    @Override
    protected Mono<AgentResult> run(PipelineContext context) {
        return Mono.fromCallable(() -> validate(context));
    }

    private AgentResult validate(PipelineContext context) {
        PipelineInput input = context.input();
        if (!input.hasPropertyLocation()) {
            log("Property coordinates missing.", LogLevel.WARN);
            return AgentResult.builder(AgentStatus.WARN)
                .summary("Location cannot be verified, property coordinates are missing")
                .warning("Property coordinates were not provided.")
                .build();
        }

        List<ImageDescriptor> images = input.images();
        AgentResult.Builder result = AgentResult.builder(AgentStatus.SUCCESS);
        Map<String, Long> distances = new LinkedHashMap<>();
        List<String> withoutGps = new ArrayList<>();
        double maxDistance = 0;

        log("Measuring photo distances from the property.", LogLevel.THINKING);
        for (ImageDescriptor image : images) {
            if (!image.hasGps()) {
                withoutGps.add(image.id());
                continue;
            }
            double distance = haversine(input.propertyLatitude(), input.propertyLongitude(),
                image.gpsLatitude(), image.gpsLongitude());
            maxDistance = Math.max(maxDistance, distance);
            distances.put(image.id(), Math.round(distance));
            if (distance > DISTANCE_FAIL_METERS) {
                result.error(String.format("Photo %s: %.0f m from the property", image.id(), distance));
            } else if (distance > DISTANCE_WARN_METERS) {
                result.warning(String.format("Photo %s: %.0f m from the property", image.id(), distance));
            }
        }
        log("Photos with GPS: " + distances.size() + ", without GPS: " + withoutGps.size());

        if (!images.isEmpty() && withoutGps.size() * 2 > images.size()) {
            result.warning("Most photos carry no GPS data (" + withoutGps.size() + "/" + images.size() + ").");
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(MAX_PHOTO_AGE_DAYS));
        List<String> stale = images.stream()
            .filter(i -> i.dateTaken() != null && i.dateTaken().isBefore(cutoff))
            .map(ImageDescriptor::id)
            .toList();
        if (!stale.isEmpty()) {
            log(stale.size() + " photos are older than " + MAX_PHOTO_AGE_DAYS + " days.", LogLevel.WARN);
            result.error(stale.size() + " photos are older than " + MAX_PHOTO_AGE_DAYS
                + " days: " + String.join(", ", stale) + ". Photos must be current.");
        }

        context.resultOf(AgentNames.GUARDIAN)
            .map(guardian -> guardian.detail(DetailKeys.FRONT_PHOTO_ID))
            .map(Object::toString)
            .ifPresent(front -> {
                result.detail(DetailKeys.FRONT_PHOTO_ID, front);
                Long frontDistance = distances.get(front);
                if (frontDistance != null) {
                    log("Street-facing photo " + front + " is " + frontDistance + " m from the property.");
                    result.detail("frontPhotoDistanceMeters", frontDistance);
                }
            });

        AgentResult outcome = result
            .summary(String.format("%d photos with GPS, max distance %.0f m", distances.size(), maxDistance))
            .detail("photosWithGps", distances.size())
            .detail("photosWithoutGps", withoutGps)
            .detail("maxDistanceMeters", Math.round(maxDistance))
            .detail("photoDistances", distances)
            .detail("stalePhotos", stale)
            .statusFromFindings()
            .build();
        log("GeoValidator result: " + outcome.status());
        return outcome;
    }

    /** Great-circle distance in meters between two WGS84 points. */
    static double haversine(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
            + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        return EARTH_RADIUS_METERS * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }
}
