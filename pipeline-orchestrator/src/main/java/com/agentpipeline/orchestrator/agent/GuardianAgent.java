package com.agentpipeline.orchestrator.agent;

import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.AgentStatus;
import com.agentpipeline.common.model.DetailKeys;
import com.agentpipeline.common.model.ImageCategory;
import com.agentpipeline.common.model.ImageDescriptor;
import com.agentpipeline.common.model.LogLevel;
import com.agentpipeline.common.model.PipelineContext;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Completeness check of the photo set.
 *
 * <p>Requires at least {@value #MIN_TOTAL_PHOTOS} photos, of which {@value #MIN_EXTERIOR_PHOTOS}
 * show the exterior and {@value #MIN_INTERIOR_PHOTOS} the interior, plus at least one rear or
 * side view of the building. One photo may count towards several categories. When no photo
 * has been classified the category requirements cannot be verified and the result is
 * {@code WARN}.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Order(10)
public class GuardianAgent extends PipelineAgent {

    static final int MIN_TOTAL_PHOTOS    = 9;
    static final int MIN_EXTERIOR_PHOTOS = 2;
    static final int MIN_INTERIOR_PHOTOS = 3;

    private static final String PROMPT = """
        Validate that the photo set of a family house is complete: at least 9 photos, \
        at least 2 exterior and 3 interior views, and a rear or side view of the building.""";

    public GuardianAgent() {
        super(AgentNames.GUARDIAN, "Photo set completeness check", PROMPT);
    }

    @Override
    protected Mono<AgentResult> run(PipelineContext context) {
        return Mono.fromCallable(() -> inspect(context.input().images()));
    }

    private AgentResult inspect(List<ImageDescriptor> images) {
        int total = images.size();
        log("Checking " + total + " photos.");

        if (total < MIN_TOTAL_PHOTOS) {
            log("Too few photos: " + total + "/" + MIN_TOTAL_PHOTOS, LogLevel.ERROR);
            return AgentResult.builder(AgentStatus.FAIL)
                .summary("Set of " + total + " photos is below the minimum of " + MIN_TOTAL_PHOTOS)
                .detail("totalPhotos", total)
                .error("At least " + MIN_TOTAL_PHOTOS + " photos required, got " + total)
                .build();
        }

        long classified = images.stream().filter(i -> !i.categories().isEmpty()).count();
        if (classified == 0) {
            log("No photo carries a classification.", LogLevel.WARN);
            return AgentResult.builder(AgentStatus.WARN)
                .summary(total + " photos (classification unavailable)")
                .detail("totalPhotos", total)
                .detail("classificationAvailable", false)
                .warning("Photo classification unavailable, categories cannot be verified.")
                .build();
        }

        int exterior = (int) images.stream()
            .filter(i -> i.categories().stream().anyMatch(ImageCategory::isExterior)).count();
        int interior = (int) images.stream()
            .filter(i -> i.categories().stream().anyMatch(ImageCategory::isInterior)).count();
        boolean rearOrSide = images.stream()
            .anyMatch(i -> i.categories().stream().anyMatch(ImageCategory::isRearOrSideView));
        log("Exterior: " + exterior + ", interior: " + interior + ", rear/side: " + rearOrSide);

        TreeSet<String> found = new TreeSet<>();
        images.forEach(i -> i.categories().forEach(c -> found.add(c.name())));

        AgentResult.Builder result = AgentResult.builder(AgentStatus.SUCCESS)
            .summary("Set of " + total + " photos: exterior=" + exterior + ", interior=" + interior
                + ", rear/side=" + (rearOrSide ? "yes" : "no"))
            .detail("totalPhotos", total)
            .detail(DetailKeys.EXTERIOR_COUNT, exterior)
            .detail(DetailKeys.INTERIOR_COUNT, interior)
            .detail("hasRearOrSideExterior", rearOrSide)
            .detail("categoriesFound", List.copyOf(found))
            .detail("unclassifiedCount", (int) (total - classified));

        String frontPhoto = frontPhotoId(images);
        if (frontPhoto != null) {
            result.detail(DetailKeys.FRONT_PHOTO_ID, frontPhoto);
        }

        if (exterior < MIN_EXTERIOR_PHOTOS) {
            result.error("Not enough exterior photos: " + exterior + "/" + MIN_EXTERIOR_PHOTOS);
        }
        if (interior < MIN_INTERIOR_PHOTOS) {
            result.error("Not enough interior photos: " + interior + "/" + MIN_INTERIOR_PHOTOS);
        }
        if (!rearOrSide) {
            result.error("Blocking: rear or side exterior view is missing.");
        }

        AgentResult outcome = result.statusFromFindings().build();
        log("Guardian result: " + outcome.status(), outcome.isFailed() ? LogLevel.ERROR : LogLevel.INFO);
        return outcome;
    }

    /** Street-facing photo: the first front exterior, otherwise the first exterior of any kind. */
    private static String frontPhotoId(List<ImageDescriptor> images) {
        return images.stream()
            .filter(i -> i.categories().contains(ImageCategory.EXTERIOR_FRONT))
            .map(ImageDescriptor::id)
            .filter(Objects::nonNull)
            .findFirst()
            .orElseGet(() -> images.stream()
                .filter(i -> i.categories().stream().anyMatch(ImageCategory::isExterior))
                .map(ImageDescriptor::id)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null));
    }
}
