package com.agentpipeline.orchestrator.agent;

import com.agentpipeline.common.matrix.AgeBand;
import com.agentpipeline.common.model.AgentResult;
import com.agentpipeline.common.model.AgentStatus;
import com.agentpipeline.common.model.DetailKeys;
import com.agentpipeline.common.model.LogLevel;
import com.agentpipeline.common.model.PipelineContext;
import com.agentpipeline.common.model.PipelineInput;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Derives the effective age of the building and its age-only category.
 *
 * <p>Effective age is measured from the reconstruction year when one is given, otherwise
 * from the construction year, against a fixed reference year, and never drops below zero.
 */
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
@Order(30)
public class HistorianAgent extends PipelineAgent {

    static final int OLD_BUILDING_AGE = 50;

    private static final String PROMPT = """
        Determine the effective age of the building from its construction and \
        reconstruction years and assign the age category 1 to 5.""";

    private final int referenceYear;

    public HistorianAgent(@Value("${pipeline.reference-year:2026}") int referenceYear) {
        super(AgentNames.HISTORIAN, "Effective age and age category", PROMPT);
        this.referenceYear = referenceYear;
    }

    @Override
    protected Mono<AgentResult> run(PipelineContext context) {
        return Mono.fromCallable(() -> assess(context.input()));
    }

    private AgentResult assess(PipelineInput input) {
        Integer built = positive(input.yearBuilt());
        Integer reconstructed = positive(input.yearReconstructed());

        if (built == null && reconstructed == null) {
            log("Neither construction nor reconstruction year provided.", LogLevel.ERROR);
            return AgentResult.builder(AgentStatus.FAIL)
                .summary("Building age cannot be determined")
                .error("Construction year or reconstruction year is required.")
                .build();
        }

        int baseYear = reconstructed != null ? reconstructed : built;
        String basis = reconstructed != null ? "reconstruction" : "construction";
        if (baseYear > referenceYear) {
            log("Year " + baseYear + " lies after reference year " + referenceYear
                + ", effective age floored at 0.", LogLevel.WARN);
        }
        int effectiveAge = Math.max(0, referenceYear - baseYear);
        AgeBand band = AgeBand.of(effectiveAge);
        log("Effective age " + effectiveAge + " years from " + basis + " year " + baseYear
            + " → category " + band.category());

        AgentResult.Builder result = AgentResult.builder(AgentStatus.SUCCESS)
            .category(band.category())
            .summary("Effective age " + effectiveAge + " years (" + basis + " " + baseYear
                + "), category " + band.category())
            .detail(DetailKeys.EFFECTIVE_AGE, effectiveAge)
            .detail("ageBasis", basis)
            .detail("ageBand", band.name())
            .detail("yearBuilt", input.yearBuilt())
            .detail("yearReconstructed", input.yearReconstructed())
            .detail("referenceYear", referenceYear);

        if (effectiveAge > OLD_BUILDING_AGE) {
            result.warning("Effective age of " + effectiveAge + " years exceeds " + OLD_BUILDING_AGE + " years.");
        }
        return result.statusFromFindings().build();
    }

    private static Integer positive(Integer year) {
        return year != null && year > 0 ? year : null;
    }
}
