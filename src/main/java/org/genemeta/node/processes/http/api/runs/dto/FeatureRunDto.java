package org.genemeta.node.processes.http.api.runs.dto;

import java.time.Instant;
import java.util.List;

import org.genemeta.datapipeline.api.resources.database.dto.FeatureRun;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Provenance of one aggregation run with its data-quality warnings.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeatureRunDto(String featureRunId,
                            int triggeredByStudyKey,
                            Integer diseaseKey,
                            String technology,
                            String startedAt,
                            String endedAt,
                            String status,
                            String finalState,
                            int attempts,
                            int pairsTouched,
                            int contributionsApplied,
                            int contributionsSkipped,
                            String errorCode,
                            String errorMessage,
                            List<ValidationWarningDto> warnings) {

    public static FeatureRunDto from(final FeatureRun run, final List<ValidationWarningDto> warnings) {
        return new FeatureRunDto(run.featureRunId(), run.triggeredByStudyKey(), run.diseaseKey(), run.technology(),
            format(run.startedAt()), format(run.endedAt()), run.status().name(), run.finalState(), run.attempts(),
            run.pairsTouched(), run.contributionsApplied(), run.contributionsSkipped(), run.errorCode(),
            run.errorMessage(), warnings);
    }

    private static String format(final Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
