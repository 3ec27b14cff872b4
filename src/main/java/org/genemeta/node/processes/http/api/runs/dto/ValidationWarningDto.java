package org.genemeta.node.processes.http.api.runs.dto;

import org.genemeta.datapipeline.api.resources.database.dto.ValidationWarning;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationWarningDto(int studyKey, String pairId, String metricName, String code, String severity,
                                   String details) {

    public static ValidationWarningDto from(final ValidationWarning warning) {
        return new ValidationWarningDto(warning.studyKey(), warning.pairId(), warning.metricName(),
            warning.code().name(), ValidationWarning.SEVERITY, warning.details());
    }
}
