package com.star.loginsight.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Log lines to analyze, with optional per-run overrides")
public class AnalysisRequest {

    @Valid
    @NotEmpty(message = "At least one log source is required")
    private List<LogSourceRequest> sources;

    @Schema(description = "Aggregation window, ISO-8601 duration", example = "PT5M")
    private Duration windowSize;

    @Schema(description = "Hypothesis correlation window, ISO-8601 duration", example = "PT5M")
    private Duration correlationWindow;

    @PositiveOrZero(message = "Event limit must not be negative")
    private Integer eventLimit;

    @Valid
    private ThresholdRequest thresholds;

    @Valid
    private List<PatternRuleRequest> rules;

    // Line references are sourceId:lineNumber, so two sources may not share an id.
    @JsonIgnore
    @Schema(hidden = true)
    @AssertTrue(message = "Source ids must be unique")
    public boolean isSourceIdsUnique() {
        if (sources == null) {
            return true;
        }
        Set<String> seen = new HashSet<>();
        return sources.stream()
                .filter(Objects::nonNull)
                .map(LogSourceRequest::getSourceId)
                .filter(Objects::nonNull)
                .allMatch(seen::add);
    }
}
