package com.star.loginsight.dto;

import com.star.loginsight.model.MetricKind;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Expectation for one dimension key; absent slots are wildcards")
public class BaselineRequest {

    @NotBlank(message = "Service is required")
    @Schema(example = "auth-service")
    private String service;

    @Schema(example = "ERROR")
    private String severity;

    @Schema(example = "DB_TIMEOUT")
    private String errorSignature;

    @NotNull(message = "Expected value is required")
    private Double expected;

    @NotNull(message = "Variability is required")
    @PositiveOrZero(message = "Variability must not be negative")
    private Double variability;

    @Schema(description = "Metric the expectation describes", defaultValue = "COUNT")
    private MetricKind metric;
}
