package com.star.loginsight.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Threshold overrides; absent fields keep the configured value")
public class ThresholdRequest {

    @Positive(message = "Medium threshold must be positive")
    private Double medium;

    @Positive(message = "High threshold must be positive")
    private Double high;

    @Positive(message = "Epsilon must be positive")
    private Double epsilon;

    @Min(value = 1, message = "Evidence cap must be at least 1")
    private Integer evidenceCap;
}
