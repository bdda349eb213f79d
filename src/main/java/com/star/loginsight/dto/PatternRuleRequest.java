package com.star.loginsight.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Pattern rule; replaces the configured rule table when any are given")
public class PatternRuleRequest {

    @NotBlank(message = "Rule id is required")
    private String id;

    @NotBlank(message = "Regex is required")
    private String regex;

    @NotEmpty(message = "At least one field mapping is required")
    @Schema(description = "Capture group name or index -> target field", example = "{\"level\": \"severity\"}")
    private Map<String, String> fields;

    @Schema(description = "Optional DateTimeFormatter pattern for the timestamp group")
    private String timestampFormat;
}
