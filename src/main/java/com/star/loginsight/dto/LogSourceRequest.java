package com.star.loginsight.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Lines of one log source, in source order")
public class LogSourceRequest {

    @NotBlank(message = "Source id is required")
    @Schema(description = "Identifier of the source, used as service fallback", example = "auth-service")
    private String sourceId;

    @NotNull(message = "Lines are required")
    @Schema(description = "Raw log lines; line numbers are assigned from 1")
    private List<@NotNull(message = "Lines must not contain null") String> lines;
}
