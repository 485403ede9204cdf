package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Per-component breakdown of the total score")
public class ScoreBreakdown {

    List<ComponentScore> components;

    @Schema(description = "Sum of component points before clamping", example = "82.0")
    double rawTotal;

    @Schema(description = "Total after clamping to the score range", example = "82.0")
    double total;

    @Schema(description = "Sum of all penalties applied (negative or zero)", example = "0.0")
    double penaltiesApplied;
}
