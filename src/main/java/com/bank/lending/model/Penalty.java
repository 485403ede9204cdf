package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@Schema(description = "Flat penalty applied on top of banded points")
public class Penalty {

    @Schema(description = "Penalty name", example = "gambling-percentage")
    String name;

    @Schema(description = "Metric value that crossed the penalty threshold", example = "8.2")
    double metricValue;

    @Schema(description = "Points deducted (negative)", example = "-5.0")
    double points;
}
