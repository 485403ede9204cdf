package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@Schema(description = "Points awarded for one metric within a component")
public class SubScore {

    @Schema(description = "Sub-score name", example = "debt-to-income")
    String name;

    @Schema(description = "Metric value that was banded; null when the metric is undefined", example = "22.5")
    Double metricValue;

    @Schema(description = "Points awarded", example = "18.0")
    double points;
}
