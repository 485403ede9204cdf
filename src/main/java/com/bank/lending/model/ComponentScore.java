package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Score of one component, clamped to its configured range")
public class ComponentScore {

    @Schema(description = "Component", example = "AFFORDABILITY")
    ComponentType component;

    @Schema(description = "Points after penalties and clamping", example = "41.0")
    double points;

    @Schema(description = "Configured maximum points", example = "45.0")
    double maxPoints;

    @Schema(description = "Configured minimum points", example = "0.0")
    double minPoints;

    List<SubScore> subScores;

    List<Penalty> penalties;
}
