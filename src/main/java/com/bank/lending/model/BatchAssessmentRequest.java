package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Several loan applications assessed together")
public class BatchAssessmentRequest {

    @Schema(description = "Applications to assess")
    private List<AssessmentRequest> applications;
}
