package com.bank.lending.controller;

import com.bank.lending.model.AssessmentRequest;
import com.bank.lending.model.AssessmentResult;
import com.bank.lending.model.BatchAssessmentRequest;
import com.bank.lending.model.BatchAssessmentResult;
import com.bank.lending.service.BatchAssessmentService;
import com.bank.lending.service.LoanAssessmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/assessments")
@Tag(name = "Assessments", description = "Assess loan applications from bank transaction history")
public class AssessmentController {

    private final LoanAssessmentService assessmentService;
    private final BatchAssessmentService batchService;

    public AssessmentController(LoanAssessmentService assessmentService,
                                BatchAssessmentService batchService) {
        this.assessmentService = assessmentService;
        this.batchService = batchService;
    }

    @Operation(summary = "Assess a single loan application",
            description = "Classifies every transaction, aggregates income, expense, debt, balance and risk metrics, " +
                    "applies the decline/refer rules and score bands, and returns the decision with the loan offer " +
                    "(APPROVE only), the metrics and the per-transaction classification audit.")
    @PostMapping
    public ResponseEntity<AssessmentResult> assess(@RequestBody AssessmentRequest request) {
        return ResponseEntity.ok(assessmentService.assess(request));
    }

    @Operation(summary = "Assess a batch of loan applications",
            description = "Assesses applications in parallel. Failures are reported per application " +
                    "(DATA_VALIDATION_ERROR, PROCESSING_ERROR, TIMEOUT) without failing the batch.")
    @PostMapping("/batch")
    public ResponseEntity<BatchAssessmentResult> assessBatch(@RequestBody BatchAssessmentRequest request) {
        return ResponseEntity.ok(batchService.assessBatch(request));
    }
}
