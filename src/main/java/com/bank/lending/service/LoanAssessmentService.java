package com.bank.lending.service;

import com.bank.lending.config.AssessmentConfig;
import com.bank.lending.config.MetricsConfig;
import com.bank.lending.engine.classification.TransactionClassifier;
import com.bank.lending.engine.decision.DecisionEngine;
import com.bank.lending.engine.metrics.MetricsAggregator;
import com.bank.lending.model.AssessmentRequest;
import com.bank.lending.model.AssessmentResult;
import com.bank.lending.model.ClassifiedTransaction;
import com.bank.lending.model.Decision;
import com.bank.lending.model.LoanRequest;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.ScoringResult;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Main orchestrator for a single loan application.
 *
 * Flow:
 * 1. Validate the request (transactions present, amount and term positive or defaulted)
 * 2. Classify every transaction (recurrence search runs once for the applicant)
 * 3. Count months of data in the trailing window
 * 4. Aggregate the metrics bundle for the requested loan
 * 5. Apply rules, score and offer via the DecisionEngine
 * 6. Record metrics and return the auditable result
 *
 * Stateless: safe to call from several batch workers at once.
 */
@Service
public class LoanAssessmentService {

    private static final Logger log = LoggerFactory.getLogger(LoanAssessmentService.class);

    private final TransactionClassifier classifier;
    private final MetricsAggregator aggregator;
    private final DecisionEngine decisionEngine;
    private final AssessmentConfig assessmentConfig;
    private final MetricsConfig metricsConfig;

    public LoanAssessmentService(TransactionClassifier classifier,
                                 MetricsAggregator aggregator,
                                 DecisionEngine decisionEngine,
                                 AssessmentConfig assessmentConfig,
                                 MetricsConfig metricsConfig) {
        this.classifier = classifier;
        this.aggregator = aggregator;
        this.decisionEngine = decisionEngine;
        this.assessmentConfig = assessmentConfig;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "loan.assess", contextualName = "assess-application")
    public AssessmentResult assess(AssessmentRequest request) {
        // 1. Validate
        validate(request);
        LoanRequest loan = new LoanRequest(
                request.getRequestedAmount() != null ? request.getRequestedAmount() : assessmentConfig.getDefaultLoanAmount(),
                request.getRequestedTermMonths() != null ? request.getRequestedTermMonths() : assessmentConfig.getDefaultLoanTerm());

        // 2. Classify
        List<ClassifiedTransaction> classified = classifier.classifyAll(request.getTransactions());

        // 3. Months of data
        int monthsOfData = aggregator.countMonthsOfData(classified);

        // 4. Metrics
        MetricsBundle metrics = aggregator.aggregate(classified, monthsOfData, loan, request.getCurrentBalance());

        // 5. Decision
        ScoringResult scoring = decisionEngine.decide(metrics, loan);

        // 6. Record
        metricsConfig.recordAssessment(scoring.getDecision().name(), scoring.getScore());
        if (scoring.getDecision() == Decision.DECLINE) {
            log.warn("Application {} declined (score {}): {}",
                    request.getApplicationRef(), scoring.getScore(), scoring.getReasons());
        } else {
            log.info("Application {} assessed: decision={}, score={}, transactions={}, months={}",
                    request.getApplicationRef(), scoring.getDecision(), scoring.getScore(),
                    classified.size(), monthsOfData);
        }

        return AssessmentResult.builder()
                .applicationRef(request.getApplicationRef())
                .scoring(scoring)
                .metrics(metrics)
                .classifications(classified)
                .monthsOfData(monthsOfData)
                .assessedAt(System.currentTimeMillis())
                .build();
    }

    private void validate(AssessmentRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Assessment request is required");
        }
        if (request.getTransactions() == null || request.getTransactions().isEmpty()) {
            throw new IllegalArgumentException("At least one transaction is required");
        }
        if (request.getTransactions().contains(null)) {
            throw new IllegalArgumentException("Transaction list contains a null entry");
        }
        if (request.getRequestedAmount() != null && request.getRequestedAmount() <= 0) {
            throw new IllegalArgumentException("requestedAmount must be positive when given");
        }
        if (request.getRequestedTermMonths() != null && request.getRequestedTermMonths() <= 0) {
            throw new IllegalArgumentException("requestedTermMonths must be a positive number of months when given");
        }
    }
}
