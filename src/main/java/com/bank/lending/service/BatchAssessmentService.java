package com.bank.lending.service;

import com.bank.lending.config.AssessmentConfig;
import com.bank.lending.config.MetricsConfig;
import com.bank.lending.model.AssessmentRequest;
import com.bank.lending.model.AssessmentResult;
import com.bank.lending.model.BatchAssessmentRequest;
import com.bank.lending.model.BatchAssessmentResult;
import com.bank.lending.model.BatchError;
import com.bank.lending.model.BatchError.ErrorType;
import com.bank.lending.model.Decision;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assesses many applications in parallel on a fixed pool of daemon workers.
 * One application failing never affects the others; results keep input order.
 * The batch timeout is shared by the whole batch, not applied per application;
 * an application still running at the deadline has its worker interrupted.
 */
@Service
public class BatchAssessmentService {

    private static final Logger log = LoggerFactory.getLogger(BatchAssessmentService.class);

    private final LoanAssessmentService assessmentService;
    private final AssessmentConfig config;
    private final MetricsConfig metricsConfig;
    private final ExecutorService executor;

    public BatchAssessmentService(LoanAssessmentService assessmentService,
                                  AssessmentConfig config,
                                  MetricsConfig metricsConfig) {
        this.assessmentService = assessmentService;
        this.config = config;
        this.metricsConfig = metricsConfig;

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.getBatch().getWorkerThreads()), r -> {
            Thread t = new Thread(r, "assessment-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public BatchAssessmentResult assessBatch(BatchAssessmentRequest request) {
        List<AssessmentRequest> applications = request == null ? null : request.getApplications();
        if (applications == null || applications.isEmpty()) {
            throw new IllegalArgumentException("At least one application is required");
        }
        if (applications.size() > config.getBatch().getMaxApplications()) {
            throw new IllegalArgumentException("Batch of " + applications.size()
                    + " applications exceeds the maximum of " + config.getBatch().getMaxApplications());
        }

        long start = System.currentTimeMillis();
        long deadline = start + TimeUnit.SECONDS.toMillis(config.getBatch().getTimeoutSeconds());

        List<Future<AssessmentResult>> futures = new ArrayList<>(applications.size());
        for (AssessmentRequest application : applications) {
            futures.add(executor.submit(() -> assessmentService.assess(application)));
        }

        List<AssessmentResult> results = new ArrayList<>();
        List<BatchError> errors = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String ref = reference(applications.get(i), i);
            Future<AssessmentResult> future = futures.get(i);
            try {
                long remaining = Math.max(0, deadline - System.currentTimeMillis());
                results.add(future.get(remaining, TimeUnit.MILLISECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                log.error("Application {} did not finish within the batch timeout", ref);
                errors.add(new BatchError(ref, ErrorType.TIMEOUT,
                        "Not completed within " + config.getBatch().getTimeoutSeconds() + "s"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof IllegalArgumentException) {
                    log.error("Application {} rejected: {}", ref, cause.getMessage());
                    errors.add(new BatchError(ref, ErrorType.DATA_VALIDATION_ERROR, cause.getMessage()));
                } else {
                    log.error("Application {} failed: {}", ref, cause.getMessage(), cause);
                    errors.add(new BatchError(ref, ErrorType.PROCESSING_ERROR, String.valueOf(cause.getMessage())));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Batch assessment interrupted", e);
            }
        }

        long elapsed = System.currentTimeMillis() - start;
        BatchAssessmentResult result = summarize(applications.size(), results, errors, elapsed);
        metricsConfig.recordBatch(applications.size(), errors.size(), elapsed);
        log.info("Batch assessed: {} applications, {} failed, decisions={}, elapsed={}ms",
                applications.size(), errors.size(), result.getDecisionCounts(), elapsed);
        return result;
    }

    private BatchAssessmentResult summarize(int total, List<AssessmentResult> results,
                                            List<BatchError> errors, long elapsed) {
        Map<Decision, Integer> decisionCounts = new EnumMap<>(Decision.class);
        for (Decision d : Decision.values()) {
            decisionCounts.put(d, 0);
        }
        double sum = 0.0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (AssessmentResult r : results) {
            double score = r.getScoring().getScore();
            decisionCounts.merge(r.getScoring().getDecision(), 1, Integer::sum);
            sum += score;
            min = Math.min(min, score);
            max = Math.max(max, score);
        }
        boolean any = !results.isEmpty();

        return BatchAssessmentResult.builder()
                .totalApplications(total)
                .results(results)
                .errors(errors)
                .decisionCounts(decisionCounts)
                .averageScore(any ? Math.round(sum / results.size() * 10.0) / 10.0 : 0.0)
                .minScore(any ? min : 0.0)
                .maxScore(any ? max : 0.0)
                .elapsedMillis(elapsed)
                .build();
    }

    private static String reference(AssessmentRequest application, int index) {
        if (application != null && application.getApplicationRef() != null) {
            return application.getApplicationRef();
        }
        return "#" + index;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
