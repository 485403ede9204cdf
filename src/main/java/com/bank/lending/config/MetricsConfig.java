package com.bank.lending.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAssessment(String decision, double score) {
        Counter.builder("assessment.count")
                .tag("decision", decision)
                .register(registry)
                .increment();

        DistributionSummary.builder("assessment.score")
                .tag("decision", decision)
                .register(registry)
                .record(score);
    }

    public void recordRuleFired(String ruleType, String action) {
        Counter.builder("rule.fired.count")
                .tag("rule_type", ruleType)
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordClassification(String step, int count) {
        Counter.builder("classification.count")
                .tag("step", step)
                .register(registry)
                .increment(count);
    }

    public void recordBatch(int applications, int failures, long elapsedMillis) {
        Counter.builder("batch.applications.count")
                .tag("outcome", "success")
                .register(registry)
                .increment(applications - failures);

        Counter.builder("batch.applications.count")
                .tag("outcome", "failure")
                .register(registry)
                .increment(failures);

        Timer.builder("batch.duration")
                .register(registry)
                .record(elapsedMillis, TimeUnit.MILLISECONDS);
    }
}
