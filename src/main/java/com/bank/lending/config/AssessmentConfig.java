package com.bank.lending.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "assessment")
public class AssessmentConfig {

    private double defaultLoanAmount = 500.0;
    private int defaultLoanTerm = 4;

    private Batch batch = new Batch();

    @Data
    public static class Batch {
        private int workerThreads = 4;
        private long timeoutSeconds = 120;
        private int maxApplications = 500;
    }
}
