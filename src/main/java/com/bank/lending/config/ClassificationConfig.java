package com.bank.lending.config;

import com.bank.lending.model.FrequencyBand;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifier and income detector tuning. Every value has a built-in default that
 * application.yml may override; the pattern tables themselves are validated on load.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "classification")
public class ClassificationConfig {

    // Location of the category pattern tables (Spring resource syntax)
    private String patternLibraryLocation = "classpath:patterns/category-patterns.json";

    // Minimum behavioral verdict confidence for a credit to be resolved as income
    private double behavioralAcceptanceThreshold = 0.70;

    // Confidence of the terminal fallback when neither text nor taxonomy matched
    private double fallbackConfidence = 0.30;

    // Confidence of coarse taxonomy-derived categories
    private double taxonomyFallbackConfidence = 0.60;

    // Income weight for credits nobody could explain
    private double unclassifiedCreditWeight = 0.5;

    // Confidence of the expense-service and lender whitelist
    private double whitelistConfidence = 0.90;

    // Confidence reported for records without a usable amount
    private double malformedConfidence = 0.0;

    private Matching matching = new Matching();

    private IncomeDetection incomeDetection = new IncomeDetection();

    @Data
    public static class Matching {
        private double keywordConfidence = 0.90;
        private double regexConfidence = 0.80;
        // Similarity (0-100) a fuzzy match must reach
        private double fuzzyThreshold = 80.0;
        private double fuzzyBaseConfidence = 0.85;
        // Keywords shorter than this never take part in fuzzy matching
        private int fuzzyMinKeywordLength = 5;
    }

    @Data
    public static class IncomeDetection {
        // Recurrence search
        private double minAmount = 50.0;
        private double amountTolerance = 0.30;
        private double tightAmountTolerance = 0.05;
        private int dayOfMonthTolerance = 3;
        private int minOccurrences = 2;
        private double minBandShare = 0.6;
        private List<IntervalBand> intervalBands = new ArrayList<>(List.of(
                new IntervalBand(FrequencyBand.WEEKLY, 5, 9),
                new IntervalBand(FrequencyBand.FORTNIGHTLY, 11, 17),
                new IntervalBand(FrequencyBand.MONTHLY, 25, 35),
                new IntervalBand(FrequencyBand.QUARTERLY, 80, 100)));

        // Recurring source confidence
        private double baseConfidence = 0.4;
        private double confidencePerOccurrence = 0.1;
        private double maxBaseConfidence = 0.7;
        private double consistentSalaryBonus = 0.15;
        private double maxConfidence = 0.95;
        private double salaryMinAmount = 200.0;

        // Signal confidences
        private double exclusionConfidence = 0.95;
        private double expenseServiceConfidence = 0.90;
        private double taxonomyWagesConfidence = 0.95;
        private double taxonomyIncomeConfidence = 0.85;
        private double payrollConfidence = 0.95;
        private double benefitConfidence = 0.92;
        private double pensionConfidence = 0.92;
        private double gigConfidence = 0.85;
        private double employerConfidence = 0.90;
        private double employerMinAmount = 200.0;
        private double largeCreditMinAmount = 500.0;
        private double largeCreditConfidence = 0.75;
        private int largeCreditMinPayerWords = 2;
        private double transferInConfidence = 0.60;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IntervalBand {
        private FrequencyBand band;
        private int minDays;
        private int maxDays;

        public boolean contains(double days) {
            return days >= minDays && days <= maxDays;
        }
    }
}
