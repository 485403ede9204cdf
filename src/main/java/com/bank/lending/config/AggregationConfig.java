package com.bank.lending.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregation windows and regularity tiers. These are tuning values with built-in
 * defaults; application.yml overrides them key by key.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "metrics")
public class AggregationConfig {

    // Whole calendar months, ending with the month of the latest transaction
    private int lookbackMonths = 3;

    private int hcstcLookbackDays = 90;
    private int failedPaymentLookbackDays = 45;
    private int bankChargeLookbackDays = 90;
    private int newCreditLookbackDays = 90;

    // Income credits below this amount are ignored for payment-day regularity
    private double regularityMinAmount = 100.0;

    // Day-of-month standard deviation -> regularity score, checked in order
    private List<RegularityTier> regularityTiers = new ArrayList<>(List.of(
            new RegularityTier(2.0, 100.0),
            new RegularityTier(5.0, 80.0),
            new RegularityTier(10.0, 60.0),
            new RegularityTier(15.0, 40.0)));

    // Score when the deviation exceeds every tier
    private double regularityFloorScore = 20.0;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RegularityTier {
        private double maxStdDev;
        private double score;
    }
}
