package com.bank.lending.engine.decision.components;

import com.bank.lending.engine.decision.ScoreComponent;
import com.bank.lending.model.ComponentType;
import com.bank.lending.model.MetricsBundle;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gambling share of income and recent high-cost borrowing. Usually the only component
 * configured with penalties and a negative floor.
 */
@Component
public class RiskIndicatorsComponent implements ScoreComponent {

    public static final String GAMBLING_PERCENTAGE = "gambling-percentage";
    public static final String HCSTC_LENDERS = "hcstc-lenders-90d";

    @Override
    public ComponentType getType() {
        return ComponentType.RISK_INDICATORS;
    }

    @Override
    public List<String> metricNames() {
        return List.of(GAMBLING_PERCENTAGE, HCSTC_LENDERS);
    }

    @Override
    public Map<String, Double> metricValues(MetricsBundle metrics) {
        Map<String, Double> values = new HashMap<>();
        values.put(GAMBLING_PERCENTAGE, metrics.getRisk().getGamblingPercentage());
        values.put(HCSTC_LENDERS, (double) metrics.getDebt().getActiveHcstcLenders90d());
        return values;
    }
}
