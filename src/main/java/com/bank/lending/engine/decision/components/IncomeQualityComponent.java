package com.bank.lending.engine.decision.components;

import com.bank.lending.engine.decision.ScoreComponent;
import com.bank.lending.model.ComponentType;
import com.bank.lending.model.IncomeMetrics;
import com.bank.lending.model.MetricsBundle;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class IncomeQualityComponent implements ScoreComponent {

    public static final String INCOME_STABILITY = "income-stability";
    public static final String INCOME_REGULARITY = "income-regularity";
    // 1 when salary, benefit or pension income was found, else 0
    public static final String INCOME_VERIFICATION = "income-verification";

    @Override
    public ComponentType getType() {
        return ComponentType.INCOME_QUALITY;
    }

    @Override
    public List<String> metricNames() {
        return List.of(INCOME_STABILITY, INCOME_REGULARITY, INCOME_VERIFICATION);
    }

    @Override
    public Map<String, Double> metricValues(MetricsBundle metrics) {
        IncomeMetrics income = metrics.getIncome();
        Map<String, Double> values = new HashMap<>();
        values.put(INCOME_STABILITY, income.getStabilityScore());
        values.put(INCOME_REGULARITY, income.getRegularityScore());
        values.put(INCOME_VERIFICATION, income.isVerified() ? 1.0 : 0.0);
        return values;
    }
}
