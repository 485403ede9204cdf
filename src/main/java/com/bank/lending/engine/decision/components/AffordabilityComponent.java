package com.bank.lending.engine.decision.components;

import com.bank.lending.engine.decision.ScoreComponent;
import com.bank.lending.model.AffordabilityMetrics;
import com.bank.lending.model.ComponentType;
import com.bank.lending.model.MetricsBundle;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Debt-to-income, stress-tested disposable income and disposable income left after the new loan.
 * DTI is undefined without income, so it scores as the worst band.
 */
@Component
public class AffordabilityComponent implements ScoreComponent {

    public static final String DEBT_TO_INCOME = "debt-to-income";
    public static final String DISPOSABLE_INCOME = "disposable-income";
    public static final String POST_LOAN_DISPOSABLE = "post-loan-disposable";

    @Override
    public ComponentType getType() {
        return ComponentType.AFFORDABILITY;
    }

    @Override
    public List<String> metricNames() {
        return List.of(DEBT_TO_INCOME, DISPOSABLE_INCOME, POST_LOAN_DISPOSABLE);
    }

    @Override
    public Map<String, Double> metricValues(MetricsBundle metrics) {
        AffordabilityMetrics affordability = metrics.getAffordability();
        Map<String, Double> values = new HashMap<>();
        values.put(DEBT_TO_INCOME, metrics.getIncome().getMonthlyIncome() > 0
                ? affordability.getDebtToIncomeRatio() : null);
        values.put(DISPOSABLE_INCOME, affordability.getStressedDisposable());
        values.put(POST_LOAN_DISPOSABLE, affordability.getPostLoanDisposable());
        return values;
    }
}
