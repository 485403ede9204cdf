package com.bank.lending.engine.decision.components;

import com.bank.lending.engine.decision.ScoreComponent;
import com.bank.lending.model.ComponentType;
import com.bank.lending.model.MetricsBundle;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class AccountConductComponent implements ScoreComponent {

    public static final String FAILED_PAYMENTS = "failed-payments";
    public static final String OVERDRAFT_DAYS = "overdraft-days";
    public static final String AVERAGE_BALANCE = "average-balance";

    @Override
    public ComponentType getType() {
        return ComponentType.ACCOUNT_CONDUCT;
    }

    @Override
    public List<String> metricNames() {
        return List.of(FAILED_PAYMENTS, OVERDRAFT_DAYS, AVERAGE_BALANCE);
    }

    @Override
    public Map<String, Double> metricValues(MetricsBundle metrics) {
        Map<String, Double> values = new HashMap<>();
        values.put(FAILED_PAYMENTS, (double) metrics.getRisk().getFailedPaymentsAllTime());
        values.put(OVERDRAFT_DAYS, (double) metrics.getBalance().getDaysInOverdraft());
        values.put(AVERAGE_BALANCE, metrics.getBalance().getAverageBalance());
        return values;
    }
}
