package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Fires when effective monthly income is below the threshold.
 */
@Component
public class MinMonthlyIncomeRule extends AbstractDecisionRule {

    @Override
    public DecisionRuleType getSupportedRuleType() {
        return DecisionRuleType.MIN_MONTHLY_INCOME;
    }

    @Override
    protected String getName() {
        return "Minimum monthly income";
    }

    @Override
    public RuleResult evaluate(MetricsBundle metrics, RuleDefinition rule) {
        double income = metrics.getIncome().getMonthlyIncome();
        if (income >= rule.getThreshold()) {
            return notTriggered(rule, income);
        }
        return triggered(rule, income, String.format(
                "Monthly income £%.2f is below the minimum £%.0f", income, rule.getThreshold()));
    }
}
