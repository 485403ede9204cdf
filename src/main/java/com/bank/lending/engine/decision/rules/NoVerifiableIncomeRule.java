package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Fires when no salary, benefit or pension income was found and total income
 * is also below the threshold.
 */
@Component
public class NoVerifiableIncomeRule extends AbstractDecisionRule {

    @Override
    public DecisionRuleType getSupportedRuleType() {
        return DecisionRuleType.NO_VERIFIABLE_INCOME;
    }

    @Override
    protected String getName() {
        return "Verifiable income";
    }

    @Override
    public RuleResult evaluate(MetricsBundle metrics, RuleDefinition rule) {
        double income = metrics.getIncome().getMonthlyIncome();
        if (metrics.getIncome().isVerified() || income >= rule.getThreshold()) {
            return notTriggered(rule, income);
        }
        return triggered(rule, income, String.format(
                "No verifiable income source identified (monthly income £%.2f)", income));
    }
}
