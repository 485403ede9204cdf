package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Fires when debt payments plus the proposed repayment exceed the threshold share of income.
 * Applicants with no income are left to the income rules.
 */
@Component
public class ProjectedDebtToIncomeRule extends AbstractDecisionRule {

    @Override
    public DecisionRuleType getSupportedRuleType() {
        return DecisionRuleType.MAX_DTI_WITH_NEW_LOAN;
    }

    @Override
    protected String getName() {
        return "Debt-to-income with new loan";
    }

    @Override
    public RuleResult evaluate(MetricsBundle metrics, RuleDefinition rule) {
        double projected = metrics.getAffordability().getProjectedDebtToIncomeRatio();
        if (metrics.getIncome().getMonthlyIncome() <= 0 || projected <= rule.getThreshold()) {
            return notTriggered(rule, projected);
        }
        return triggered(rule, projected, String.format(
                "Projected DTI %.1f%% would exceed the maximum %.0f%%", projected, rule.getThreshold()));
    }
}
