package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Fires when the number of distinct high-cost lenders paid in the last 90 days exceeds the threshold.
 */
@Component
public class ActiveHcstcLendersRule extends AbstractDecisionRule {

    @Override
    public DecisionRuleType getSupportedRuleType() {
        return DecisionRuleType.MAX_ACTIVE_HCSTC_LENDERS;
    }

    @Override
    protected String getName() {
        return "Active high-cost lenders";
    }

    @Override
    public RuleResult evaluate(MetricsBundle metrics, RuleDefinition rule) {
        int lenders = metrics.getDebt().getActiveHcstcLenders90d();
        if (lenders <= rule.getThreshold()) {
            return notTriggered(rule, lenders);
        }
        return triggered(rule, lenders, String.format(
                "Active high-cost lenders in last 90 days: %d (maximum %.0f)", lenders, rule.getThreshold()));
    }
}
