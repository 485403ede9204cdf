package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Fires when the number of high-cost lenders first seen in the last 90 days reaches the threshold.
 */
@Component
public class NewCreditBurstRule extends AbstractDecisionRule {

    @Override
    public DecisionRuleType getSupportedRuleType() {
        return DecisionRuleType.NEW_CREDIT_BURST_REFERRAL;
    }

    @Override
    protected String getName() {
        return "New credit providers";
    }

    @Override
    public RuleResult evaluate(MetricsBundle metrics, RuleDefinition rule) {
        int providers = metrics.getRisk().getNewCreditProviders90d();
        if (providers < rule.getThreshold()) {
            return notTriggered(rule, providers);
        }
        return triggered(rule, providers, String.format(
                "New credit providers in last 90 days: %d (referral at %.0f)", providers, rule.getThreshold()));
    }
}
