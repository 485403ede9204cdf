package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RuleResult;
import org.springframework.stereotype.Component;

@Component
public class BankChargesRule extends AbstractDecisionRule {

    @Override
    public DecisionRuleType getSupportedRuleType() {
        return DecisionRuleType.BANK_CHARGES_REFERRAL;
    }

    @Override
    protected String getName() {
        return "Recent bank charges";
    }

    @Override
    public RuleResult evaluate(MetricsBundle metrics, RuleDefinition rule) {
        int charges = metrics.getRisk().getBankCharges90d();
        if (charges <= rule.getThreshold()) {
            return notTriggered(rule, charges);
        }
        return triggered(rule, charges, String.format(
                "Bank charges in last 90 days: %d (maximum %.0f)", charges, rule.getThreshold()));
    }
}
