package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RuleResult;
import org.springframework.stereotype.Component;

@Component
public class FailedPaymentsRule extends AbstractDecisionRule {

    @Override
    public DecisionRuleType getSupportedRuleType() {
        return DecisionRuleType.MAX_FAILED_PAYMENTS;
    }

    @Override
    protected String getName() {
        return "Recent failed payments";
    }

    @Override
    public RuleResult evaluate(MetricsBundle metrics, RuleDefinition rule) {
        int failed = metrics.getRisk().getFailedPayments45d();
        if (failed <= rule.getThreshold()) {
            return notTriggered(rule, failed);
        }
        return triggered(rule, failed, String.format(
                "Failed payments in last 45 days: %d (maximum %.0f)", failed, rule.getThreshold()));
    }
}
