package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RuleResult;
import org.springframework.stereotype.Component;

@Component
public class GamblingPercentageRule extends AbstractDecisionRule {

    @Override
    public DecisionRuleType getSupportedRuleType() {
        return DecisionRuleType.MAX_GAMBLING_PERCENTAGE;
    }

    @Override
    protected String getName() {
        return "Gambling share of income";
    }

    @Override
    public RuleResult evaluate(MetricsBundle metrics, RuleDefinition rule) {
        double pct = metrics.getRisk().getGamblingPercentage();
        if (pct <= rule.getThreshold()) {
            return notTriggered(rule, pct);
        }
        return triggered(rule, pct, String.format(
                "Gambling spend is %.1f%% of income (maximum %.0f%%)", pct, rule.getThreshold()));
    }
}
