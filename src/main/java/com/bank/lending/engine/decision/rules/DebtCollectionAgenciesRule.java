package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RuleResult;
import org.springframework.stereotype.Component;

@Component
public class DebtCollectionAgenciesRule extends AbstractDecisionRule {

    @Override
    public DecisionRuleType getSupportedRuleType() {
        return DecisionRuleType.MAX_DCA_COUNT;
    }

    @Override
    protected String getName() {
        return "Debt collection agencies";
    }

    @Override
    public RuleResult evaluate(MetricsBundle metrics, RuleDefinition rule) {
        int agencies = metrics.getDebt().getDebtCollectionAgencies();
        if (agencies <= rule.getThreshold()) {
            return notTriggered(rule, agencies);
        }
        return triggered(rule, agencies, String.format(
                "Distinct debt collection agencies: %d (maximum %.0f)", agencies, rule.getThreshold()));
    }
}
