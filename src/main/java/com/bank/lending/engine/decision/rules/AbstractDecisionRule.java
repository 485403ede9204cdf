package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.engine.decision.DecisionRule;
import com.bank.lending.model.RuleResult;

abstract class AbstractDecisionRule implements DecisionRule {

    protected abstract String getName();

    protected RuleResult triggered(RuleDefinition rule, double observed, String reason) {
        return RuleResult.builder()
                .ruleType(rule.getType())
                .ruleName(getName())
                .triggered(true)
                .action(rule.getAction())
                .observedValue(observed)
                .threshold(rule.getThreshold())
                .reason(reason)
                .build();
    }

    protected RuleResult notTriggered(RuleDefinition rule, double observed) {
        return RuleResult.builder()
                .ruleType(rule.getType())
                .ruleName(getName())
                .triggered(false)
                .action(rule.getAction())
                .observedValue(observed)
                .threshold(rule.getThreshold())
                .reason(getName() + " within limit")
                .build();
    }
}
