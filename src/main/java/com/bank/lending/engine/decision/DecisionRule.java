package com.bank.lending.engine.decision;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RuleResult;

/**
 * A single decline or refer policy rule.
 * Each implementation handles one DecisionRuleType; threshold and action come from configuration.
 */
public interface DecisionRule {

    /**
     * The rule type this implementation handles.
     */
    DecisionRuleType getSupportedRuleType();

    /**
     * Evaluate the applicant's metrics against the configured rule.
     *
     * @param metrics aggregated metrics for the applicant
     * @param rule    configured threshold and action
     * @return the rule outcome, triggered or not
     */
    RuleResult evaluate(MetricsBundle metrics, RuleDefinition rule);
}
