package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Fires when the stress-tested disposable income left after the new repayment is below the threshold.
 */
@Component
public class PostLoanDisposableRule extends AbstractDecisionRule {

    @Override
    public DecisionRuleType getSupportedRuleType() {
        return DecisionRuleType.MIN_POST_LOAN_DISPOSABLE;
    }

    @Override
    protected String getName() {
        return "Post-loan disposable income";
    }

    @Override
    public RuleResult evaluate(MetricsBundle metrics, RuleDefinition rule) {
        double postLoan = metrics.getAffordability().getPostLoanDisposable();
        if (postLoan >= rule.getThreshold()) {
            return notTriggered(rule, postLoan);
        }
        return triggered(rule, postLoan, String.format(
                "Post-loan disposable income £%.2f is below the minimum £%.0f", postLoan, rule.getThreshold()));
    }
}
