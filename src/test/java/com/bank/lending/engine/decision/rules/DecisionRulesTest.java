package com.bank.lending.engine.decision.rules;

import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.model.*;
import org.junit.jupiter.api.Test;

import static com.bank.lending.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class DecisionRulesTest {

    private static MetricsBundle withIncome(double monthlyIncome, boolean verified) {
        return createMetrics(createIncome(monthlyIncome, verified), createDebt(0.0, 0),
                createAffordability(1500.0, 1250.0, 0.0, 10.0), createRisk(0.0, 0));
    }

    private static MetricsBundle withLenders(int lenders) {
        return createMetrics(createIncome(3000.0, true), createDebt(300.0, lenders),
                createAffordability(1500.0, 1250.0, 10.0, 18.0), createRisk(0.0, 0));
    }

    private static MetricsBundle withRisk(RiskMetrics risk) {
        return createMetrics(createIncome(3000.0, true), createDebt(0.0, 0),
                createAffordability(1500.0, 1250.0, 0.0, 8.0), risk);
    }

    // ── Income ──

    @Test
    void minMonthlyIncome_firesBelowThreshold() {
        RuleDefinition def = rule(DecisionRuleType.MIN_MONTHLY_INCOME, 1500.0, RuleAction.REFER);
        MinMonthlyIncomeRule rule = new MinMonthlyIncomeRule();

        RuleResult below = rule.evaluate(withIncome(1200.0, true), def);
        RuleResult atThreshold = rule.evaluate(withIncome(1500.0, true), def);

        assertThat(below.isTriggered()).isTrue();
        assertThat(below.getAction()).isEqualTo(RuleAction.REFER);
        assertThat(below.getObservedValue()).isEqualTo(1200.0);
        assertThat(below.getRuleType()).isEqualTo(DecisionRuleType.MIN_MONTHLY_INCOME);
        assertThat(atThreshold.isTriggered()).isFalse();
    }

    @Test
    void noVerifiableIncome_needsUnverifiedAndLowIncome() {
        RuleDefinition def = rule(DecisionRuleType.NO_VERIFIABLE_INCOME, 300.0, RuleAction.REFER);
        NoVerifiableIncomeRule rule = new NoVerifiableIncomeRule();

        assertThat(rule.evaluate(withIncome(200.0, false), def).isTriggered()).isTrue();
        assertThat(rule.evaluate(withIncome(200.0, true), def).isTriggered()).isFalse();
        assertThat(rule.evaluate(withIncome(800.0, false), def).isTriggered()).isFalse();
    }

    // ── Debt ──

    @Test
    void activeHcstcLenders_firesAboveThreshold() {
        RuleDefinition def = rule(DecisionRuleType.MAX_ACTIVE_HCSTC_LENDERS, 6.0, RuleAction.DECLINE);
        ActiveHcstcLendersRule rule = new ActiveHcstcLendersRule();

        RuleResult seven = rule.evaluate(withLenders(7), def);

        assertThat(seven.isTriggered()).isTrue();
        assertThat(seven.getAction()).isEqualTo(RuleAction.DECLINE);
        assertThat(seven.getReason()).isEqualTo("Active high-cost lenders in last 90 days: 7 (maximum 6)");
        assertThat(rule.evaluate(withLenders(6), def).isTriggered()).isFalse();
    }

    @Test
    void debtCollectionAgencies_firesAboveThreshold() {
        RuleDefinition def = rule(DecisionRuleType.MAX_DCA_COUNT, 4.0, RuleAction.REFER);
        MetricsBundle five = createMetrics(createIncome(3000.0, true),
                DebtMetrics.builder().debtCollectionAgencies(5).build(),
                createAffordability(1500.0, 1250.0, 0.0, 8.0), createRisk(0.0, 0));

        assertThat(new DebtCollectionAgenciesRule().evaluate(five, def).isTriggered()).isTrue();
    }

    @Test
    void projectedDebtToIncome_ignoredWithoutIncome() {
        RuleDefinition def = rule(DecisionRuleType.MAX_DTI_WITH_NEW_LOAN, 85.0, RuleAction.REFER);
        ProjectedDebtToIncomeRule rule = new ProjectedDebtToIncomeRule();
        MetricsBundle high = createMetrics(createIncome(1000.0, true), createDebt(800.0, 0),
                createAffordability(100.0, 60.0, 80.0, 104.7), createRisk(0.0, 0));
        MetricsBundle noIncome = createMetrics(createIncome(0.0, false), createDebt(800.0, 0),
                createAffordability(-800.0, -1000.0, 0.0, 0.0), createRisk(0.0, 0));

        assertThat(rule.evaluate(high, def).isTriggered()).isTrue();
        assertThat(rule.evaluate(noIncome, def).isTriggered()).isFalse();
    }

    @Test
    void postLoanDisposable_firesBelowThreshold() {
        RuleDefinition def = rule(DecisionRuleType.MIN_POST_LOAN_DISPOSABLE, 50.0, RuleAction.REFER);
        MetricsBundle tight = createMetrics(createIncome(1600.0, true), createDebt(0.0, 0),
                createAffordability(260.0, 13.4, 0.0, 15.4), createRisk(0.0, 0));

        assertThat(new PostLoanDisposableRule().evaluate(tight, def).isTriggered()).isTrue();
    }

    // ── Risk ──

    @Test
    void gamblingPercentage_firesAboveThreshold() {
        RuleDefinition def = rule(DecisionRuleType.MAX_GAMBLING_PERCENTAGE, 15.0, RuleAction.REFER);
        GamblingPercentageRule rule = new GamblingPercentageRule();

        assertThat(rule.evaluate(withRisk(createRisk(15.1, 0)), def).isTriggered()).isTrue();
        assertThat(rule.evaluate(withRisk(createRisk(15.0, 0)), def).isTriggered()).isFalse();
    }

    @Test
    void failedPayments_usesRecentCount() {
        RuleDefinition def = rule(DecisionRuleType.MAX_FAILED_PAYMENTS, 2.0, RuleAction.REFER);
        RiskMetrics oldFailures = RiskMetrics.builder().failedPayments45d(1).failedPaymentsAllTime(9).build();

        assertThat(new FailedPaymentsRule().evaluate(withRisk(createRisk(0.0, 3)), def).isTriggered()).isTrue();
        assertThat(new FailedPaymentsRule().evaluate(withRisk(oldFailures), def).isTriggered()).isFalse();
    }

    @Test
    void bankCharges_firesAboveThreshold() {
        RuleDefinition def = rule(DecisionRuleType.BANK_CHARGES_REFERRAL, 2.0, RuleAction.REFER);
        RiskMetrics charges = RiskMetrics.builder().bankCharges90d(3).bankChargesAllTime(3).build();

        RuleResult result = new BankChargesRule().evaluate(withRisk(charges), def);

        assertThat(result.isTriggered()).isTrue();
        assertThat(result.getReason()).isEqualTo("Bank charges in last 90 days: 3 (maximum 2)");
    }

    @Test
    void newCreditBurst_firesAtThreshold() {
        RuleDefinition def = rule(DecisionRuleType.NEW_CREDIT_BURST_REFERRAL, 5.0, RuleAction.REFER);
        NewCreditBurstRule rule = new NewCreditBurstRule();

        assertThat(rule.evaluate(withRisk(RiskMetrics.builder().newCreditProviders90d(5).build()), def)
                .isTriggered()).isTrue();
        assertThat(rule.evaluate(withRisk(RiskMetrics.builder().newCreditProviders90d(4).build()), def)
                .isTriggered()).isFalse();
    }

    @Test
    void notTriggered_reportsObservedValueAndThreshold() {
        RuleDefinition def = rule(DecisionRuleType.MAX_ACTIVE_HCSTC_LENDERS, 6.0, RuleAction.DECLINE);

        RuleResult result = new ActiveHcstcLendersRule().evaluate(withLenders(2), def);

        assertThat(result.isTriggered()).isFalse();
        assertThat(result.getObservedValue()).isEqualTo(2.0);
        assertThat(result.getThreshold()).isEqualTo(6.0);
        assertThat(result.getRuleName()).isEqualTo("Active high-cost lenders");
    }
}
