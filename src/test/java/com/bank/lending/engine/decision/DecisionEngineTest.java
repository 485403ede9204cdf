package com.bank.lending.engine.decision;

import com.bank.lending.config.EngineConfigurationException;
import com.bank.lending.config.MetricsConfig;
import com.bank.lending.config.ProductConfig;
import com.bank.lending.config.ScoringConfig;
import com.bank.lending.config.ScoringConfig.BandDirection;
import com.bank.lending.engine.decision.components.AccountConductComponent;
import com.bank.lending.engine.decision.components.AffordabilityComponent;
import com.bank.lending.engine.decision.components.IncomeQualityComponent;
import com.bank.lending.engine.decision.components.RiskIndicatorsComponent;
import com.bank.lending.engine.decision.rules.*;
import com.bank.lending.model.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.bank.lending.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionEngineTest {

    private static final LoanRequest REQUEST = new LoanRequest(500.0, 4);

    private ScoringConfig scoring;
    private ProductConfig product;
    private SimpleMeterRegistry meterRegistry;
    private DecisionEngine engine;

    @BeforeEach
    void setUp() {
        scoring = createScoringConfig();
        product = createProductConfig();
        meterRegistry = new SimpleMeterRegistry();
        engine = newEngine(allComponents());
    }

    private DecisionEngine newEngine(List<ScoreComponent> components) {
        List<DecisionRule> rules = List.of(
                new MinMonthlyIncomeRule(), new NoVerifiableIncomeRule(), new ActiveHcstcLendersRule(),
                new GamblingPercentageRule(), new PostLoanDisposableRule(), new FailedPaymentsRule(),
                new DebtCollectionAgenciesRule(), new ProjectedDebtToIncomeRule(), new BankChargesRule(),
                new NewCreditBurstRule());
        return new DecisionEngine(scoring, product, new MetricsConfig(meterRegistry), rules, components);
    }

    private static List<ScoreComponent> allComponents() {
        return new ArrayList<>(List.of(new AffordabilityComponent(), new IncomeQualityComponent(),
                new AccountConductComponent(), new RiskIndicatorsComponent()));
    }

    private static MetricsBundle bundle(IncomeMetrics income, DebtMetrics debt, AffordabilityMetrics affordability,
                                        BalanceMetrics balance, RiskMetrics risk) {
        return MetricsBundle.builder()
                .monthsOfData(3)
                .income(income)
                .expense(createExpense(1200.0))
                .debt(debt)
                .affordability(affordability)
                .balance(balance)
                .risk(risk)
                .build();
    }

    private static IncomeMetrics income(double stability, double regularity) {
        return IncomeMetrics.builder()
                .monthlyIncome(3000.0)
                .monthlyStableIncome(3000.0)
                .stabilityScore(stability)
                .regularityScore(regularity)
                .verified(true)
                .build();
    }

    // ── Decisions ──

    @Test
    void decide_strongApplicant_approvesWithOffer() {
        ScoringResult result = engine.decide(createHealthyMetrics(), REQUEST);

        assertThat(result.getDecision()).isEqualTo(Decision.APPROVE);
        assertThat(result.getScore()).isEqualTo(100.0);
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(result.getReasons()).isEmpty();
        assertThat(result.getRiskFlags()).isEmpty();
        assertThat(result.getRuleResults()).hasSize(10).noneMatch(RuleResult::isTriggered);
        assertThat(result.getBreakdown().getComponents()).hasSize(4);

        LoanOffer offer = result.getOffer();
        assertThat(offer.getPrincipal()).isEqualTo(500.0);
        assertThat(offer.getTermMonths()).isEqualTo(4);
        assertThat(offer.getMonthlyRepayment()).isEqualTo(246.6);
    }

    @Test
    void decide_tooManyActiveLenders_declinesAtFloorWithoutScoring() {
        MetricsBundle metrics = createMetrics(createIncome(3000.0, true), createDebt(400.0, 7),
                createAffordability(1500.0, 1253.4, 13.3, 21.6), createRisk(0.0, 0));

        ScoringResult result = engine.decide(metrics, REQUEST);

        assertThat(result.getDecision()).isEqualTo(Decision.DECLINE);
        assertThat(result.getScore()).isEqualTo(0.0);
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.VERY_HIGH);
        assertThat(result.getBreakdown()).isNull();
        assertThat(result.getOffer()).isNull();
        assertThat(result.getReasons())
                .containsExactly("Active high-cost lenders in last 90 days: 7 (maximum 6)");
        // Evaluation stops at the first decline rule
        assertThat(result.getRuleResults()).hasSize(3);
        assertThat(meterRegistry.counter("rule.fired.count",
                "rule_type", "MAX_ACTIVE_HCSTC_LENDERS", "action", "DECLINE").count()).isEqualTo(1.0);
    }

    @Test
    void decide_referRuleOverridesApprovalBand() {
        MetricsBundle metrics = createMetrics(createIncome(1200.0, true), createDebt(0.0, 0),
                createAffordability(600.0, 353.4, 0.0, 20.6), createRisk(0.0, 0));

        ScoringResult result = engine.decide(metrics, REQUEST);

        assertThat(result.getScore()).isEqualTo(100.0);
        assertThat(result.getDecision()).isEqualTo(Decision.REFER);
        assertThat(result.getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.getReasons()).hasSize(1);
        assertThat(result.getReasons().get(0)).startsWith("Monthly income");
        assertThat(result.getOffer()).isNull();
    }

    @Test
    void decide_middleScore_refers() {
        MetricsBundle metrics = bundle(income(60.0, 40.0), createDebt(1350.0, 1),
                createAffordability(120.0, 60.0, 45.0, 53.2), createBalance(150.0, 8),
                RiskMetrics.builder().gamblingPercentage(3.0).failedPayments45d(1).failedPaymentsAllTime(1).build());

        ScoringResult result = engine.decide(metrics, REQUEST);

        assertThat(result.getScore()).isEqualTo(58.2);
        assertThat(result.getDecision()).isEqualTo(Decision.REFER);
        assertThat(result.getRuleResults()).noneMatch(RuleResult::isTriggered);
        assertThat(result.getReasons()).hasSize(1);
        assertThat(result.getReasons().get(0)).contains("below the approval threshold");
        // Gambling, lenders, failed payments and DTI above 40%
        assertThat(result.getRiskFlags()).hasSize(4);
    }

    @Test
    void decide_lowScore_declinesWithBreakdown() {
        MetricsBundle metrics = bundle(income(0.0, 0.0), createDebt(2250.0, 0),
                createAffordability(20.0, 5.0, 75.0, 84.0), createBalance(-300.0, 40),
                createRisk(0.0, 0));

        ScoringResult result = engine.decide(metrics, REQUEST);

        assertThat(result.getScore()).isEqualTo(23.0);
        assertThat(result.getDecision()).isEqualTo(Decision.DECLINE);
        assertThat(result.getBreakdown()).isNotNull();
        assertThat(result.getOffer()).isNull();
        assertThat(result.getReasons()).hasSize(2);
        assertThat(result.getReasons().get(0)).startsWith("Post-loan disposable income");
        assertThat(result.getReasons().get(1)).contains("below the referral threshold");
    }

    // ── Scoring ──

    @Test
    void score_penaltiesCanPushComponentNegativeUntilItsMinimum() {
        MetricsBundle metrics = createMetrics(createIncome(3000.0, true), createDebt(300.0, 2),
                createAffordability(1500.0, 1253.4, 10.0, 18.2), createRisk(8.0, 0));

        ScoreBreakdown breakdown = engine.score(metrics);

        ComponentScore risk = breakdown.getComponents().get(3);
        assertThat(risk.getComponent()).isEqualTo(ComponentType.RISK_INDICATORS);
        // -3 (gambling band) + 0 (lender band) - 5 - 10 = -18, clamped to -15
        assertThat(risk.getPoints()).isEqualTo(-15.0);
        assertThat(risk.getPenalties()).extracting(Penalty::getName)
                .containsExactly("gambling-percentage", "hcstc-lenders-90d");
        assertThat(breakdown.getPenaltiesApplied()).isEqualTo(-15.0);
        assertThat(breakdown.getRawTotal()).isEqualTo(75.0);
    }

    @Test
    void score_zeroIncome_debtToIncomeIsUndefinedAndScoresWorstBand() {
        MetricsBundle metrics = createMetrics(createIncome(0.0, false), createDebt(0.0, 0),
                createAffordability(0.0, -125.0, 0.0, 0.0), createRisk(0.0, 0));

        ComponentScore affordability = engine.score(metrics).getComponents().get(0);

        SubScore dti = affordability.getSubScores().get(0);
        assertThat(dti.getName()).isEqualTo("debt-to-income");
        assertThat(dti.getMetricValue()).isNull();
        assertThat(dti.getPoints()).isEqualTo(0.0);
    }

    @Test
    void score_totalStaysWithinRange() {
        List<MetricsBundle> samples = List.of(
                createHealthyMetrics(),
                createMetrics(createIncome(0.0, false), createDebt(900.0, 5),
                        createAffordability(-900.0, -1146.6, 0.0, 0.0), createRisk(100.0, 6)),
                createMetrics(createIncome(1800.0, true), createDebt(200.0, 1),
                        createAffordability(320.0, 73.4, 11.1, 24.8), createRisk(1.5, 1)));

        for (MetricsBundle metrics : samples) {
            double total = engine.score(metrics).getTotal();
            assertThat(total).isBetween(0.0, 100.0);
        }
    }

    // ── Offers ──

    @Test
    void decide_offerLimitedByAffordability() {
        MetricsBundle metrics = createMetrics(createIncome(3000.0, true), createDebt(0.0, 0),
                createAffordability(300.0, 100.0, 0.0, 8.3), createRisk(0.0, 0));

        ScoringResult result = engine.decide(metrics, new LoanRequest(1000.0, 6));

        assertThat(result.getDecision()).isEqualTo(Decision.APPROVE);
        // (300 - 50) * 6 / (1 + cost cap)
        assertThat(result.getOffer().getPrincipal()).isEqualTo(750.0);
        assertThat(result.getOffer().getTermMonths()).isEqualTo(6);
        assertThat(result.getOffer().getTotalRepayable()).isEqualTo(1500.0);
    }

    @Test
    void decide_offerLimitedByScoreTier() {
        MetricsBundle metrics = bundle(income(60.0, 60.0), createDebt(1050.0, 1),
                createAffordability(2000.0, 1500.0, 35.0, 45.0), createBalance(150.0, 3),
                RiskMetrics.builder().gamblingPercentage(1.0).failedPayments45d(1).failedPaymentsAllTime(1).build());

        ScoringResult result = engine.decide(metrics, new LoanRequest(1500.0, 6));

        assertThat(result.getScore()).isEqualTo(72.8);
        assertThat(result.getDecision()).isEqualTo(Decision.APPROVE);
        assertThat(result.getOffer().getPrincipal()).isEqualTo(1200.0);
        assertThat(result.getOffer().getTermMonths()).isEqualTo(6);
    }

    @Test
    void decide_affordablePrincipalBelowProductMinimum_approvesWithEmptyOffer() {
        MetricsBundle metrics = createMetrics(createIncome(3000.0, true), createDebt(0.0, 0),
                createAffordability(100.0, 60.0, 0.0, 8.2), createRisk(0.0, 0));

        ScoringResult result = engine.decide(metrics, REQUEST);

        assertThat(result.getDecision()).isEqualTo(Decision.APPROVE);
        assertThat(result.getOffer().getPrincipal()).isEqualTo(0.0);
    }

    @Test
    void decide_requestedTermShorterThanEveryAvailableTerm_refersWithoutOffer() {
        ScoringResult result = engine.decide(createHealthyMetrics(), new LoanRequest(500.0, 2));

        assertThat(result.getScore()).isEqualTo(100.0);
        assertThat(result.getDecision()).isEqualTo(Decision.REFER);
        assertThat(result.getOffer()).isNull();
        assertThat(result.getReasons()).containsExactly("No available loan term fits within 2 months");
    }

    @Test
    void decide_offeredTermNeverExceedsRequestedTerm() {
        ScoringResult result = engine.decide(createHealthyMetrics(), new LoanRequest(500.0, 5));

        assertThat(result.getDecision()).isEqualTo(Decision.APPROVE);
        assertThat(result.getOffer().getTermMonths()).isEqualTo(5);
    }

    @Test
    void snapTerm_roundsDownToAvailableTerm() {
        assertThat(engine.snapTerm(7)).hasValue(6);
        assertThat(engine.snapTerm(5)).hasValue(5);
        assertThat(engine.snapTerm(2)).isEmpty();
    }

    @Test
    void decide_configChangedAfterStartup_usesStartupSnapshot() {
        scoring.getBands().setApproveMin(100.5);
        scoring.getBands().setReferMin(100.1);
        scoring.getTiers().clear();
        scoring.getRules().get(0).setThreshold(5000.0);
        product.setMaxLoanAmount(250.0);
        product.setAvailableTerms(List.of(12));

        ScoringResult result = engine.decide(createHealthyMetrics(), REQUEST);

        assertThat(result.getDecision()).isEqualTo(Decision.APPROVE);
        assertThat(result.getOffer().getPrincipal()).isEqualTo(500.0);
        assertThat(result.getOffer().getTermMonths()).isEqualTo(4);
    }

    // ── Configuration ──

    @Test
    void constructor_missingRuleDefinition_throws() {
        scoring.getRules().removeIf(r -> r.getType() == DecisionRuleType.MAX_DCA_COUNT);

        assertThatThrownBy(() -> newEngine(allComponents()))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("Missing rule definition: MAX_DCA_COUNT");
    }

    @Test
    void constructor_nonMonotonicTable_throws() {
        scoring.getComponents().get(0).getSubScores()
                .put("debt-to-income", table(BandDirection.LOWER_IS_BETTER, 30, 5, 40, 15));

        assertThatThrownBy(() -> newEngine(allComponents()))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("is not monotonic");
    }

    @Test
    void constructor_unknownMetricName_throws() {
        scoring.getComponents().get(2).getSubScores()
                .put("credit-score", table(BandDirection.HIGHER_IS_BETTER, 700, 5, 0, 0));

        assertThatThrownBy(() -> newEngine(allComponents()))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("unknown metric 'credit-score'");
    }

    @Test
    void constructor_invertedBands_throws() {
        scoring.getBands().setReferMin(80.0);

        assertThatThrownBy(() -> newEngine(allComponents()))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("must be above refer-min");
    }

    @Test
    void constructor_missingScoreRangeAndRiskFlags_throws() {
        scoring.setScoreFloor(null);
        scoring.setScoreCeiling(null);
        scoring.getRiskFlags().setOverdraftDays(null);

        assertThatThrownBy(() -> newEngine(allComponents()))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("scoring.score-floor is missing")
                .hasMessageContaining("scoring.score-ceiling is missing")
                .hasMessageContaining("scoring.risk-flags.overdraft-days is missing");
    }

    @Test
    void constructor_missingComponentImplementation_throws() {
        List<ScoreComponent> components = allComponents();
        components.remove(3);

        assertThatThrownBy(() -> newEngine(components))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("No score component registered for RISK_INDICATORS");
    }
}
