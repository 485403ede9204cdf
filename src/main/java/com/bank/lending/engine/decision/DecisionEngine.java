package com.bank.lending.engine.decision;

import com.bank.lending.config.EngineConfigurationException;
import com.bank.lending.config.MetricsConfig;
import com.bank.lending.config.ProductConfig;
import com.bank.lending.config.ScoringConfig;
import com.bank.lending.config.ScoringConfig.BandTable;
import com.bank.lending.config.ScoringConfig.ComponentDefinition;
import com.bank.lending.config.ScoringConfig.PenaltyDefinition;
import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.config.ScoringConfig.ScoreTier;
import com.bank.lending.model.AffordabilityMetrics;
import com.bank.lending.model.ComponentScore;
import com.bank.lending.model.ComponentType;
import com.bank.lending.model.Decision;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.LoanOffer;
import com.bank.lending.model.LoanRequest;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.Penalty;
import com.bank.lending.model.RiskLevel;
import com.bank.lending.model.RuleAction;
import com.bank.lending.model.RuleResult;
import com.bank.lending.model.ScoreBreakdown;
import com.bank.lending.model.ScoringResult;
import com.bank.lending.model.SubScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Applies the lending policy to an applicant's metrics.
 *
 * Order of play:
 * 1. Rules run in their fixed order. A DECLINE rule ends the assessment at the floor score.
 * 2. Each score component bands its metrics, adds penalties and is clamped to its range.
 * 3. The clamped total picks a decision band; any fired REFER rule downgrades APPROVE.
 * 4. Approved applications get an offer bounded by product, score tier and affordability.
 *    An approval whose term limit sits below every available term is referred instead.
 *
 * Rules and components are strategies registered by type, like the classifier's matchers.
 * Scoring and product settings are copied at construction; every decision uses that snapshot.
 */
@Component
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final ScoringConfig scoring;
    private final ProductConfig product;
    private final RepaymentCalculator calculator;
    private final MetricsConfig metricsConfig;
    private final Map<DecisionRuleType, DecisionRule> ruleMap;
    private final Map<ComponentType, ScoreComponent> componentMap;
    private final Map<DecisionRuleType, RuleDefinition> ruleDefinitions;
    private final List<ScoreTier> tiersHighestFirst;

    public DecisionEngine(ScoringConfig scoring,
                          ProductConfig product,
                          MetricsConfig metricsConfig,
                          List<DecisionRule> rules,
                          List<ScoreComponent> components) {
        this.scoring = scoring.copy();
        this.product = product.copy();
        this.calculator = new RepaymentCalculator(this.product);
        this.metricsConfig = metricsConfig;
        this.ruleMap = new EnumMap<>(DecisionRuleType.class);
        this.componentMap = new EnumMap<>(ComponentType.class);

        // Auto-register all rule and component implementations
        for (DecisionRule rule : rules) {
            ruleMap.put(rule.getSupportedRuleType(), rule);
            log.info("Registered decision rule: {} -> {}",
                    rule.getSupportedRuleType(), rule.getClass().getSimpleName());
        }
        for (ScoreComponent component : components) {
            componentMap.put(component.getType(), component);
            log.info("Registered score component: {} -> {}",
                    component.getType(), component.getClass().getSimpleName());
        }

        List<String> problems = new ScoringConfigValidator(this.scoring, this.product, componentMap).validate();
        for (DecisionRuleType type : DecisionRuleType.values()) {
            if (!ruleMap.containsKey(type)) {
                problems.add("No rule implementation registered for " + type);
            }
        }
        for (ComponentType type : ComponentType.values()) {
            if (!componentMap.containsKey(type)) {
                problems.add("No score component registered for " + type);
            }
        }
        if (!problems.isEmpty()) {
            throw new EngineConfigurationException(problems);
        }

        this.ruleDefinitions = new EnumMap<>(DecisionRuleType.class);
        for (RuleDefinition def : this.scoring.getRules()) {
            ruleDefinitions.put(def.getType(), def);
        }
        this.tiersHighestFirst = new ArrayList<>(this.scoring.getTiers());
        tiersHighestFirst.sort(Comparator.comparingDouble(ScoreTier::getMinScore).reversed());
    }

    public ScoringResult decide(MetricsBundle metrics, LoanRequest request) {
        List<String> riskFlags = riskFlags(metrics);

        // 1. Rules
        List<RuleResult> ruleResults = new ArrayList<>();
        List<String> referReasons = new ArrayList<>();
        for (DecisionRuleType type : DecisionRuleType.values()) {
            RuleResult result = ruleMap.get(type).evaluate(metrics, ruleDefinitions.get(type));
            ruleResults.add(result);
            if (!result.isTriggered()) {
                continue;
            }
            metricsConfig.recordRuleFired(type.name(), result.getAction().name());
            if (result.getAction() == RuleAction.DECLINE) {
                log.warn("Decline rule {} fired: {}", type, result.getReason());
                return ScoringResult.builder()
                        .decision(Decision.DECLINE)
                        .score(scoring.getScoreFloor())
                        .riskLevel(RiskLevel.fromDecision(Decision.DECLINE))
                        .ruleResults(ruleResults)
                        .reasons(List.of(result.getReason()))
                        .riskFlags(riskFlags)
                        .build();
            }
            referReasons.add(result.getReason());
        }

        // 2. Score
        ScoreBreakdown breakdown = score(metrics);
        double score = breakdown.getTotal();

        // 3. Decision band
        List<String> reasons = new ArrayList<>(referReasons);
        Decision decision;
        if (score >= scoring.getBands().getApproveMin()) {
            decision = referReasons.isEmpty() ? Decision.APPROVE : Decision.REFER;
        } else if (score >= scoring.getBands().getReferMin()) {
            decision = Decision.REFER;
            reasons.add(String.format("Score %.1f is below the approval threshold %.0f",
                    score, scoring.getBands().getApproveMin()));
        } else {
            decision = Decision.DECLINE;
            reasons.add(String.format("Score %.1f is below the referral threshold %.0f",
                    score, scoring.getBands().getReferMin()));
        }

        // 4. Offer
        LoanOffer offer = null;
        if (decision == Decision.APPROVE) {
            Optional<ScoreTier> tier = tiersHighestFirst.stream()
                    .filter(t -> score >= t.getMinScore())
                    .findFirst();
            if (tier.isEmpty() || tier.get().getMaxAmount() <= 0 || tier.get().getMaxTerm() <= 0) {
                offer = LoanOffer.none(request.getTermMonths(), product.getDailyInterestRate());
            } else {
                int termLimit = Math.min(request.getTermMonths(), tier.get().getMaxTerm());
                OptionalInt term = snapTerm(termLimit);
                if (term.isPresent()) {
                    offer = buildOffer(score, tier.get(), term.getAsInt(), metrics.getAffordability(), request);
                } else {
                    log.info("Approved at score {} but no available term fits within {} months", score, termLimit);
                    decision = Decision.REFER;
                    reasons.add(String.format("No available loan term fits within %d months", termLimit));
                }
            }
        }

        log.debug("Decision {} with score {} ({} refer reasons)", decision, score, referReasons.size());
        return ScoringResult.builder()
                .decision(decision)
                .score(score)
                .riskLevel(RiskLevel.fromDecision(decision))
                .breakdown(breakdown)
                .ruleResults(ruleResults)
                .reasons(reasons)
                .riskFlags(riskFlags)
                .offer(offer)
                .build();
    }

    ScoreBreakdown score(MetricsBundle metrics) {
        List<ComponentScore> componentScores = new ArrayList<>();
        double rawTotal = 0.0;
        double penaltyTotal = 0.0;

        for (ComponentDefinition def : scoring.getComponents()) {
            Map<String, Double> values = componentMap.get(def.getType()).metricValues(metrics);

            double points = 0.0;
            List<SubScore> subScores = new ArrayList<>();
            for (Map.Entry<String, BandTable> e : def.getSubScores().entrySet()) {
                Double value = values.get(e.getKey());
                double awarded = BandScorer.score(e.getValue(), value);
                subScores.add(new SubScore(e.getKey(), value, awarded));
                points += awarded;
            }

            List<Penalty> penalties = new ArrayList<>();
            for (Map.Entry<String, PenaltyDefinition> e : def.getPenalties().entrySet()) {
                Double value = values.get(e.getKey());
                if (value != null && value > e.getValue().getThreshold()) {
                    penalties.add(new Penalty(e.getKey(), value, e.getValue().getPoints()));
                    points += e.getValue().getPoints();
                    penaltyTotal += e.getValue().getPoints();
                }
            }

            double clamped = clamp(points, def.getMinPoints(), def.getMaxPoints());
            rawTotal += clamped;
            componentScores.add(ComponentScore.builder()
                    .component(def.getType())
                    .points(round1(clamped))
                    .maxPoints(def.getMaxPoints())
                    .minPoints(def.getMinPoints())
                    .subScores(subScores)
                    .penalties(penalties)
                    .build());
        }

        return ScoreBreakdown.builder()
                .components(componentScores)
                .rawTotal(round1(rawTotal))
                .total(round1(clamp(rawTotal, scoring.getScoreFloor(), scoring.getScoreCeiling())))
                .penaltiesApplied(penaltyTotal)
                .build();
    }

    private LoanOffer buildOffer(double score, ScoreTier tier, int term,
                                 AffordabilityMetrics affordability, LoanRequest request) {
        double affordable = calculator.maxAffordablePrincipal(affordability.getStressedDisposable(), term);
        double principal = Math.min(Math.min(request.getAmount(), product.getMaxLoanAmount()),
                Math.min(tier.getMaxAmount(), affordable));
        principal = Math.floor(principal);

        if (principal < product.getMinLoanAmount()) {
            log.info("Approved at score {} but affordable principal {} is below the product minimum {}",
                    score, principal, product.getMinLoanAmount());
            return LoanOffer.none(term, product.getDailyInterestRate());
        }
        return calculator.offer(principal, term);
    }

    /** Largest available term not above the limit; empty when every term is longer. */
    OptionalInt snapTerm(int limit) {
        return product.getAvailableTerms().stream()
                .mapToInt(Integer::intValue)
                .filter(available -> available <= limit)
                .max();
    }

    private List<String> riskFlags(MetricsBundle m) {
        List<String> flags = new ArrayList<>();
        if (m.getRisk().getGamblingPercentage() > 0) {
            flags.add(String.format("Gambling: %.1f%% of income", m.getRisk().getGamblingPercentage()));
        }
        if (m.getDebt().getActiveHcstcLenders90d() > 0) {
            flags.add(String.format("Active high-cost lenders (90d): %d", m.getDebt().getActiveHcstcLenders90d()));
        }
        if (m.getRisk().getFailedPayments45d() > 0) {
            flags.add(String.format("Failed payments (45d): %d", m.getRisk().getFailedPayments45d()));
        }
        if (m.getDebt().getDebtCollectionAgencies() > 0) {
            flags.add(String.format("Debt collection: %d agencies", m.getDebt().getDebtCollectionAgencies()));
        }
        if (m.getBalance().getDaysInOverdraft() > scoring.getRiskFlags().getOverdraftDays()) {
            flags.add(String.format("Overdraft: %d days", m.getBalance().getDaysInOverdraft()));
        }
        if (m.getAffordability().getDebtToIncomeRatio() > scoring.getRiskFlags().getDebtToIncome()) {
            flags.add(String.format("High DTI: %.1f%%", m.getAffordability().getDebtToIncomeRatio()));
        }
        return flags;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
