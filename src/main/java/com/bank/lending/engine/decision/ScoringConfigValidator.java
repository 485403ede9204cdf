package com.bank.lending.engine.decision;

import com.bank.lending.config.ProductConfig;
import com.bank.lending.config.ScoringConfig;
import com.bank.lending.config.ScoringConfig.BandTable;
import com.bank.lending.config.ScoringConfig.ComponentDefinition;
import com.bank.lending.config.ScoringConfig.RuleDefinition;
import com.bank.lending.config.ScoringConfig.ScoreTier;
import com.bank.lending.model.ComponentType;
import com.bank.lending.model.DecisionRuleType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Checks scoring policy and product limits before the engine accepts its first
 * application. Collects every problem instead of stopping at the first.
 */
class ScoringConfigValidator {

    private final ScoringConfig scoring;
    private final ProductConfig product;
    private final Map<ComponentType, ScoreComponent> components;

    ScoringConfigValidator(ScoringConfig scoring, ProductConfig product,
                           Map<ComponentType, ScoreComponent> components) {
        this.scoring = scoring;
        this.product = product;
        this.components = components;
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();
        validateRange(problems);
        validateRules(problems);
        validateComponents(problems);
        validateProduct(problems);
        validateTiers(problems);
        return problems;
    }

    private void validateRange(List<String> problems) {
        Double floor = scoring.getScoreFloor();
        Double ceiling = scoring.getScoreCeiling();
        if (floor == null) problems.add("scoring.score-floor is missing");
        if (ceiling == null) problems.add("scoring.score-ceiling is missing");
        if (floor != null && ceiling != null && floor >= ceiling) {
            problems.add("scoring.score-floor must be below scoring.score-ceiling");
        }
        if (scoring.getRiskFlags().getOverdraftDays() == null) {
            problems.add("scoring.risk-flags.overdraft-days is missing");
        }
        if (scoring.getRiskFlags().getDebtToIncome() == null) {
            problems.add("scoring.risk-flags.debt-to-income is missing");
        }
        Double approve = scoring.getBands().getApproveMin();
        Double refer = scoring.getBands().getReferMin();
        if (approve == null) problems.add("scoring.bands.approve-min is missing");
        if (refer == null) problems.add("scoring.bands.refer-min is missing");
        if (approve != null && refer != null && approve <= refer) {
            problems.add("scoring.bands.approve-min (" + approve + ") must be above refer-min (" + refer + ")");
        }
    }

    private void validateRules(List<String> problems) {
        Map<DecisionRuleType, Integer> counts = new EnumMap<>(DecisionRuleType.class);
        for (RuleDefinition rule : scoring.getRules()) {
            if (rule.getType() == null) {
                problems.add("scoring.rules entry without a type");
                continue;
            }
            counts.merge(rule.getType(), 1, Integer::sum);
            if (rule.getThreshold() == null) {
                problems.add("Rule " + rule.getType() + " has no threshold");
            }
            if (rule.getAction() == null) {
                problems.add("Rule " + rule.getType() + " has no action");
            }
        }
        for (DecisionRuleType type : DecisionRuleType.values()) {
            int count = counts.getOrDefault(type, 0);
            if (count == 0) {
                problems.add("Missing rule definition: " + type);
            } else if (count > 1) {
                problems.add("Rule " + type + " is defined " + count + " times");
            }
        }
    }

    private void validateComponents(List<String> problems) {
        Map<ComponentType, Integer> counts = new EnumMap<>(ComponentType.class);
        for (ComponentDefinition def : scoring.getComponents()) {
            if (def.getType() == null) {
                problems.add("scoring.components entry without a type");
                continue;
            }
            counts.merge(def.getType(), 1, Integer::sum);
            String name = "Component " + def.getType();

            if (def.getMaxPoints() == null) {
                problems.add(name + " has no max-points");
            } else if (def.getMinPoints() > def.getMaxPoints()) {
                problems.add(name + " min-points is above max-points");
            }
            if (def.getSubScores().isEmpty()) {
                problems.add(name + " has no sub-score tables");
            }

            ScoreComponent component = components.get(def.getType());
            List<String> known = component == null ? List.of() : component.metricNames();
            def.getSubScores().forEach((metric, table) -> {
                if (!known.contains(metric)) {
                    problems.add(name + " references unknown metric '" + metric + "'");
                }
                validateTable(problems, name + " table '" + metric + "'", table, def.getMaxPoints());
            });
            def.getPenalties().forEach((metric, penalty) -> {
                if (!known.contains(metric)) {
                    problems.add(name + " penalty references unknown metric '" + metric + "'");
                }
                if (penalty.getPoints() > 0) {
                    problems.add(name + " penalty '" + metric + "' must not award positive points");
                }
            });
        }
        for (ComponentType type : ComponentType.values()) {
            int count = counts.getOrDefault(type, 0);
            if (count == 0) {
                problems.add("Missing score component: " + type);
            } else if (count > 1) {
                problems.add("Score component " + type + " is defined " + count + " times");
            }
        }
    }

    private void validateTable(List<String> problems, String name, BandTable table, Double cap) {
        if (table == null || table.getBands() == null || table.getBands().isEmpty()) {
            problems.add(name + " is empty");
            return;
        }
        if (table.getDirection() == null) {
            problems.add(name + " has no direction");
            return;
        }
        if (!BandScorer.isMonotonic(table)) {
            problems.add(name + " is not monotonic for " + table.getDirection());
        }
        if (cap != null && BandScorer.maxPoints(table) > cap) {
            problems.add(name + " awards more than the component maximum " + cap);
        }
    }

    private void validateProduct(List<String> problems) {
        if (product.getMinLoanAmount() == null) problems.add("product.min-loan-amount is missing");
        if (product.getMaxLoanAmount() == null) problems.add("product.max-loan-amount is missing");
        if (product.getDailyInterestRate() == null) problems.add("product.daily-interest-rate is missing");
        if (product.getTotalCostCap() == null) problems.add("product.total-cost-cap is missing");
        if (product.getAvailableTerms() == null || product.getAvailableTerms().isEmpty()) {
            problems.add("product.available-terms is missing");
        } else if (product.getAvailableTerms().stream().anyMatch(t -> t == null || t <= 0)) {
            problems.add("product.available-terms must all be positive");
        }
        if (product.getMinLoanAmount() != null && product.getMaxLoanAmount() != null
                && product.getMinLoanAmount() > product.getMaxLoanAmount()) {
            problems.add("product.min-loan-amount is above product.max-loan-amount");
        }
    }

    private void validateTiers(List<String> problems) {
        if (scoring.getTiers().isEmpty()) {
            problems.add("scoring.tiers is empty");
        }
        for (ScoreTier tier : scoring.getTiers()) {
            if (tier.getMaxAmount() < 0 || tier.getMaxTerm() < 0) {
                problems.add("scoring.tiers entry at min-score " + tier.getMinScore() + " has negative limits");
            }
        }
    }
}
