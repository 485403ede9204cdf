package com.bank.lending.config;

import com.bank.lending.model.ComponentType;
import com.bank.lending.model.DecisionRuleType;
import com.bank.lending.model.RuleAction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Decision policy: rules, score components, decision bands and offer tiers.
 * None of the policy values has a built-in default. Everything is read from
 * application.yml and validated when the decision engine starts; the engine then
 * works from a {@link #copy()} so later changes to this bean do not reach it.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private Double scoreFloor;
    private Double scoreCeiling;

    private DecisionBands bands = new DecisionBands();

    private List<RuleDefinition> rules = new ArrayList<>();

    private List<ComponentDefinition> components = new ArrayList<>();

    // Offer limits by score, highest qualifying minScore wins
    private List<ScoreTier> tiers = new ArrayList<>();

    private RiskFlags riskFlags = new RiskFlags();

    /**
     * Deep copy with unmodifiable collections.
     */
    public ScoringConfig copy() {
        ScoringConfig copy = new ScoringConfig();
        copy.setScoreFloor(scoreFloor);
        copy.setScoreCeiling(scoreCeiling);
        copy.setBands(bands == null ? new DecisionBands() : bands.copy());
        copy.setRules(copyList(rules, RuleDefinition::copy));
        copy.setComponents(copyList(components, ComponentDefinition::copy));
        copy.setTiers(copyList(tiers, ScoreTier::copy));
        copy.setRiskFlags(riskFlags == null ? new RiskFlags() : riskFlags.copy());
        return copy;
    }

    private static <T> List<T> copyList(List<T> source, Function<T, T> copier) {
        List<T> copy = new ArrayList<>();
        if (source != null) {
            for (T item : source) {
                copy.add(item == null ? null : copier.apply(item));
            }
        }
        return Collections.unmodifiableList(copy);
    }

    private static <T> Map<String, T> copyMap(Map<String, T> source, Function<T, T> copier) {
        Map<String, T> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> copy.put(key, value == null ? null : copier.apply(value)));
        }
        return Collections.unmodifiableMap(copy);
    }

    @Data
    public static class DecisionBands {
        private Double approveMin;
        private Double referMin;

        DecisionBands copy() {
            DecisionBands copy = new DecisionBands();
            copy.setApproveMin(approveMin);
            copy.setReferMin(referMin);
            return copy;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RuleDefinition {
        private DecisionRuleType type;
        private Double threshold;
        private RuleAction action;

        RuleDefinition copy() {
            return new RuleDefinition(type, threshold, action);
        }
    }

    // min-points defaults to 0: a component cannot go negative unless it says so
    @Data
    public static class ComponentDefinition {
        private ComponentType type;
        private Double maxPoints;
        private double minPoints = 0.0;
        private Map<String, BandTable> subScores = new LinkedHashMap<>();
        private Map<String, PenaltyDefinition> penalties = new LinkedHashMap<>();

        ComponentDefinition copy() {
            ComponentDefinition copy = new ComponentDefinition();
            copy.setType(type);
            copy.setMaxPoints(maxPoints);
            copy.setMinPoints(minPoints);
            copy.setSubScores(copyMap(subScores, BandTable::copy));
            copy.setPenalties(copyMap(penalties, PenaltyDefinition::copy));
            return copy;
        }
    }

    public enum BandDirection {
        LOWER_IS_BETTER,
        HIGHER_IS_BETTER
    }

    /**
     * Lookup table from a metric value to points.
     * LOWER_IS_BETTER: bounds ascending, a value scores the first band whose bound it does not exceed.
     * HIGHER_IS_BETTER: bounds descending, a value scores the first band whose bound it reaches.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BandTable {
        private BandDirection direction;
        private List<Band> bands = new ArrayList<>();

        BandTable copy() {
            return new BandTable(direction, bands == null ? null : copyList(bands, Band::copy));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Band {
        private double bound;
        private double points;

        Band copy() {
            return new Band(bound, points);
        }
    }

    // Fires when the metric is strictly greater than the threshold
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PenaltyDefinition {
        private double threshold;
        private double points;

        PenaltyDefinition copy() {
            return new PenaltyDefinition(threshold, points);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScoreTier {
        private double minScore;
        private double maxAmount;
        private int maxTerm;

        ScoreTier copy() {
            return new ScoreTier(minScore, maxAmount, maxTerm);
        }
    }

    @Data
    public static class RiskFlags {
        private Integer overdraftDays;
        private Double debtToIncome;

        RiskFlags copy() {
            RiskFlags copy = new RiskFlags();
            copy.setOverdraftDays(overdraftDays);
            copy.setDebtToIncome(debtToIncome);
            return copy;
        }
    }
}
