package com.bank.lending.engine.classification;

import com.bank.lending.model.Category;
import com.bank.lending.model.Direction;
import com.bank.lending.model.RiskLevel;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of the category pattern resource. Only used while loading;
 * the engine works with the compiled {@link PatternLibrary}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PatternLibraryDefinition {

    private String version;
    private Map<String, String> lenderAliases = new LinkedHashMap<>();
    private List<String> expenseServices = new ArrayList<>();
    private List<String> passThroughKeywords = new ArrayList<>();
    private List<TaxonomyRuleDefinition> strictTaxonomy = new ArrayList<>();
    private List<TaxonomyRuleDefinition> taxonomyFallback = new ArrayList<>();
    private IncomeSignalDefinition incomeSignals;
    private List<TableDefinition> categoryTables = new ArrayList<>();

    public enum MatchType {
        EXACT,
        PREFIX
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TaxonomyRuleDefinition {
        private String code;
        private MatchType matchType = MatchType.PREFIX;
        private Direction direction = Direction.ANY;
        private Category category;
        private String subcategory;
        private Double confidence;
        private double weight = 1.0;
        private RiskLevel riskLevel = RiskLevel.NONE;
        private boolean stable;
        private boolean housing;
        private String description;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IncomeSignalDefinition {
        private List<String> exclusion = new ArrayList<>();
        private List<String> payroll = new ArrayList<>();
        private List<String> benefit = new ArrayList<>();
        private List<String> pension = new ArrayList<>();
        private List<String> gig = new ArrayList<>();
        private List<String> loan = new ArrayList<>();
        private String employerSuffixPattern;
        private List<String> genericWords = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TableDefinition {
        private Category category;
        private Direction direction = Direction.ANY;
        private double minimumConfidence;
        private List<EntryDefinition> entries = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EntryDefinition {
        private String subcategory;
        private List<String> keywords = new ArrayList<>();
        private List<String> regexes = new ArrayList<>();
        private double weight = 1.0;
        private boolean stable;
        private RiskLevel riskLevel = RiskLevel.NONE;
        private boolean housing;
        private Double keywordConfidence;
        private Double regexConfidence;
    }
}
