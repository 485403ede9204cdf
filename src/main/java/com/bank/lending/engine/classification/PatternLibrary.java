package com.bank.lending.engine.classification;

import com.bank.lending.engine.classification.PatternLibraryDefinition.MatchType;
import com.bank.lending.model.Category;
import com.bank.lending.model.Direction;
import com.bank.lending.model.RiskLevel;
import com.bank.lending.model.Transaction;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable, compiled category pattern tables. Built once at start-up by
 * {@link PatternLibraryLoader} and shared read-only by every classification run.
 */
@Value
@Builder
public class PatternLibrary {

    String version;

    /** Alias text to canonical lender token, longest alias first. */
    Map<String, String> lenderAliases;

    @Singular
    List<String> expenseServices;

    @Singular
    List<String> passThroughKeywords;

    @Singular("strictTaxonomyRule")
    List<TaxonomyRule> strictTaxonomy;

    @Singular("taxonomyFallbackRule")
    List<TaxonomyRule> taxonomyFallback;

    IncomeSignals incomeSignals;

    /** Tables in evaluation order: risk, debt, essential, income, positive, transfer. */
    @Singular
    List<CategoryTable> categoryTables;

    public Optional<CategoryTable> table(Category category) {
        return categoryTables.stream()
                .filter(t -> t.getCategory() == category)
                .findFirst();
    }

    public Optional<PatternEntry> entry(Category category, String subcategory) {
        return table(category).flatMap(t -> t.getEntries().stream()
                .filter(e -> e.getSubcategory().equals(subcategory))
                .findFirst());
    }

    @Value
    @Builder
    public static class TaxonomyRule {
        String code;
        MatchType matchType;
        Direction direction;
        Category category;
        String subcategory;
        /** Null means the configured taxonomy fallback confidence applies. */
        Double confidence;
        double weight;
        RiskLevel riskLevel;
        boolean stable;
        boolean housing;
        String description;

        /**
         * Matches the detailed taxonomy code, or the primary code when no detailed code is present.
         */
        public boolean matches(Transaction txn) {
            if (!direction.accepts(txn.getDirection())) {
                return false;
            }
            String taxonomy = txn.getTaxonomyDetailed();
            if (taxonomy == null || taxonomy.isBlank()) {
                taxonomy = txn.getTaxonomyPrimary();
            }
            if (taxonomy == null || taxonomy.isBlank()) {
                return false;
            }
            String code = taxonomy.trim().toUpperCase();
            return matchType == MatchType.EXACT ? code.equals(this.code) : code.startsWith(this.code);
        }
    }

    @Value
    @Builder
    public static class IncomeSignals {
        List<String> exclusion;
        List<String> payroll;
        List<String> benefit;
        List<String> pension;
        List<String> gig;
        List<String> loan;
        Pattern employerSuffix;
        List<String> genericWords;
    }

    @Value
    @Builder
    public static class CategoryTable {
        Category category;
        Direction direction;
        double minimumConfidence;
        List<PatternEntry> entries;
    }

    @Value
    @Builder
    public static class PatternEntry {
        Category category;
        String subcategory;
        List<String> keywords;
        List<Pattern> regexes;
        double weight;
        boolean stable;
        RiskLevel riskLevel;
        boolean housing;
        double keywordConfidence;
        double regexConfidence;
    }
}
