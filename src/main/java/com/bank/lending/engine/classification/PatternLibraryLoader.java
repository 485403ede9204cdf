package com.bank.lending.engine.classification;

import com.bank.lending.config.ClassificationConfig;
import com.bank.lending.config.EngineConfigurationException;
import com.bank.lending.engine.classification.PatternLibraryDefinition.EntryDefinition;
import com.bank.lending.engine.classification.PatternLibraryDefinition.IncomeSignalDefinition;
import com.bank.lending.engine.classification.PatternLibraryDefinition.TableDefinition;
import com.bank.lending.engine.classification.PatternLibraryDefinition.TaxonomyRuleDefinition;
import com.bank.lending.engine.classification.PatternLibrary.CategoryTable;
import com.bank.lending.engine.classification.PatternLibrary.IncomeSignals;
import com.bank.lending.engine.classification.PatternLibrary.PatternEntry;
import com.bank.lending.engine.classification.PatternLibrary.TaxonomyRule;
import com.bank.lending.model.Category;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads the category pattern resource and compiles it into a {@link PatternLibrary}.
 * Every problem found is collected and reported together.
 */
public class PatternLibraryLoader {

    private static final Logger log = LoggerFactory.getLogger(PatternLibraryLoader.class);

    /** Fixed evaluation order of the category tables. */
    public static final List<Category> TABLE_ORDER = List.of(
            Category.RISK, Category.DEBT, Category.ESSENTIAL,
            Category.INCOME, Category.POSITIVE, Category.TRANSFER);

    /** Income subcategories the behavioral step can resolve to. */
    public static final List<String> REQUIRED_INCOME_ENTRIES = List.of(
            "salary", "benefits", "pension", "gig_economy", "loans", "other");

    private final ObjectMapper objectMapper;
    private final ClassificationConfig.Matching matching;

    public PatternLibraryLoader(ObjectMapper objectMapper, ClassificationConfig.Matching matching) {
        this.objectMapper = objectMapper;
        this.matching = matching;
    }

    public PatternLibrary load(Resource resource) {
        PatternLibraryDefinition definition;
        try (InputStream in = resource.getInputStream()) {
            definition = objectMapper.readValue(in, PatternLibraryDefinition.class);
        } catch (IOException e) {
            throw new EngineConfigurationException("Cannot read pattern library " + resource.getDescription(), e);
        }

        PatternLibrary library = compile(definition);
        log.info("Loaded pattern library version={} tables={} lenderAliases={}",
                library.getVersion(), library.getCategoryTables().size(), library.getLenderAliases().size());
        return library;
    }

    public PatternLibrary compile(PatternLibraryDefinition definition) {
        List<String> problems = new ArrayList<>();

        PatternLibrary.PatternLibraryBuilder builder = PatternLibrary.builder()
                .version(definition.getVersion())
                .lenderAliases(sortAliases(definition.getLenderAliases()))
                .expenseServices(upper(definition.getExpenseServices()))
                .passThroughKeywords(upper(definition.getPassThroughKeywords()));

        for (TaxonomyRuleDefinition rule : definition.getStrictTaxonomy()) {
            toRule(rule, "strictTaxonomy", problems).ifPresent(builder::strictTaxonomyRule);
        }
        for (TaxonomyRuleDefinition rule : definition.getTaxonomyFallback()) {
            toRule(rule, "taxonomyFallback", problems).ifPresent(builder::taxonomyFallbackRule);
        }

        builder.incomeSignals(toIncomeSignals(definition.getIncomeSignals(), problems));

        Map<Category, TableDefinition> tables = new LinkedHashMap<>();
        for (TableDefinition table : definition.getCategoryTables()) {
            if (table.getCategory() == null) {
                problems.add("categoryTables: table without category");
            } else if (tables.put(table.getCategory(), table) != null) {
                problems.add("categoryTables: duplicate table for " + table.getCategory());
            }
        }
        for (Category category : TABLE_ORDER) {
            TableDefinition table = tables.get(category);
            if (table == null) {
                problems.add("categoryTables: missing table for " + category);
                continue;
            }
            builder.categoryTable(toTable(table, problems));
        }
        for (Category category : tables.keySet()) {
            if (!TABLE_ORDER.contains(category)) {
                problems.add("categoryTables: " + category + " has no place in the table order");
            }
        }

        if (!problems.isEmpty()) {
            throw new EngineConfigurationException(problems);
        }

        PatternLibrary library = builder.build();
        for (String subcategory : REQUIRED_INCOME_ENTRIES) {
            if (library.entry(Category.INCOME, subcategory).isEmpty()) {
                problems.add("categoryTables: INCOME table is missing entry '" + subcategory + "'");
            }
        }
        if (!problems.isEmpty()) {
            throw new EngineConfigurationException(problems);
        }
        return library;
    }

    private Map<String, String> sortAliases(Map<String, String> aliases) {
        Map<String, String> sorted = new LinkedHashMap<>();
        aliases.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed()
                        .thenComparing(Map.Entry::getKey))
                .forEach(e -> sorted.put(e.getKey().toUpperCase().trim(), e.getValue().toUpperCase().trim()));
        return Collections.unmodifiableMap(sorted);
    }

    private Optional<TaxonomyRule> toRule(TaxonomyRuleDefinition def, String section, List<String> problems) {
        if (def.getCode() == null || def.getCode().isBlank()) {
            problems.add(section + ": rule without code");
            return Optional.empty();
        }
        if (def.getCategory() == null || def.getSubcategory() == null) {
            problems.add(section + ": rule " + def.getCode() + " needs category and subcategory");
            return Optional.empty();
        }
        return Optional.of(TaxonomyRule.builder()
                .code(def.getCode().trim().toUpperCase())
                .matchType(def.getMatchType())
                .direction(def.getDirection())
                .category(def.getCategory())
                .subcategory(def.getSubcategory())
                .confidence(def.getConfidence())
                .weight(def.getWeight())
                .riskLevel(def.getRiskLevel())
                .stable(def.isStable())
                .housing(def.isHousing())
                .description(def.getDescription() != null ? def.getDescription() : def.getCode())
                .build());
    }

    private IncomeSignals toIncomeSignals(IncomeSignalDefinition def, List<String> problems) {
        if (def == null) {
            problems.add("incomeSignals: section missing");
            return null;
        }
        Pattern employerSuffix = null;
        if (def.getEmployerSuffixPattern() == null) {
            problems.add("incomeSignals: employerSuffixPattern missing");
        } else {
            employerSuffix = compileRegex(def.getEmployerSuffixPattern(), "incomeSignals.employerSuffixPattern", problems);
        }
        return IncomeSignals.builder()
                .exclusion(upper(def.getExclusion()))
                .payroll(upper(def.getPayroll()))
                .benefit(upper(def.getBenefit()))
                .pension(upper(def.getPension()))
                .gig(upper(def.getGig()))
                .loan(upper(def.getLoan()))
                .employerSuffix(employerSuffix)
                .genericWords(upper(def.getGenericWords()))
                .build();
    }

    private CategoryTable toTable(TableDefinition table, List<String> problems) {
        List<PatternEntry> entries = new ArrayList<>();
        for (EntryDefinition entry : table.getEntries()) {
            String where = "categoryTables." + table.getCategory() + "." + entry.getSubcategory();
            if (entry.getSubcategory() == null || entry.getSubcategory().isBlank()) {
                problems.add("categoryTables." + table.getCategory() + ": entry without subcategory");
                continue;
            }
            if (entry.getWeight() < 0.0 || entry.getWeight() > 1.0) {
                problems.add(where + ": weight must be within [0, 1]");
            }
            List<Pattern> regexes = new ArrayList<>();
            for (String regex : entry.getRegexes()) {
                Pattern compiled = compileRegex(regex, where, problems);
                if (compiled != null) {
                    regexes.add(compiled);
                }
            }
            entries.add(PatternEntry.builder()
                    .category(table.getCategory())
                    .subcategory(entry.getSubcategory())
                    .keywords(upper(entry.getKeywords()))
                    .regexes(List.copyOf(regexes))
                    // Only income entries discount; every other category counts in full
                    .weight(table.getCategory() == Category.INCOME ? entry.getWeight() : 1.0)
                    .stable(entry.isStable())
                    .riskLevel(entry.getRiskLevel())
                    .housing(entry.isHousing())
                    .keywordConfidence(entry.getKeywordConfidence() != null
                            ? entry.getKeywordConfidence() : matching.getKeywordConfidence())
                    .regexConfidence(entry.getRegexConfidence() != null
                            ? entry.getRegexConfidence() : matching.getRegexConfidence())
                    .build());
        }
        return CategoryTable.builder()
                .category(table.getCategory())
                .direction(table.getDirection())
                .minimumConfidence(table.getMinimumConfidence())
                .entries(List.copyOf(entries))
                .build();
    }

    private Pattern compileRegex(String regex, String where, List<String> problems) {
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            problems.add(where + ": invalid regex '" + regex + "' (" + e.getDescription() + ")");
            return null;
        }
    }

    private static List<String> upper(List<String> values) {
        if (values == null) return List.of();
        return values.stream()
                .map(v -> v.toUpperCase().trim())
                .filter(v -> !v.isEmpty())
                .toList();
    }
}
