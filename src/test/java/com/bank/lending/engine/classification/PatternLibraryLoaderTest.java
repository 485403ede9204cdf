package com.bank.lending.engine.classification;

import com.bank.lending.config.ClassificationConfig;
import com.bank.lending.config.EngineConfigurationException;
import com.bank.lending.engine.classification.PatternLibraryDefinition.EntryDefinition;
import com.bank.lending.engine.classification.PatternLibraryDefinition.IncomeSignalDefinition;
import com.bank.lending.engine.classification.PatternLibraryDefinition.TableDefinition;
import com.bank.lending.model.Category;
import com.bank.lending.model.Direction;
import com.bank.lending.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternLibraryLoaderTest {

    private PatternLibraryLoader loader;

    @BeforeEach
    void setUp() {
        loader = new PatternLibraryLoader(new ObjectMapper(), new ClassificationConfig().getMatching());
    }

    @Test
    void load_shippedLibrary_hasTablesInEvaluationOrder() {
        PatternLibrary library = TestDataFactory.loadPatternLibrary();

        assertThat(library.getCategoryTables())
                .extracting(PatternLibrary.CategoryTable::getCategory)
                .containsExactly(Category.RISK, Category.DEBT, Category.ESSENTIAL,
                        Category.INCOME, Category.POSITIVE, Category.TRANSFER);
        assertThat(library.getStrictTaxonomy()).isNotEmpty();
        assertThat(library.getIncomeSignals().getEmployerSuffix()).isNotNull();
    }

    @Test
    void load_shippedLibrary_onlyIncomeEntriesDiscount() {
        PatternLibrary library = TestDataFactory.loadPatternLibrary();

        assertThat(library.entry(Category.INCOME, "gig_economy").map(PatternLibrary.PatternEntry::getWeight))
                .contains(0.7);
        assertThat(library.entry(Category.INCOME, "loans").map(PatternLibrary.PatternEntry::getWeight))
                .contains(0.0);
        library.getCategoryTables().stream()
                .filter(t -> t.getCategory() != Category.INCOME)
                .flatMap(t -> t.getEntries().stream())
                .forEach(e -> assertThat(e.getWeight()).isEqualTo(1.0));
    }

    @Test
    void load_shippedLibrary_aliasesLongestFirst() {
        List<String> aliases = new ArrayList<>(TestDataFactory.loadPatternLibrary().getLenderAliases().keySet());

        for (int i = 1; i < aliases.size(); i++) {
            assertThat(aliases.get(i - 1).length()).isGreaterThanOrEqualTo(aliases.get(i).length());
        }
    }

    @Test
    void load_unreadableResource_throwsConfigurationError() {
        ByteArrayResource broken = new ByteArrayResource("{ not json".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> loader.load(broken))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("Cannot read pattern library");
    }

    @Test
    void compile_invalidRegexAndMissingTables_reportsEveryProblem() {
        PatternLibraryDefinition definition = new PatternLibraryDefinition();
        IncomeSignalDefinition signals = new IncomeSignalDefinition();
        signals.setEmployerSuffixPattern("\\b(LTD|PLC)\\b");
        definition.setIncomeSignals(signals);

        EntryDefinition gambling = new EntryDefinition();
        gambling.setSubcategory("gambling");
        gambling.setRegexes(List.of("bet(365"));
        TableDefinition risk = new TableDefinition();
        risk.setCategory(Category.RISK);
        risk.setDirection(Direction.ANY);
        risk.setMinimumConfidence(0.75);
        risk.setEntries(List.of(gambling));
        definition.setCategoryTables(List.of(risk));

        assertThatThrownBy(() -> loader.compile(definition))
                .isInstanceOf(EngineConfigurationException.class)
                .satisfies(e -> {
                    List<String> problems = ((EngineConfigurationException) e).getProblems();
                    assertThat(problems).anyMatch(p -> p.contains("invalid regex 'bet(365'"));
                    assertThat(problems).anyMatch(p -> p.contains("missing table for DEBT"));
                    assertThat(problems).anyMatch(p -> p.contains("missing table for TRANSFER"));
                });
    }

    @Test
    void compile_missingIncomeSignals_isRejected() {
        PatternLibraryDefinition definition = new PatternLibraryDefinition();

        assertThatThrownBy(() -> loader.compile(definition))
                .isInstanceOf(EngineConfigurationException.class)
                .hasMessageContaining("incomeSignals: section missing");
    }
}
