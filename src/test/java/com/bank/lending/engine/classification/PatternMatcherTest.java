package com.bank.lending.engine.classification;

import com.bank.lending.config.ClassificationConfig;
import com.bank.lending.engine.classification.PatternLibrary.PatternEntry;
import com.bank.lending.model.Category;
import com.bank.lending.model.MatchMethod;
import com.bank.lending.model.RiskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PatternMatcherTest {

    private PatternMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new PatternMatcher(new ClassificationConfig());
    }

    private static PatternEntry entry(List<String> keywords, List<String> regexes) {
        return PatternEntry.builder()
                .category(Category.ESSENTIAL)
                .subcategory("groceries")
                .keywords(keywords)
                .regexes(regexes.stream().map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE)).toList())
                .weight(1.0)
                .riskLevel(RiskLevel.NONE)
                .keywordConfidence(0.90)
                .regexConfidence(0.80)
                .build();
    }

    @Test
    void match_keywordContained_returnsKeywordOutcome() {
        MatchOutcome outcome = matcher.match("TESCO STORES 2231", entry(List.of("ASDA", "TESCO"), List.of()));

        assertThat(outcome.isMatch()).isTrue();
        assertThat(outcome.getMethod()).isEqualTo(MatchMethod.KEYWORD);
        assertThat(outcome.getConfidence()).isEqualTo(0.90);
        assertThat(outcome.getMatchedTerm()).isEqualTo("TESCO");
    }

    @Test
    void match_keywordBeatsRegexOnSameEntry() {
        MatchOutcome outcome = matcher.match("TESCO EXPRESS", entry(List.of("TESCO"), List.of("tesco")));

        assertThat(outcome.getMethod()).isEqualTo(MatchMethod.KEYWORD);
    }

    @Test
    void match_regexOnly_returnsRegexOutcome() {
        MatchOutcome outcome = matcher.match("SAINSBURYS LOCAL", entry(List.of("ALDI"), List.of("sainsbury")));

        assertThat(outcome.getMethod()).isEqualTo(MatchMethod.REGEX);
        assertThat(outcome.getConfidence()).isEqualTo(0.80);
        assertThat(outcome.getMatchedTerm()).isEqualTo("sainsbury");
    }

    @Test
    void match_nearMiss_returnsFuzzyScaledConfidence() {
        // One substitution in five characters: similarity 80
        MatchOutcome outcome = matcher.match("TESKO", entry(List.of("TESCO"), List.of()));

        assertThat(outcome.getMethod()).isEqualTo(MatchMethod.FUZZY);
        assertThat(outcome.getConfidence()).isCloseTo(0.85 * 0.80, within(1e-9));
    }

    @Test
    void match_shortKeywordsNeverFuzzy() {
        MatchOutcome outcome = matcher.match("ALDO", entry(List.of("ALDI"), List.of()));

        assertThat(outcome.isMatch()).isFalse();
    }

    @Test
    void match_emptyText_noMatch() {
        assertThat(matcher.match("", entry(List.of("TESCO"), List.of())).isMatch()).isFalse();
        assertThat(matcher.match(null, entry(List.of("TESCO"), List.of())).isMatch()).isFalse();
    }

    @Test
    void containsKeyword_respectsWordBoundaries() {
        assertThat(PatternMatcher.containsKeyword("UC PAYMENT", "UC")).isTrue();
        assertThat(PatternMatcher.containsKeyword("TRUCK HIRE", "UC")).isFalse();
        assertThat(PatternMatcher.containsKeyword("PAID BY M&S FOOD", "M&S FOOD")).isTrue();
        assertThat(PatternMatcher.containsKeyword("RENTOKIL", "RENT")).isFalse();
    }

    @Test
    void firstKeyword_returnsFirstInListOrder() {
        assertThat(PatternMatcher.firstKeyword("SALARY BGC", List.of("BGC", "SALARY"))).contains("BGC");
        assertThat(PatternMatcher.containsAny("CARD PAYMENT", List.of("BGC", "SALARY"))).isFalse();
    }
}
