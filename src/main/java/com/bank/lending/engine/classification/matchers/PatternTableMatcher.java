package com.bank.lending.engine.classification.matchers;

import com.bank.lending.engine.classification.ClassificationContext;
import com.bank.lending.engine.classification.MatchOutcome;
import com.bank.lending.engine.classification.PatternLibrary;
import com.bank.lending.engine.classification.PatternLibrary.CategoryTable;
import com.bank.lending.engine.classification.PatternLibrary.PatternEntry;
import com.bank.lending.engine.classification.PatternMatcher;
import com.bank.lending.engine.classification.TransactionMatcher;
import com.bank.lending.model.ClassificationResult;
import com.bank.lending.model.ClassificationStep;
import com.bank.lending.model.MatchMethod;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Walks the category tables in their fixed order (risk, debt, essential, income,
 * positive, transfer). The first table with an accepted match wins. Within a table
 * an explicit regex beats a keyword, which beats a fuzzy match; then higher
 * confidence; then the entry listed first.
 */
@Component
public class PatternTableMatcher implements TransactionMatcher {

    private final List<CategoryTable> tables;
    private final PatternMatcher patternMatcher;

    public PatternTableMatcher(PatternLibrary library, PatternMatcher patternMatcher) {
        this.tables = library.getCategoryTables();
        this.patternMatcher = patternMatcher;
    }

    @Override
    public ClassificationStep getStep() {
        return ClassificationStep.PATTERN_TABLE;
    }

    @Override
    public Optional<ClassificationResult> match(ClassificationContext ctx) {
        for (CategoryTable table : tables) {
            if (!table.getDirection().accepts(ctx.getTransaction().getDirection())) {
                continue;
            }

            PatternEntry bestEntry = null;
            MatchOutcome best = null;
            for (PatternEntry entry : table.getEntries()) {
                MatchOutcome outcome = patternMatcher.match(ctx.getText(), entry);
                if (!outcome.isMatch() || outcome.getConfidence() < table.getMinimumConfidence()) {
                    continue;
                }
                if (best == null || beats(outcome, best)) {
                    best = outcome;
                    bestEntry = entry;
                }
            }

            if (best != null) {
                return Optional.of(toResult(ctx, table, bestEntry, best));
            }
        }
        return Optional.empty();
    }

    private ClassificationResult toResult(ClassificationContext ctx, CategoryTable table,
                                          PatternEntry entry, MatchOutcome outcome) {
        String reason = String.format("%s match '%s' in %s/%s",
                outcome.getMethod().name().toLowerCase(), outcome.getMatchedTerm(),
                table.getCategory().name().toLowerCase(), entry.getSubcategory());
        return ClassificationResult.builder()
                .category(table.getCategory())
                .subcategory(entry.getSubcategory())
                .confidence(outcome.getConfidence())
                .method(outcome.getMethod())
                .step(getStep())
                .weight(entry.getWeight())
                .stable(entry.isStable())
                .riskLevel(entry.getRiskLevel())
                .housing(entry.isHousing())
                .lenderId(ctx.getLenderId())
                .matchedPattern(outcome.getMatchedTerm())
                .reason(reason)
                .build();
    }

    // Strictly better only, so earlier entries keep ties
    private static boolean beats(MatchOutcome candidate, MatchOutcome current) {
        int rankDiff = rank(candidate.getMethod()) - rank(current.getMethod());
        if (rankDiff != 0) {
            return rankDiff > 0;
        }
        return candidate.getConfidence() > current.getConfidence();
    }

    private static int rank(MatchMethod method) {
        switch (method) {
            case REGEX:
                return 3;
            case KEYWORD:
                return 2;
            case FUZZY:
                return 1;
            default:
                return 0;
        }
    }
}
