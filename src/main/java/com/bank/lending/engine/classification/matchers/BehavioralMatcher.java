package com.bank.lending.engine.classification.matchers;

import com.bank.lending.config.ClassificationConfig;
import com.bank.lending.engine.classification.ClassificationContext;
import com.bank.lending.engine.classification.PatternLibrary;
import com.bank.lending.engine.classification.PatternLibrary.PatternEntry;
import com.bank.lending.engine.classification.TransactionMatcher;
import com.bank.lending.engine.income.BehavioralIncomeDetector;
import com.bank.lending.model.Category;
import com.bank.lending.model.ClassificationResult;
import com.bank.lending.model.ClassificationStep;
import com.bank.lending.model.IncomeVerdict;
import com.bank.lending.model.MatchMethod;
import com.bank.lending.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves credits the income detector is confident about. Runs before the pattern
 * tables because third-party taxonomies often label payroll rails as transfers.
 */
@Component
public class BehavioralMatcher implements TransactionMatcher {

    private final BehavioralIncomeDetector detector;
    private final PatternLibrary library;
    private final double acceptanceThreshold;

    public BehavioralMatcher(BehavioralIncomeDetector detector, PatternLibrary library, ClassificationConfig config) {
        this.detector = detector;
        this.library = library;
        this.acceptanceThreshold = config.getBehavioralAcceptanceThreshold();
    }

    @Override
    public ClassificationStep getStep() {
        return ClassificationStep.BEHAVIORAL;
    }

    @Override
    public Optional<ClassificationResult> match(ClassificationContext ctx) {
        if (!ctx.isCredit()) {
            return Optional.empty();
        }
        IncomeVerdict verdict = detector.assess(ctx);
        if (!verdict.isIncome() || verdict.getConfidence() < acceptanceThreshold) {
            return Optional.empty();
        }

        PatternEntry entry = library.entry(Category.INCOME, verdict.getSubcategory())
                .or(() -> library.entry(Category.INCOME, "other"))
                .orElseThrow(() -> new IllegalStateException("Income table has no 'other' entry"));

        return Optional.of(ClassificationResult.builder()
                .category(Category.INCOME)
                .subcategory(entry.getSubcategory())
                .confidence(verdict.getConfidence())
                .method(MatchMethod.BEHAVIORAL)
                .step(getStep())
                .weight(entry.getWeight())
                .stable(entry.isStable())
                .riskLevel(RiskLevel.NONE)
                .lenderId(ctx.getLenderId())
                .reason(verdict.getReason())
                .build());
    }
}
