package com.bank.lending.engine.classification.matchers;

import com.bank.lending.config.ClassificationConfig;
import com.bank.lending.engine.classification.ClassificationContext;
import com.bank.lending.engine.classification.PatternLibrary;
import com.bank.lending.engine.classification.PatternLibrary.TaxonomyRule;
import com.bank.lending.engine.classification.TransactionMatcher;
import com.bank.lending.model.Category;
import com.bank.lending.model.ClassificationResult;
import com.bank.lending.model.ClassificationStep;
import com.bank.lending.model.MatchMethod;
import com.bank.lending.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Terminal step; always classifies. Coarse taxonomy mapping first, then a low-confidence
 * default: unexplained credits count as partially weighted income, debits as other spend.
 */
@Component
public class FallbackMatcher implements TransactionMatcher {

    private final List<TaxonomyRule> taxonomyFallback;
    private final ClassificationConfig config;

    public FallbackMatcher(PatternLibrary library, ClassificationConfig config) {
        this.taxonomyFallback = library.getTaxonomyFallback();
        this.config = config;
    }

    @Override
    public ClassificationStep getStep() {
        return ClassificationStep.FALLBACK;
    }

    @Override
    public Optional<ClassificationResult> match(ClassificationContext ctx) {
        if (!ctx.getTransaction().hasValidAmount()) {
            return Optional.of(ClassificationResult.builder()
                    .category(Category.OTHER)
                    .subcategory("unclassified")
                    .confidence(config.getMalformedConfidence())
                    .method(MatchMethod.DEFAULT)
                    .step(getStep())
                    .weight(0.0)
                    .riskLevel(RiskLevel.NONE)
                    .reason("No usable amount")
                    .build());
        }

        for (TaxonomyRule rule : taxonomyFallback) {
            if (rule.matches(ctx.getTransaction())) {
                return Optional.of(TaxonomyResults.fromRule(rule, MatchMethod.TAXONOMY_FALLBACK, getStep(),
                        config.getTaxonomyFallbackConfidence(), ctx.getLenderId(),
                        "Taxonomy fallback " + rule.getCode()));
            }
        }

        if (ctx.isCredit()) {
            return Optional.of(ClassificationResult.builder()
                    .category(Category.INCOME)
                    .subcategory("other")
                    .confidence(config.getFallbackConfidence())
                    .method(MatchMethod.DEFAULT)
                    .step(getStep())
                    .weight(config.getUnclassifiedCreditWeight())
                    .riskLevel(RiskLevel.NONE)
                    .lenderId(ctx.getLenderId())
                    .reason("Unrecognised credit")
                    .build());
        }
        return Optional.of(ClassificationResult.builder()
                .category(Category.EXPENSE)
                .subcategory("other")
                .confidence(config.getFallbackConfidence())
                .method(MatchMethod.DEFAULT)
                .step(getStep())
                .weight(1.0)
                .riskLevel(RiskLevel.NONE)
                .lenderId(ctx.getLenderId())
                .reason("Unrecognised debit")
                .build());
    }
}
