package com.bank.lending.engine.classification.matchers;

import com.bank.lending.config.ClassificationConfig;
import com.bank.lending.engine.classification.ClassificationContext;
import com.bank.lending.engine.classification.PatternLibrary;
import com.bank.lending.engine.classification.PatternLibrary.TaxonomyRule;
import com.bank.lending.engine.classification.TransactionMatcher;
import com.bank.lending.model.ClassificationResult;
import com.bank.lending.model.ClassificationStep;
import com.bank.lending.model.MatchMethod;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Third-party taxonomy codes that win regardless of description text:
 * loan disbursements, account transfers, gambling and unpaid-item fees.
 * Loan disbursements land in income with weight 0 so they stay visible but never count.
 */
@Component
public class StrictTaxonomyMatcher implements TransactionMatcher {

    private final List<TaxonomyRule> rules;
    private final double defaultConfidence;

    public StrictTaxonomyMatcher(PatternLibrary library, ClassificationConfig config) {
        this.rules = library.getStrictTaxonomy();
        this.defaultConfidence = config.getTaxonomyFallbackConfidence();
    }

    @Override
    public ClassificationStep getStep() {
        return ClassificationStep.STRICT_TAXONOMY;
    }

    @Override
    public Optional<ClassificationResult> match(ClassificationContext ctx) {
        for (TaxonomyRule rule : rules) {
            if (rule.matches(ctx.getTransaction())) {
                return Optional.of(TaxonomyResults.fromRule(rule, MatchMethod.TAXONOMY_STRICT, getStep(),
                        defaultConfidence, ctx.getLenderId(), "Strict taxonomy " + rule.getCode() + ": " + rule.getDescription()));
            }
        }
        return Optional.empty();
    }
}
