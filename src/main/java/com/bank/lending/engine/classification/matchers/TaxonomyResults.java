package com.bank.lending.engine.classification.matchers;

import com.bank.lending.engine.classification.PatternLibrary.TaxonomyRule;
import com.bank.lending.model.ClassificationResult;
import com.bank.lending.model.ClassificationStep;
import com.bank.lending.model.MatchMethod;

final class TaxonomyResults {

    private TaxonomyResults() {
    }

    static ClassificationResult fromRule(TaxonomyRule rule, MatchMethod method, ClassificationStep step,
                                         double defaultConfidence, String lenderId, String reason) {
        return ClassificationResult.builder()
                .category(rule.getCategory())
                .subcategory(rule.getSubcategory())
                .confidence(rule.getConfidence() != null ? rule.getConfidence() : defaultConfidence)
                .method(method)
                .step(step)
                .weight(rule.getWeight())
                .stable(rule.isStable())
                .riskLevel(rule.getRiskLevel())
                .housing(rule.isHousing())
                .lenderId(lenderId)
                .matchedPattern(rule.getCode())
                .reason(reason)
                .build();
    }
}
