package com.bank.lending.engine.classification.matchers;

import com.bank.lending.config.ClassificationConfig;
import com.bank.lending.engine.classification.ClassificationContext;
import com.bank.lending.engine.classification.PatternLibrary;
import com.bank.lending.engine.classification.TransactionMatcher;
import com.bank.lending.model.Category;
import com.bank.lending.model.ClassificationResult;
import com.bank.lending.model.ClassificationStep;
import com.bank.lending.model.MatchMethod;
import com.bank.lending.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

import static com.bank.lending.engine.classification.PatternMatcher.firstKeyword;

/**
 * Credits from payment processors, BNPL providers and lenders are money moving
 * through the account, not income. Payouts and disbursements pass through to the
 * later steps so gig-economy payouts can still be recognised.
 */
@Component
public class WhitelistMatcher implements TransactionMatcher {

    private final List<String> expenseServices;
    private final List<String> loanKeywords;
    private final List<String> passThroughKeywords;
    private final double confidence;

    public WhitelistMatcher(PatternLibrary library, ClassificationConfig config) {
        this.expenseServices = library.getExpenseServices();
        this.loanKeywords = library.getIncomeSignals().getLoan();
        this.passThroughKeywords = library.getPassThroughKeywords();
        this.confidence = config.getWhitelistConfidence();
    }

    @Override
    public ClassificationStep getStep() {
        return ClassificationStep.WHITELIST;
    }

    @Override
    public Optional<ClassificationResult> match(ClassificationContext ctx) {
        if (!ctx.isCredit()) {
            return Optional.empty();
        }
        String text = ctx.getText();
        if (firstKeyword(text, passThroughKeywords).isPresent()) {
            return Optional.empty();
        }

        Optional<String> service = Optional.ofNullable(ctx.getLenderId())
                .or(() -> firstKeyword(text, loanKeywords))
                .or(() -> firstKeyword(text, expenseServices));
        if (service.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(ClassificationResult.builder()
                .category(Category.TRANSFER)
                .subcategory("external")
                .confidence(confidence)
                .method(MatchMethod.KEYWORD)
                .step(getStep())
                .weight(1.0)
                .riskLevel(RiskLevel.NONE)
                .lenderId(ctx.getLenderId())
                .matchedPattern(service.get())
                .reason("Credit from payment service or lender: " + service.get())
                .build());
    }
}
