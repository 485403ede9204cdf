package com.bank.lending.engine.classification;

import com.bank.lending.config.EngineConfigurationException;
import com.bank.lending.config.MetricsConfig;
import com.bank.lending.engine.income.BehavioralIncomeDetector;
import com.bank.lending.engine.income.RecurrenceCache;
import com.bank.lending.model.ClassificationResult;
import com.bank.lending.model.ClassificationStep;
import com.bank.lending.model.ClassifiedTransaction;
import com.bank.lending.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies transactions through an ordered chain of matchers.
 * Uses the Strategy pattern: each {@link ClassificationStep} is handled by a registered
 * {@link TransactionMatcher}, and the steps always run in declaration order.
 */
@Component
public class TransactionClassifier {

    private static final Logger log = LoggerFactory.getLogger(TransactionClassifier.class);

    private final Map<ClassificationStep, TransactionMatcher> matcherMap;
    private final TextNormalizer normalizer;
    private final BehavioralIncomeDetector incomeDetector;
    private final MetricsConfig metricsConfig;

    public TransactionClassifier(List<TransactionMatcher> matchers,
                                 TextNormalizer normalizer,
                                 BehavioralIncomeDetector incomeDetector,
                                 MetricsConfig metricsConfig) {
        this.matcherMap = new EnumMap<>(ClassificationStep.class);
        this.normalizer = normalizer;
        this.incomeDetector = incomeDetector;
        this.metricsConfig = metricsConfig;

        // Auto-register all matcher implementations
        List<String> problems = new ArrayList<>();
        for (TransactionMatcher matcher : matchers) {
            TransactionMatcher previous = matcherMap.put(matcher.getStep(), matcher);
            if (previous != null) {
                problems.add("Two matchers registered for step " + matcher.getStep() + ": "
                        + previous.getClass().getSimpleName() + ", " + matcher.getClass().getSimpleName());
            }
            log.info("Registered transaction matcher: {} -> {}",
                    matcher.getStep(), matcher.getClass().getSimpleName());
        }
        for (ClassificationStep step : ClassificationStep.values()) {
            if (!matcherMap.containsKey(step)) {
                problems.add("No matcher registered for step " + step);
            }
        }
        if (!problems.isEmpty()) {
            throw new EngineConfigurationException(problems);
        }
    }

    /**
     * Classify one applicant's transactions. The recurrence search runs once over the
     * whole list and its cache lives only for this call.
     *
     * @return one classification per input transaction, in input order
     */
    public List<ClassifiedTransaction> classifyAll(List<Transaction> transactions) {
        RecurrenceCache recurrence = incomeDetector.analyze(transactions);

        List<ClassifiedTransaction> results = new ArrayList<>(transactions.size());
        Map<ClassificationStep, Integer> stepCounts = new EnumMap<>(ClassificationStep.class);
        for (int i = 0; i < transactions.size(); i++) {
            ClassificationResult result = classify(i, transactions.get(i), recurrence);
            results.add(new ClassifiedTransaction(i, transactions.get(i), result));
            stepCounts.merge(result.getStep(), 1, Integer::sum);
        }

        stepCounts.forEach((step, count) -> metricsConfig.recordClassification(step.name(), count));
        return results;
    }

    /**
     * Classify a single transaction without recurrence context.
     */
    public ClassificationResult classify(Transaction txn) {
        return classify(0, txn, RecurrenceCache.empty());
    }

    private ClassificationResult classify(int index, Transaction txn, RecurrenceCache recurrence) {
        String text = normalizer.normalizeTransaction(txn);
        ClassificationContext ctx = ClassificationContext.builder()
                .index(index)
                .transaction(txn)
                .text(text)
                .lenderId(normalizer.canonicalLender(text).orElse(null))
                .recurrence(recurrence)
                .build();

        if (!txn.hasValidAmount()) {
            log.warn("Transaction {} ('{}') has no usable amount; classified as unclassified",
                    txn.getTransactionId(), txn.getDescription());
            return terminal(matcherMap.get(ClassificationStep.FALLBACK), ctx);
        }

        for (ClassificationStep step : ClassificationStep.values()) {
            Optional<ClassificationResult> result = matcherMap.get(step).match(ctx);
            if (result.isPresent()) {
                log.debug("Classified '{}' at {} as {}/{} ({}, confidence={})",
                        text, step, result.get().getCategory(), result.get().getSubcategory(),
                        result.get().getMethod(), result.get().getConfidence());
                return result.get();
            }
        }
        throw new IllegalStateException("Fallback matcher did not classify '" + text + "'");
    }

    private static ClassificationResult terminal(TransactionMatcher fallback, ClassificationContext ctx) {
        return fallback.match(ctx)
                .orElseThrow(() -> new IllegalStateException("Fallback matcher did not classify a malformed record"));
    }
}
