package com.bank.lending.engine.classification;

import com.bank.lending.model.ClassificationResult;
import com.bank.lending.model.ClassificationStep;

import java.util.Optional;

/**
 * One step of the classification chain.
 * Each implementation handles a specific {@link ClassificationStep}.
 */
public interface TransactionMatcher {

    /**
     * The chain step this matcher implements.
     */
    ClassificationStep getStep();

    /**
     * Classify the transaction, or return empty to pass it to the next step.
     * The last step must always return a result.
     */
    Optional<ClassificationResult> match(ClassificationContext ctx);
}
