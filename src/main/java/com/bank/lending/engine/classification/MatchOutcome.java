package com.bank.lending.engine.classification;

import com.bank.lending.model.MatchMethod;
import lombok.Value;

/**
 * Result of scoring text against one pattern entry. A null method means no match.
 */
@Value
public class MatchOutcome {

    private static final MatchOutcome NONE = new MatchOutcome(null, 0.0, null);

    MatchMethod method;
    double confidence;
    String matchedTerm;

    public static MatchOutcome none() {
        return NONE;
    }

    public boolean isMatch() {
        return method != null;
    }
}
