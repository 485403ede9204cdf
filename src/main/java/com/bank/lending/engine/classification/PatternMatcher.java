package com.bank.lending.engine.classification;

import com.bank.lending.config.ClassificationConfig;
import com.bank.lending.engine.classification.PatternLibrary.PatternEntry;
import com.bank.lending.model.MatchMethod;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores normalized text against a pattern entry.
 * Order: keyword containment, then regex, then fuzzy similarity, else no match.
 */
@Component
public class PatternMatcher {

    private final ClassificationConfig.Matching matching;

    public PatternMatcher(ClassificationConfig config) {
        this.matching = config.getMatching();
    }

    public MatchOutcome match(String text, PatternEntry entry) {
        if (text == null || text.isEmpty()) {
            return MatchOutcome.none();
        }

        Optional<String> keyword = firstKeyword(text, entry.getKeywords());
        if (keyword.isPresent()) {
            return new MatchOutcome(MatchMethod.KEYWORD, entry.getKeywordConfidence(), keyword.get());
        }

        for (Pattern regex : entry.getRegexes()) {
            Matcher m = regex.matcher(text);
            if (m.find()) {
                return new MatchOutcome(MatchMethod.REGEX, entry.getRegexConfidence(), regex.pattern());
            }
        }

        return fuzzy(text, entry.getKeywords());
    }

    private MatchOutcome fuzzy(String text, List<String> keywords) {
        String[] tokens = text.split(" ");
        double bestSimilarity = 0.0;
        String bestKeyword = null;

        for (String keyword : keywords) {
            if (keyword.length() < matching.getFuzzyMinKeywordLength()) {
                continue;
            }
            int window = keyword.split(" ").length;
            for (int start = 0; start + window <= tokens.length; start++) {
                String candidate = String.join(" ", Arrays.copyOfRange(tokens, start, start + window));
                double similarity = TextSimilarity.ratio(candidate, keyword);
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    bestKeyword = keyword;
                }
            }
        }

        if (bestKeyword == null || bestSimilarity < matching.getFuzzyThreshold()) {
            return MatchOutcome.none();
        }
        double confidence = matching.getFuzzyBaseConfidence() * (bestSimilarity / 100.0);
        return new MatchOutcome(MatchMethod.FUZZY, confidence, bestKeyword);
    }

    /**
     * First keyword contained in the text as a whole token sequence.
     */
    public static Optional<String> firstKeyword(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (containsKeyword(text, keyword)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }

    public static boolean containsAny(String text, List<String> keywords) {
        return firstKeyword(text, keywords).isPresent();
    }

    /**
     * Substring containment that will not match inside a longer word:
     * "UC" matches "UC PAYMENT" but not "TRUCK". Boundaries are only enforced
     * on sides where the keyword itself starts or ends with a word character.
     */
    public static boolean containsKeyword(String text, String keyword) {
        if (keyword.isEmpty()) return false;
        boolean checkStart = isWordChar(keyword.charAt(0));
        boolean checkEnd = isWordChar(keyword.charAt(keyword.length() - 1));

        int from = 0;
        while (true) {
            int idx = text.indexOf(keyword, from);
            if (idx < 0) return false;
            int end = idx + keyword.length();
            boolean startOk = !checkStart || idx == 0 || !isWordChar(text.charAt(idx - 1));
            boolean endOk = !checkEnd || end == text.length() || !isWordChar(text.charAt(end));
            if (startOk && endOk) return true;
            from = idx + 1;
        }
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
