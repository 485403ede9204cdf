package com.bank.lending.engine.classification;

import com.bank.lending.model.Transaction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes free-text transaction descriptions and folds known high-cost lender
 * spellings into one canonical token (e.g. "LENDING STREAM" and "LENDINGSTREAM"
 * both become "LENDING_STREAM"). Pure and total: null input yields "".
 */
@Component
public class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String TOKEN_START = "(?<![A-Z0-9_])";
    private static final String TOKEN_END = "(?![A-Z0-9_])";

    private final List<Alias> aliases = new ArrayList<>();
    private final Map<String, Pattern> canonicalTokens = new LinkedHashMap<>();

    public TextNormalizer(PatternLibrary library) {
        // Library aliases are already ordered longest first
        for (Map.Entry<String, String> e : library.getLenderAliases().entrySet()) {
            Pattern pattern = Pattern.compile(TOKEN_START + Pattern.quote(e.getKey()) + TOKEN_END);
            aliases.add(new Alias(pattern, Matcher.quoteReplacement(e.getValue())));
            canonicalTokens.computeIfAbsent(e.getValue(),
                    token -> Pattern.compile(TOKEN_START + Pattern.quote(token) + TOKEN_END));
        }
    }

    /**
     * Uppercase, trim, collapse whitespace, then canonicalize lender names.
     */
    public String normalize(String raw) {
        String text = clean(raw);
        if (text.isEmpty()) {
            return text;
        }
        for (Alias alias : aliases) {
            text = alias.pattern.matcher(text).replaceAll(alias.replacement);
        }
        return text;
    }

    /**
     * Normalized description followed by the merchant name, when present.
     */
    public String normalizeTransaction(Transaction txn) {
        String description = txn.getDescription() == null ? "" : txn.getDescription();
        String merchant = txn.getMerchantName() == null ? "" : txn.getMerchantName();
        return normalize(description + " " + merchant);
    }

    /**
     * Uppercase, trim and collapse whitespace only.
     */
    public String clean(String raw) {
        if (raw == null) {
            return "";
        }
        return WHITESPACE.matcher(raw.trim()).replaceAll(" ").toUpperCase(Locale.ROOT);
    }

    /**
     * Canonical lender id present in already-normalized text, if any.
     */
    public Optional<String> canonicalLender(String normalizedText) {
        if (normalizedText == null || normalizedText.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<String, Pattern> e : canonicalTokens.entrySet()) {
            if (e.getValue().matcher(normalizedText).find()) {
                return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    private static final class Alias {
        private final Pattern pattern;
        private final String replacement;

        private Alias(Pattern pattern, String replacement) {
            this.pattern = pattern;
            this.replacement = replacement;
        }
    }
}
