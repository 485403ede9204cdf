package com.bank.lending.engine.income;

import com.bank.lending.config.ClassificationConfig;
import com.bank.lending.config.ClassificationConfig.IntervalBand;
import com.bank.lending.engine.classification.ClassificationContext;
import com.bank.lending.engine.classification.PatternLibrary;
import com.bank.lending.engine.classification.PatternLibrary.IncomeSignals;
import com.bank.lending.engine.classification.TextNormalizer;
import com.bank.lending.model.FrequencyBand;
import com.bank.lending.model.IncomeVerdict;
import com.bank.lending.model.RecurringIncomeSource;
import com.bank.lending.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.bank.lending.engine.classification.PatternMatcher.firstKeyword;

/**
 * Decides whether a credit is probably income, even when its text or third-party
 * taxonomy suggests a transfer.
 *
 * Two phases:
 * 1. {@link #analyze(List)} searches the whole window once for recurring credit
 *    clusters (same amount within tolerance, regular cadence) and returns a
 *    {@link RecurrenceCache} scoped to that applicant.
 * 2. {@link #assess(ClassificationContext)} checks signals for one transaction in
 *    priority order: exclusion vocabulary, expense services and lenders, taxonomy,
 *    keywords, employer names, recurrence membership, large named credits.
 */
@Component
public class BehavioralIncomeDetector {

    private static final Logger log = LoggerFactory.getLogger(BehavioralIncomeDetector.class);

    private static final Set<FrequencyBand> SALARY_BANDS =
            Set.of(FrequencyBand.WEEKLY, FrequencyBand.FORTNIGHTLY, FrequencyBand.MONTHLY);

    private final TextNormalizer normalizer;
    private final IncomeSignals signals;
    private final List<String> expenseServices;
    private final List<String> passThroughKeywords;
    private final ClassificationConfig.IncomeDetection tuning;

    public BehavioralIncomeDetector(TextNormalizer normalizer,
                                    PatternLibrary library,
                                    ClassificationConfig config) {
        this.normalizer = normalizer;
        this.signals = library.getIncomeSignals();
        this.expenseServices = library.getExpenseServices();
        this.passThroughKeywords = library.getPassThroughKeywords();
        this.tuning = config.getIncomeDetection();
    }

    // ── Recurrence search ──

    /**
     * Find recurring income clusters across the full transaction list.
     * Quadratic in the number of candidate credits.
     */
    public RecurrenceCache analyze(List<Transaction> transactions) {
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < transactions.size(); i++) {
            Transaction txn = transactions.get(i);
            if (!txn.isCredit() || txn.getAbsoluteAmount() < tuning.getMinAmount()) {
                continue;
            }
            Optional<LocalDate> date = txn.getParsedDate();
            if (date.isEmpty()) {
                continue;
            }
            String text = normalizer.normalizeTransaction(txn);
            if (firstKeyword(text, signals.getExclusion()).isPresent()) {
                continue;
            }
            candidates.add(new Candidate(i, date.get(), txn.getAbsoluteAmount()));
        }

        candidates.sort(Comparator.comparing((Candidate c) -> c.date).thenComparingInt(c -> c.index));

        List<RecurringIncomeSource> sources = new ArrayList<>();
        Set<Integer> assigned = new HashSet<>();

        for (Candidate reference : candidates) {
            if (assigned.contains(reference.index)) {
                continue;
            }
            List<Candidate> members = new ArrayList<>();
            for (Candidate other : candidates) {
                if (assigned.contains(other.index)) continue;
                if (withinTolerance(other.amount, reference.amount)) {
                    members.add(other);
                }
            }

            Optional<RecurringIncomeSource> source = toSource(members);
            if (source.isPresent()) {
                sources.add(source.get());
                members.forEach(m -> assigned.add(m.index));
            } else {
                assigned.add(reference.index);
            }
        }

        log.debug("Recurrence search: {} candidate credits, {} recurring sources", candidates.size(), sources.size());
        return new RecurrenceCache(sources);
    }

    private Optional<RecurringIncomeSource> toSource(List<Candidate> members) {
        if (members.size() < Math.max(2, tuning.getMinOccurrences())) {
            return Optional.empty();
        }

        // Members are already in date order
        List<Long> intervals = new ArrayList<>();
        Map<FrequencyBand, Integer> bandCounts = new EnumMap<>(FrequencyBand.class);
        for (int i = 1; i < members.size(); i++) {
            long days = ChronoUnit.DAYS.between(members.get(i - 1).date, members.get(i).date);
            intervals.add(days);
            bandOf(days).ifPresent(band -> bandCounts.merge(band, 1, Integer::sum));
        }

        FrequencyBand modalBand = null;
        int modalCount = 0;
        for (Map.Entry<FrequencyBand, Integer> e : bandCounts.entrySet()) {
            if (e.getValue() > modalCount) {
                modalBand = e.getKey();
                modalCount = e.getValue();
            }
        }
        if (modalBand == null || (double) modalCount / intervals.size() < tuning.getMinBandShare()) {
            return Optional.empty();
        }

        double averageAmount = members.stream().mapToDouble(m -> m.amount).average().orElse(0.0);
        if (averageAmount <= 0) {
            return Optional.empty();
        }
        double spread = members.stream()
                .mapToDouble(m -> Math.abs(m.amount - averageAmount) / averageAmount)
                .max().orElse(0.0);
        double averageInterval = intervals.stream().mapToLong(Long::longValue).average().orElse(0.0);

        boolean dayConsistent = false;
        if (modalBand == FrequencyBand.MONTHLY) {
            double averageDay = members.stream().mapToInt(m -> m.date.getDayOfMonth()).average().orElse(0.0);
            double maxDeviation = members.stream()
                    .mapToDouble(m -> Math.abs(m.date.getDayOfMonth() - averageDay))
                    .max().orElse(0.0);
            dayConsistent = maxDeviation <= tuning.getDayOfMonthTolerance();
        }

        double confidence = Math.min(tuning.getMaxBaseConfidence(),
                tuning.getBaseConfidence() + tuning.getConfidencePerOccurrence() * members.size())
                * (1.0 - spread);
        if (dayConsistent && spread <= tuning.getTightAmountTolerance()) {
            confidence += tuning.getConsistentSalaryBonus();
        }
        confidence = Math.min(tuning.getMaxConfidence(), confidence);

        return Optional.of(RecurringIncomeSource.builder()
                .transactionIndexes(members.stream().map(m -> m.index).toList())
                .averageAmount(averageAmount)
                .amountSpread(spread)
                .band(modalBand)
                .averageIntervalDays(averageInterval)
                .dayOfMonthConsistent(dayConsistent)
                .confidence(confidence)
                .build());
    }

    private Optional<FrequencyBand> bandOf(long days) {
        for (IntervalBand band : tuning.getIntervalBands()) {
            if (band.contains(days)) {
                return Optional.of(band.getBand());
            }
        }
        return Optional.empty();
    }

    // ── Per-transaction verdict ──

    public IncomeVerdict assess(ClassificationContext ctx) {
        Transaction txn = ctx.getTransaction();
        if (!ctx.isCredit()) {
            return IncomeVerdict.notIncome(0.0, "Not a credit");
        }
        String text = ctx.getText();

        Optional<String> excluded = firstKeyword(text, signals.getExclusion());
        if (excluded.isPresent()) {
            return IncomeVerdict.notIncome(tuning.getExclusionConfidence(),
                    "Internal transfer or savings movement: " + excluded.get());
        }

        // (a) lenders never pay income; payment services only when it is not a payout
        Optional<String> provider = Optional.ofNullable(ctx.getLenderId())
                .or(() -> firstKeyword(text, signals.getLoan()));
        if (provider.isEmpty() && firstKeyword(text, passThroughKeywords).isEmpty()) {
            provider = firstKeyword(text, expenseServices);
        }
        if (provider.isPresent()) {
            return IncomeVerdict.notIncome(tuning.getExpenseServiceConfidence(),
                    "Expense service or lender: " + provider.get());
        }

        // (b) third-party taxonomy
        Optional<IncomeVerdict> taxonomy = taxonomyVerdict(ctx);
        if (taxonomy.isPresent()) {
            return taxonomy.get();
        }

        // (c) keyword signals
        Optional<String> keyword = firstKeyword(text, signals.getGig());
        if (keyword.isPresent()) {
            return IncomeVerdict.income(tuning.getGigConfidence(), "gig_economy", "Gig economy payout: " + keyword.get());
        }
        keyword = firstKeyword(text, signals.getPayroll());
        if (keyword.isPresent()) {
            return IncomeVerdict.income(tuning.getPayrollConfidence(), "salary", "Payroll keyword: " + keyword.get());
        }
        keyword = firstKeyword(text, signals.getBenefit());
        if (keyword.isPresent()) {
            return IncomeVerdict.income(tuning.getBenefitConfidence(), "benefits", "Benefit keyword: " + keyword.get());
        }
        keyword = firstKeyword(text, signals.getPension());
        if (keyword.isPresent()) {
            return IncomeVerdict.income(tuning.getPensionConfidence(), "pension", "Pension keyword: " + keyword.get());
        }

        // (d) employer-style payer name
        if (signals.getEmployerSuffix().matcher(text).find()
                && txn.getAbsoluteAmount() >= tuning.getEmployerMinAmount()) {
            return IncomeVerdict.income(tuning.getEmployerConfidence(), "salary",
                    String.format("Employer-style payer with amount %.2f", txn.getAbsoluteAmount()));
        }

        // (e) recurring source membership
        Optional<RecurringIncomeSource> source = ctx.getRecurrence().sourceFor(ctx.getIndex());
        if (source.isPresent()) {
            RecurringIncomeSource s = source.get();
            String subcategory = SALARY_BANDS.contains(s.getBand()) && s.getAverageAmount() >= tuning.getSalaryMinAmount()
                    ? "salary" : "other";
            return IncomeVerdict.income(s.getConfidence(), subcategory,
                    String.format("Recurring %s credit of ~%.2f (%d occurrences)",
                            s.getBand().name().toLowerCase(), s.getAverageAmount(), s.getOccurrences()));
        }

        // (f) large credit from a named payer
        if (txn.getAbsoluteAmount() >= tuning.getLargeCreditMinAmount()
                && payerWords(text) >= tuning.getLargeCreditMinPayerWords()) {
            return IncomeVerdict.income(tuning.getLargeCreditConfidence(), "other",
                    String.format("Large named credit of %.2f", txn.getAbsoluteAmount()));
        }

        // (g) taxonomy transfer-in with no income signal
        if (ctx.taxonomyDetailed().startsWith("TRANSFER_IN") || ctx.taxonomyPrimary().equals("TRANSFER_IN")) {
            return IncomeVerdict.notIncome(tuning.getTransferInConfidence(), "Transfer in without income signal");
        }
        return IncomeVerdict.notIncome(0.0, "No income signal");
    }

    private Optional<IncomeVerdict> taxonomyVerdict(ClassificationContext ctx) {
        String detailed = ctx.taxonomyDetailed();
        String primary = ctx.taxonomyPrimary();
        if (detailed.startsWith("INCOME_WAGES")) {
            return Optional.of(IncomeVerdict.income(tuning.getTaxonomyWagesConfidence(), "salary", "Taxonomy: wages"));
        }
        if (detailed.startsWith("INCOME_RETIREMENT_PENSION")) {
            return Optional.of(IncomeVerdict.income(tuning.getTaxonomyWagesConfidence(), "pension", "Taxonomy: retirement income"));
        }
        if (detailed.startsWith("INCOME_UNEMPLOYMENT")) {
            return Optional.of(IncomeVerdict.income(tuning.getTaxonomyWagesConfidence(), "benefits", "Taxonomy: unemployment benefit"));
        }
        if (detailed.startsWith("INCOME") || primary.startsWith("INCOME")) {
            return Optional.of(IncomeVerdict.income(tuning.getTaxonomyIncomeConfidence(), "other", "Taxonomy: income"));
        }
        return Optional.empty();
    }

    private int payerWords(String text) {
        int count = 0;
        for (String word : text.split(" ")) {
            if (word.length() > 3 && !signals.getGenericWords().contains(word) && word.chars().anyMatch(Character::isLetter)) {
                count++;
            }
        }
        return count;
    }

    // Compared in pence so a pair exactly at the tolerance boundary still clusters
    private boolean withinTolerance(double amount, double reference) {
        long difference = Math.abs(Math.round(amount * 100.0) - Math.round(reference * 100.0));
        return difference <= Math.round(tuning.getAmountTolerance() * Math.round(reference * 100.0));
    }

    private static final class Candidate {
        private final int index;
        private final LocalDate date;
        private final double amount;

        private Candidate(int index, LocalDate date, double amount) {
            this.index = index;
            this.date = date;
            this.amount = amount;
        }
    }
}
