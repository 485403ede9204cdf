package com.bank.lending.engine.metrics;

import com.bank.lending.config.AggregationConfig;
import com.bank.lending.config.AggregationConfig.RegularityTier;
import com.bank.lending.config.AssessmentConfig;
import com.bank.lending.config.ProductConfig;
import com.bank.lending.engine.classification.TextNormalizer;
import com.bank.lending.engine.decision.RepaymentCalculator;
import com.bank.lending.model.AffordabilityMetrics;
import com.bank.lending.model.BalanceMetrics;
import com.bank.lending.model.Category;
import com.bank.lending.model.ClassificationResult;
import com.bank.lending.model.ClassifiedTransaction;
import com.bank.lending.model.DebtMetrics;
import com.bank.lending.model.ExpenseMetrics;
import com.bank.lending.model.IncomeMetrics;
import com.bank.lending.model.LoanRequest;
import com.bank.lending.model.MetricsBundle;
import com.bank.lending.model.RiskMetrics;
import com.bank.lending.model.Transaction;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Turns classified transactions into the six metric groups the decision engine reads.
 *
 * Monetary totals cover the trailing calendar-month window and are divided by the
 * months of data actually seen in it. Counting windows (90-day lenders, 45-day failed
 * payments, and so on) run back from the latest transaction date. "All time" figures
 * use every transaction supplied.
 */
@Component
public class MetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    private static final Set<String> STABLE_SUBCATEGORIES = Set.of("salary", "benefits", "pension");
    private static final String GIG = "gig_economy";
    private static final String HCSTC = "hcstc";
    // Tokens carrying a digit, plus the words that introduce them
    private static final Pattern REFERENCE_TOKENS =
            Pattern.compile("(?<![A-Z0-9_])(?:\\S*\\d\\S*|REF(?:ERENCE)?:?|NO\\.)(?![A-Z0-9_])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final AggregationConfig config;
    private final ProductConfig product;
    private final AssessmentConfig assessment;
    private final RepaymentCalculator calculator;
    private final TextNormalizer normalizer;

    public MetricsAggregator(AggregationConfig config,
                             ProductConfig product,
                             AssessmentConfig assessment,
                             RepaymentCalculator calculator,
                             TextNormalizer normalizer) {
        this.config = config;
        this.product = product;
        this.assessment = assessment;
        this.calculator = calculator;
        this.normalizer = normalizer;
    }

    /**
     * Distinct calendar months covered by the dated transactions inside the trailing window.
     * Never less than 1.
     */
    public int countMonthsOfData(List<ClassifiedTransaction> classified) {
        AggregationWindow window = AggregationWindow.of(classified, config.getLookbackMonths());
        Set<YearMonth> months = new HashSet<>();
        for (ClassifiedTransaction ct : classified) {
            Optional<LocalDate> date = ct.getTransaction().getParsedDate();
            if (date.isPresent() && window.contains(ct)) {
                months.add(YearMonth.from(date.get()));
            }
        }
        return Math.max(1, months.size());
    }

    public MetricsBundle aggregate(List<ClassifiedTransaction> classified, int monthsOfData) {
        return aggregate(classified, monthsOfData,
                new LoanRequest(assessment.getDefaultLoanAmount(), assessment.getDefaultLoanTerm()), null);
    }

    public MetricsBundle aggregate(List<ClassifiedTransaction> classified, int monthsOfData,
                                   LoanRequest loanRequest, Double currentBalance) {
        int months = Math.max(1, monthsOfData);
        AggregationWindow window = AggregationWindow.of(classified, config.getLookbackMonths());

        List<ClassifiedTransaction> windowed = new ArrayList<>();
        for (ClassifiedTransaction ct : classified) {
            if (window.contains(ct)) {
                windowed.add(ct);
            }
        }

        double totalIncome = weightedIncome(windowed);
        IncomeMetrics income = incomeMetrics(windowed, window, months, totalIncome);
        ExpenseMetrics expense = expenseMetrics(windowed, months);
        DebtMetrics debt = debtMetrics(classified, windowed, window, months);
        AffordabilityMetrics affordability = affordabilityMetrics(income, expense, debt, loanRequest);
        BalanceMetrics balance = balanceMetrics(classified, currentBalance == null ? 0.0 : currentBalance);
        RiskMetrics risk = riskMetrics(classified, windowed, window, totalIncome);

        log.debug("Aggregated {} transactions ({} in window) over {} months: income={}, essential={}, debt={}",
                classified.size(), windowed.size(), months,
                income.getMonthlyIncome(), expense.getMonthlyEssential(), debt.getMonthlyDebtPayments());

        return MetricsBundle.builder()
                .monthsOfData(months)
                .income(income)
                .expense(expense)
                .debt(debt)
                .affordability(affordability)
                .balance(balance)
                .risk(risk)
                .build();
    }

    // ── Income ──

    private IncomeMetrics incomeMetrics(List<ClassifiedTransaction> windowed, AggregationWindow window,
                                        int months, double totalIncome) {
        double stable = 0.0;
        double gig = 0.0;
        boolean verified = false;

        for (ClassifiedTransaction ct : windowed) {
            if (!isIncomeCredit(ct)) continue;
            ClassificationResult c = ct.getClassification();
            double weighted = weighted(ct);
            if (STABLE_SUBCATEGORIES.contains(c.getSubcategory())) {
                stable += weighted;
                if (c.getWeight() > 0) {
                    verified = true;
                }
            } else if (GIG.equals(c.getSubcategory())) {
                gig += weighted;
            }
        }

        double monthlyIncome = totalIncome / months;
        double monthlyStable = stable / months;
        double monthlyGig = gig / months;

        return IncomeMetrics.builder()
                .monthlyIncome(round2(monthlyIncome))
                .monthlyStableIncome(round2(monthlyStable))
                .monthlyGigIncome(round2(monthlyGig))
                .monthlyOtherIncome(round2(Math.max(0.0, monthlyIncome - monthlyStable - monthlyGig)))
                .stabilityScore(round1(stabilityScore(windowed, window)))
                .regularityScore(regularityScore(windowed))
                .verified(verified)
                .build();
    }

    /**
     * 100 minus the coefficient of variation (as a percentage) of monthly weighted income,
     * taken over every month from the first income month to the reference month. Months
     * with no income count as zero.
     */
    private double stabilityScore(List<ClassifiedTransaction> windowed, AggregationWindow window) {
        if (!window.hasDates()) {
            return 0.0;
        }
        TreeMap<YearMonth, Double> byMonth = new TreeMap<>();
        for (ClassifiedTransaction ct : windowed) {
            Optional<LocalDate> date = ct.getTransaction().getParsedDate();
            if (date.isEmpty() || !isIncomeCredit(ct)) continue;
            byMonth.merge(YearMonth.from(date.get()), weighted(ct), Double::sum);
        }
        if (byMonth.isEmpty()) {
            return 0.0;
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (YearMonth m = byMonth.firstKey(); !m.isAfter(window.getLastMonth()); m = m.plusMonths(1)) {
            stats.addValue(byMonth.getOrDefault(m, 0.0));
        }
        if (stats.getN() < 2 || stats.getMean() <= 0) {
            return 0.0;
        }
        double cv = stats.getStandardDeviation() / stats.getMean() * 100.0;
        return Math.max(0.0, Math.min(100.0, 100.0 - cv));
    }

    private double regularityScore(List<ClassifiedTransaction> windowed) {
        DescriptiveStatistics days = new DescriptiveStatistics();
        for (ClassifiedTransaction ct : windowed) {
            Optional<LocalDate> date = ct.getTransaction().getParsedDate();
            if (date.isEmpty() || !isIncomeCredit(ct)) continue;
            if (ct.getClassification().getWeight() <= 0
                    || ct.getTransaction().getAbsoluteAmount() < config.getRegularityMinAmount()) continue;
            days.addValue(date.get().getDayOfMonth());
        }
        if (days.getN() < 2) {
            return 0.0;
        }
        double stdDev = days.getStandardDeviation();
        for (RegularityTier tier : config.getRegularityTiers()) {
            if (stdDev <= tier.getMaxStdDev()) {
                return tier.getScore();
            }
        }
        return config.getRegularityFloorScore();
    }

    // ── Expenses and debt ──

    private ExpenseMetrics expenseMetrics(List<ClassifiedTransaction> windowed, int months) {
        double rent = 0.0;
        double mortgage = 0.0;
        double otherEssential = 0.0;
        double discretionary = 0.0;

        for (ClassifiedTransaction ct : windowed) {
            if (ct.getTransaction().isCredit()) continue;
            ClassificationResult c = ct.getClassification();
            double amount = ct.getTransaction().getAbsoluteAmount();
            switch (c.getCategory()) {
                case ESSENTIAL:
                    if ("rent".equals(c.getSubcategory())) {
                        rent += amount;
                    } else if ("mortgage".equals(c.getSubcategory())) {
                        mortgage += amount;
                    } else {
                        otherEssential += amount;
                    }
                    break;
                case EXPENSE:
                case OTHER:
                    discretionary += amount;
                    break;
                default:
                    break;
            }
        }

        // Housing counts once: the larger of rent and mortgage
        double housing = Math.max(rent, mortgage);
        return ExpenseMetrics.builder()
                .monthlyEssential(round2((housing + otherEssential) / months))
                .monthlyHousing(round2(housing / months))
                .monthlyDiscretionary(round2(discretionary / months))
                .build();
    }

    private DebtMetrics debtMetrics(List<ClassifiedTransaction> all, List<ClassifiedTransaction> windowed,
                                    AggregationWindow window, int months) {
        double debtTotal = 0.0;
        double hcstcTotal = 0.0;
        for (ClassifiedTransaction ct : windowed) {
            if (!isDebtPayment(ct)) continue;
            double amount = ct.getTransaction().getAbsoluteAmount();
            debtTotal += amount;
            if (HCSTC.equals(ct.getClassification().getSubcategory())) {
                hcstcTotal += amount;
            }
        }

        Set<String> lendersAllTime = new HashSet<>();
        Set<String> lenders90d = new HashSet<>();
        for (ClassifiedTransaction ct : all) {
            if (!isDebtPayment(ct) || !HCSTC.equals(ct.getClassification().getSubcategory())) continue;
            String lender = providerKey(ct);
            lendersAllTime.add(lender);
            if (window.withinDays(ct, config.getHcstcLookbackDays())) {
                lenders90d.add(lender);
            }
        }

        Set<String> agencies = new HashSet<>();
        for (ClassifiedTransaction ct : all) {
            ClassificationResult c = ct.getClassification();
            if (c.getCategory() == Category.RISK && "debt_collection".equals(c.getSubcategory())) {
                agencies.add(providerKey(ct));
            }
        }

        return DebtMetrics.builder()
                .monthlyDebtPayments(round2(debtTotal / months))
                .monthlyHcstcPayments(round2(hcstcTotal / months))
                .activeHcstcLenders90d(lenders90d.size())
                .activeHcstcLendersAllTime(lendersAllTime.size())
                .debtCollectionAgencies(agencies.size())
                .build();
    }

    // ── Affordability ──

    private AffordabilityMetrics affordabilityMetrics(IncomeMetrics income, ExpenseMetrics expense,
                                                      DebtMetrics debt, LoanRequest loanRequest) {
        double monthlyIncome = income.getMonthlyIncome();
        double essential = expense.getMonthlyEssential();
        double debtPayments = debt.getMonthlyDebtPayments();

        double disposable = monthlyIncome - essential - debtPayments;
        double stressed = monthlyIncome - essential * product.getExpenseShockBuffer() - debtPayments;
        double repayment = calculator.monthlyRepayment(loanRequest.getAmount(), loanRequest.getTermMonths());

        // Zero income gives a 0 sentinel; the scoring tables treat it as the worst band
        double dti = monthlyIncome > 0 ? debtPayments / monthlyIncome * 100.0 : 0.0;
        double projectedDti = monthlyIncome > 0 ? (debtPayments + repayment) / monthlyIncome * 100.0 : 0.0;

        return AffordabilityMetrics.builder()
                .monthlyDisposable(round2(disposable))
                .stressedDisposable(round2(stressed))
                .proposedRepayment(round2(repayment))
                .postLoanDisposable(round2(stressed - repayment))
                .debtToIncomeRatio(round1(dti))
                .projectedDebtToIncomeRatio(round1(projectedDti))
                .maxAffordableAmount(round2(calculator.maxAffordablePrincipal(stressed, loanRequest.getTermMonths())))
                .build();
    }

    // ── Balance ──

    /**
     * Rebuilds end-of-day balances by walking backwards from the current balance:
     * the balance before a transaction is the balance after it plus its signed amount.
     */
    private BalanceMetrics balanceMetrics(List<ClassifiedTransaction> all, double currentBalance) {
        List<ClassifiedTransaction> dated = new ArrayList<>();
        for (ClassifiedTransaction ct : all) {
            if (ct.getTransaction().getParsedDate().isPresent() && ct.getTransaction().hasValidAmount()) {
                dated.add(ct);
            }
        }
        if (dated.isEmpty()) {
            return BalanceMetrics.builder()
                    .averageBalance(round2(currentBalance))
                    .minimumBalance(round2(currentBalance))
                    .daysInOverdraft(currentBalance < 0 ? 1 : 0)
                    .overdraftEntries(0)
                    .build();
        }

        dated.sort(Comparator.comparing((ClassifiedTransaction ct) -> ct.getTransaction().getParsedDate().get())
                .thenComparingInt(ClassifiedTransaction::getIndex)
                .reversed());

        Map<LocalDate, Double> endOfDay = new LinkedHashMap<>();
        double running = currentBalance;
        for (ClassifiedTransaction ct : dated) {
            LocalDate date = ct.getTransaction().getParsedDate().get();
            endOfDay.putIfAbsent(date, running);
            running += ct.getTransaction().getAmount();
        }

        List<Double> chronological = new ArrayList<>(endOfDay.values());
        Collections.reverse(chronological);

        DescriptiveStatistics stats = new DescriptiveStatistics();
        int daysNegative = 0;
        int entries = 0;
        Double previous = null;
        for (double balance : chronological) {
            stats.addValue(balance);
            if (balance < 0) {
                daysNegative++;
                if (previous == null || previous >= 0) {
                    entries++;
                }
            }
            previous = balance;
        }

        return BalanceMetrics.builder()
                .averageBalance(round2(stats.getMean()))
                .minimumBalance(round2(stats.getMin()))
                .daysInOverdraft(daysNegative)
                .overdraftEntries(entries)
                .build();
    }

    // ── Risk ──

    private RiskMetrics riskMetrics(List<ClassifiedTransaction> all, List<ClassifiedTransaction> windowed,
                                    AggregationWindow window, double totalIncome) {
        double gamblingTotal = 0.0;
        for (ClassifiedTransaction ct : windowed) {
            if (isRisk(ct, "gambling") && !ct.getTransaction().isCredit()) {
                gamblingTotal += ct.getTransaction().getAbsoluteAmount();
            }
        }
        double gamblingPct;
        if (totalIncome > 0) {
            gamblingPct = gamblingTotal / totalIncome * 100.0;
        } else {
            gamblingPct = gamblingTotal > 0 ? 100.0 : 0.0;
        }

        int failedAll = 0;
        int failedRecent = 0;
        int chargesAll = 0;
        int chargesRecent = 0;
        for (ClassifiedTransaction ct : all) {
            if (isRisk(ct, "failed_payments")) {
                failedAll++;
                if (window.withinDays(ct, config.getFailedPaymentLookbackDays())) failedRecent++;
            } else if (isRisk(ct, "bank_charges")) {
                chargesAll++;
                if (window.withinDays(ct, config.getBankChargeLookbackDays())) chargesRecent++;
            }
        }

        return RiskMetrics.builder()
                .gamblingPercentage(round1(gamblingPct))
                .gamblingTotal(round2(gamblingTotal))
                .failedPayments45d(failedRecent)
                .failedPaymentsAllTime(failedAll)
                .bankCharges90d(chargesRecent)
                .bankChargesAllTime(chargesAll)
                .newCreditProviders90d(newCreditProviders(all, window))
                .build();
    }

    private int newCreditProviders(List<ClassifiedTransaction> all, AggregationWindow window) {
        if (!window.hasDates()) {
            return 0;
        }
        Map<String, LocalDate> firstSeen = new HashMap<>();
        for (ClassifiedTransaction ct : all) {
            if (!isDebtPayment(ct) || !HCSTC.equals(ct.getClassification().getSubcategory())) continue;
            Optional<LocalDate> date = ct.getTransaction().getParsedDate();
            if (date.isEmpty()) continue;
            firstSeen.merge(providerKey(ct), date.get(), (a, b) -> a.isBefore(b) ? a : b);
        }
        LocalDate cutoff = window.getReferenceDate().minusDays(config.getNewCreditLookbackDays());
        return (int) firstSeen.values().stream().filter(d -> !d.isBefore(cutoff)).count();
    }

    // ── Helpers ──

    private double weightedIncome(List<ClassifiedTransaction> windowed) {
        double total = 0.0;
        for (ClassifiedTransaction ct : windowed) {
            if (isIncomeCredit(ct)) {
                total += weighted(ct);
            }
        }
        return total;
    }

    private static boolean isIncomeCredit(ClassifiedTransaction ct) {
        return ct.getClassification().isIncome() && ct.getTransaction().isCredit();
    }

    private static boolean isDebtPayment(ClassifiedTransaction ct) {
        return ct.getClassification().getCategory() == Category.DEBT && !ct.getTransaction().isCredit()
                && ct.getTransaction().hasValidAmount();
    }

    private static boolean isRisk(ClassifiedTransaction ct, String subcategory) {
        return ct.getClassification().getCategory() == Category.RISK
                && subcategory.equals(ct.getClassification().getSubcategory());
    }

    private static double weighted(ClassifiedTransaction ct) {
        return ct.getTransaction().getAbsoluteAmount() * ct.getClassification().getWeight();
    }

    /**
     * Identifies the counterparty of a debt or collection payment: the canonical lender id
     * when known, otherwise the normalized description (or merchant name when the description
     * is blank) with reference numbers removed.
     */
    String providerKey(ClassifiedTransaction ct) {
        if (ct.getClassification().getLenderId() != null) {
            return ct.getClassification().getLenderId();
        }
        Transaction txn = ct.getTransaction();
        String text = normalizer.normalize(txn.getDescription());
        if (text.isEmpty()) {
            text = normalizer.normalize(txn.getMerchantName());
        }
        String key = WHITESPACE.matcher(REFERENCE_TOKENS.matcher(text).replaceAll(" ")).replaceAll(" ").trim();
        return key.isEmpty() ? text : key;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
