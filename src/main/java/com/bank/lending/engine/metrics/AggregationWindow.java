package com.bank.lending.engine.metrics;

import com.bank.lending.model.ClassifiedTransaction;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

/**
 * Trailing window of whole calendar months ending with the month of the latest
 * dated transaction. Undated transactions always fall inside the window.
 */
final class AggregationWindow {

    private final LocalDate referenceDate;
    private final YearMonth firstMonth;
    private final YearMonth lastMonth;

    private AggregationWindow(LocalDate referenceDate, int lookbackMonths) {
        this.referenceDate = referenceDate;
        this.lastMonth = referenceDate == null ? null : YearMonth.from(referenceDate);
        this.firstMonth = referenceDate == null ? null : lastMonth.minusMonths(Math.max(1, lookbackMonths) - 1L);
    }

    static AggregationWindow of(List<ClassifiedTransaction> transactions, int lookbackMonths) {
        LocalDate latest = null;
        for (ClassifiedTransaction ct : transactions) {
            Optional<LocalDate> date = ct.getTransaction().getParsedDate();
            if (date.isPresent() && (latest == null || date.get().isAfter(latest))) {
                latest = date.get();
            }
        }
        return new AggregationWindow(latest, lookbackMonths);
    }

    boolean hasDates() {
        return referenceDate != null;
    }

    LocalDate getReferenceDate() {
        return referenceDate;
    }

    YearMonth getFirstMonth() {
        return firstMonth;
    }

    YearMonth getLastMonth() {
        return lastMonth;
    }

    boolean contains(ClassifiedTransaction ct) {
        Optional<LocalDate> date = ct.getTransaction().getParsedDate();
        if (date.isEmpty() || referenceDate == null) {
            return true;
        }
        YearMonth month = YearMonth.from(date.get());
        return !month.isBefore(firstMonth) && !month.isAfter(lastMonth);
    }

    /** True when the transaction is dated within the last {@code days} days up to the reference date. */
    boolean withinDays(ClassifiedTransaction ct, int days) {
        Optional<LocalDate> date = ct.getTransaction().getParsedDate();
        return date.isPresent() && referenceDate != null
                && !date.get().isBefore(referenceDate.minusDays(days));
    }
}
