package com.bank.lending.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A bank transaction from the applicant's account history")
public class Transaction {

    @Schema(description = "Optional transaction identifier, echoed back in the classification audit", example = "TXN-000123")
    private String transactionId;

    @Schema(description = "Booking date (ISO yyyy-MM-dd). Malformed dates are tolerated.", example = "2025-03-25")
    private String date;

    @Schema(description = "Signed amount: negative = money in (credit), positive = money out (debit). "
            + "A value that is not a number is read as missing and the record classified as OTHER.", example = "-2500.00")
    @JsonDeserialize(using = LenientAmountDeserializer.class)
    private Double amount;

    @Schema(description = "Free-text description as supplied by the bank", example = "BANK GIRO CREDIT ACME CORP")
    private String description;

    @Schema(description = "Optional merchant name", example = "ACME CORP")
    private String merchantName;

    @Schema(description = "Optional third-party taxonomy primary category", example = "INCOME")
    private String taxonomyPrimary;

    @Schema(description = "Optional third-party taxonomy detailed category", example = "INCOME_WAGES")
    private String taxonomyDetailed;

    /**
     * Parses the booking date. Accepts plain ISO dates and ISO date-times (time part ignored).
     * Returns empty for missing or malformed dates.
     */
    @JsonIgnore
    public Optional<LocalDate> getParsedDate() {
        if (date == null || date.isBlank()) return Optional.empty();
        String trimmed = date.trim();
        if (trimmed.length() > 10) {
            trimmed = trimmed.substring(0, 10);
        }
        try {
            return Optional.of(LocalDate.parse(trimmed));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    @JsonIgnore
    public boolean hasValidAmount() {
        return amount != null && !amount.isNaN() && !amount.isInfinite();
    }

    @JsonIgnore
    public Direction getDirection() {
        return hasValidAmount() && amount < 0 ? Direction.CREDIT : Direction.DEBIT;
    }

    @JsonIgnore
    public boolean isCredit() {
        return hasValidAmount() && amount < 0;
    }

    @JsonIgnore
    public double getAbsoluteAmount() {
        return hasValidAmount() ? Math.abs(amount) : 0.0;
    }
}
