package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

/**
 * A transaction paired with its classification. This is the audit record exposed to reviewers.
 */
@Value
@Schema(description = "A transaction with its classification, for audit")
public class ClassifiedTransaction {

    @Schema(description = "Position of the transaction in the submitted list", example = "0")
    int index;

    Transaction transaction;

    ClassificationResult classification;
}
