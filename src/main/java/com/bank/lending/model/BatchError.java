package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@Schema(description = "Failure of a single application within a batch")
public class BatchError {

    public enum ErrorType {
        DATA_VALIDATION_ERROR,
        PROCESSING_ERROR,
        TIMEOUT
    }

    @Schema(description = "Application reference", example = "APP-000124")
    String applicationRef;

    @Schema(description = "Kind of failure", example = "DATA_VALIDATION_ERROR")
    ErrorType errorType;

    @Schema(description = "Failure detail", example = "Application has no transactions")
    String message;
}
