package com.verticx.finance.fee.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record RecordPaymentRequest(@NotNull @Positive BigDecimal amount,
                                   @NotBlank String transactionId,
                                   String details) {
}
