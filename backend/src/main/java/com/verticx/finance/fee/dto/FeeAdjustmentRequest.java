package com.verticx.finance.fee.dto;

import com.verticx.finance.fee.FeeAdjustment;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record FeeAdjustmentRequest(@NotNull FeeAdjustment.Type type,
                                   @NotNull @Positive BigDecimal amount,
                                   @NotBlank String reason) {
}
