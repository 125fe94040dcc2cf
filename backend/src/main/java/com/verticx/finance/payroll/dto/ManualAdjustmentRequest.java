package com.verticx.finance.payroll.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.math.BigDecimal;

public record ManualAdjustmentRequest(@NotNull Long staffId,
                                      @NotBlank @Pattern(regexp = "\\d{4}-\\d{2}") String month,
                                      @NotNull BigDecimal amount,
                                      @NotBlank String reason) {
}
