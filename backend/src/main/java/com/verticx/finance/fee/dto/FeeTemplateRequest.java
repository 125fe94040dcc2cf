package com.verticx.finance.fee.dto;

import com.verticx.finance.fee.MonthlyFee;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.List;

public record FeeTemplateRequest(@NotNull Long branchId,
                                 @NotBlank String name,
                                 @Min(0) int gradeLevel,
                                 @NotNull @PositiveOrZero BigDecimal amount,
                                 List<MonthlyFee> monthlyBreakdown) {
}
