package com.verticx.finance.payroll.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ProcessPayrollRequest(@NotNull Long branchId, @NotEmpty List<Long> recordIds) {
}
