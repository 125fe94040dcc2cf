package com.verticx.finance.payroll.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record LeaveApplicationRequest(@NotBlank String leaveType,
                                      String reason,
                                      @NotNull LocalDate startDate,
                                      @NotNull LocalDate endDate,
                                      boolean halfDay) {
}
