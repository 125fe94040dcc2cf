package com.verticx.finance.payroll.dto;

import jakarta.validation.constraints.NotNull;

public record LeaveReviewRequest(@NotNull Boolean approve) {
}
