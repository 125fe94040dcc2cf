package com.verticx.finance.payroll.dto;

import java.util.List;

/**
 * Outcome of a payroll batch. Re-submitting the same batch moves every id into {@code alreadyPaid}.
 */
public record PayrollProcessResult(List<Long> processed, List<Long> alreadyPaid, List<Long> skipped) {
}
