package com.verticx.finance.fee;

import java.math.BigDecimal;

/**
 * Per-month view of a fee record; derived on demand, never stored.
 */
public record MonthlyDue(String month, int year, BigDecimal total, BigDecimal paid, BigDecimal balance, DueStatus status) {
}
