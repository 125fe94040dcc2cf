package com.verticx.finance.fee;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Append-only entry of a student's fee ledger.
 */
public interface FeeHistoryItem {
    Long getStudentId();

    BigDecimal getAmount();

    LocalDate getDate();

    String getDescription();
}
