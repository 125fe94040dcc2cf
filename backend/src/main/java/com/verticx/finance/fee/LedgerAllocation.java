package com.verticx.finance.fee;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of reducing a cumulative paid amount over previous-session dues and monthly dues.
 *
 * @param previousDuesPaid portion of the paid amount absorbed by previous-session arrears
 * @param monthlyDues      one entry per session month, in session order
 * @param unallocated      paid amount left once every due is covered
 */
public record LedgerAllocation(BigDecimal previousDuesPaid, List<MonthlyDue> monthlyDues, BigDecimal unallocated) {

    public BigDecimal totalAllocated() {
        return monthlyDues.stream()
                .map(MonthlyDue::paid)
                .reduce(previousDuesPaid, BigDecimal::add);
    }
}
