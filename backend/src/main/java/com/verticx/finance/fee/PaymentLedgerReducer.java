package com.verticx.finance.fee;

import com.verticx.finance.calendar.SessionMonth;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Allocates a student's cumulative payments oldest-first: previous-session arrears, then each
 * session month in order. A payment can never be targeted at a specific later month.
 */
@Component
public class PaymentLedgerReducer {

    public LedgerAllocation reduce(BigDecimal paidAmount,
                                   BigDecimal previousSessionDues,
                                   List<SessionMonth> months,
                                   Map<String, BigDecimal> duesByMonth) {
        BigDecimal tracker = nonNegative(paidAmount);
        BigDecimal previousDuesPaid = tracker.min(nonNegative(previousSessionDues));
        tracker = tracker.subtract(previousDuesPaid);

        List<MonthlyDue> monthlyDues = new ArrayList<>(months.size());
        for (SessionMonth month : months) {
            BigDecimal due = nonNegative(duesByMonth.get(month.shortLabel()));
            if (tracker.signum() <= 0) {
                monthlyDues.add(unpaid(month, due));
                continue;
            }
            BigDecimal paidForMonth = tracker.min(due);
            tracker = tracker.subtract(paidForMonth);
            BigDecimal balance = due.subtract(paidForMonth);
            monthlyDues.add(new MonthlyDue(month.fullLabel(), month.year(), due, paidForMonth, balance,
                    statusOf(balance, paidForMonth)));
        }
        return new LedgerAllocation(previousDuesPaid, List.copyOf(monthlyDues), tracker);
    }

    private MonthlyDue unpaid(SessionMonth month, BigDecimal due) {
        DueStatus status = due.signum() <= 0 ? DueStatus.PAID : DueStatus.DUE;
        return new MonthlyDue(month.fullLabel(), month.year(), due, BigDecimal.ZERO, due, status);
    }

    static DueStatus statusOf(BigDecimal balance, BigDecimal paidForMonth) {
        if (balance.signum() <= 0) {
            return DueStatus.PAID;
        }
        return paidForMonth.signum() > 0 ? DueStatus.PARTIALLY_PAID : DueStatus.DUE;
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value.max(BigDecimal.ZERO);
    }
}
