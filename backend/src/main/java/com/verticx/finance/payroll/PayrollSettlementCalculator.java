package com.verticx.finance.payroll;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Component
public class PayrollSettlementCalculator {

    // Flat daily rate divisor, independent of the month's length.
    static final BigDecimal DAYS_PER_PAY_MONTH = BigDecimal.valueOf(30);

    private static final BigDecimal HALF_DAY = new BigDecimal("0.5");

    /**
     * Settles one staff member's pay for {@code month}.
     *
     * @param baseSalary  monthly salary, or null when none has been set
     * @param leaves      the staff member's leave applications; only approved ones are counted
     * @param adjustments manual adjustments; only those recorded against {@code month} are summed
     */
    public PayrollSettlement calculate(BigDecimal baseSalary, YearMonth month,
                                       List<LeaveApplication> leaves,
                                       List<ManualSalaryAdjustment> adjustments) {
        if (baseSalary == null) {
            return PayrollSettlement.salaryNotSet();
        }

        BigDecimal unpaidLeaveDays = unpaidLeaveDays(month, leaves);
        BigDecimal exactDeductions = baseSalary.multiply(unpaidLeaveDays)
                .divide(DAYS_PER_PAY_MONTH, 10, RoundingMode.HALF_UP);
        BigDecimal adjustmentsTotal = adjustments.stream()
                .filter(adjustment -> month.toString().equals(adjustment.getMonth()))
                .map(ManualSalaryAdjustment::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal netPayable = baseSalary.subtract(exactDeductions).add(adjustmentsTotal)
                .setScale(0, RoundingMode.HALF_UP)
                .max(BigDecimal.ZERO);

        return new PayrollSettlement(PayrollRecord.Status.PENDING,
                baseSalary,
                unpaidLeaveDays,
                exactDeductions.setScale(0, RoundingMode.HALF_UP),
                adjustmentsTotal,
                netPayable);
    }

    /**
     * Approved leave days falling inside {@code month}; half-day leaves count 0.5 per day. Overlapping
     * leaves never push the total past the month's length.
     */
    BigDecimal unpaidLeaveDays(YearMonth month, List<LeaveApplication> leaves) {
        LocalDate monthStart = month.atDay(1);
        LocalDate monthEnd = month.atEndOfMonth();

        BigDecimal total = BigDecimal.ZERO;
        for (LeaveApplication leave : leaves) {
            if (leave.getStatus() != LeaveApplication.Status.APPROVED) {
                continue;
            }
            LocalDate from = leave.getStartDate().isAfter(monthStart) ? leave.getStartDate() : monthStart;
            LocalDate to = leave.getEndDate().isBefore(monthEnd) ? leave.getEndDate() : monthEnd;
            if (to.isBefore(from)) {
                continue;
            }
            BigDecimal days = BigDecimal.valueOf(ChronoUnit.DAYS.between(from, to) + 1);
            total = total.add(leave.isHalfDay() ? days.multiply(HALF_DAY) : days);
        }
        return total.min(BigDecimal.valueOf(month.lengthOfMonth()));
    }
}
