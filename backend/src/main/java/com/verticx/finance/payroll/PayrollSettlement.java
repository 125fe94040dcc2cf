package com.verticx.finance.payroll;

import java.math.BigDecimal;

/**
 * Computed pay for one staff member and month. For {@link PayrollRecord.Status#SALARY_NOT_SET} every
 * money field except {@code manualAdjustmentsTotal} is null.
 */
public record PayrollSettlement(PayrollRecord.Status status,
                                BigDecimal baseSalary,
                                BigDecimal unpaidLeaveDays,
                                BigDecimal leaveDeductions,
                                BigDecimal manualAdjustmentsTotal,
                                BigDecimal netPayable) {

    public static PayrollSettlement salaryNotSet() {
        return new PayrollSettlement(PayrollRecord.Status.SALARY_NOT_SET, null, BigDecimal.ZERO, null,
                BigDecimal.ZERO, null);
    }
}
