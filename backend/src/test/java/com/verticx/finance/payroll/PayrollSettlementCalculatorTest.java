package com.verticx.finance.payroll;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PayrollSettlementCalculatorTest {

    private static final YearMonth MARCH = YearMonth.of(2024, 3);
    private static final BigDecimal SALARY = new BigDecimal("30000");

    private final PayrollSettlementCalculator calculator = new PayrollSettlementCalculator();

    static LeaveApplication leave(String from, String to, boolean halfDay, LeaveApplication.Status status) {
        LeaveApplication leave = new LeaveApplication();
        leave.setApplicantId(7L);
        leave.setStartDate(LocalDate.parse(from));
        leave.setEndDate(LocalDate.parse(to));
        leave.setHalfDay(halfDay);
        leave.setStatus(status);
        return leave;
    }

    static ManualSalaryAdjustment adjustment(YearMonth month, String amount) {
        return new ManualSalaryAdjustment(1L, 7L, month, new BigDecimal(amount), "bonus", "principal", OffsetDateTime.now());
    }

    @Test
    void missingSalaryShortCircuits() {
        PayrollSettlement settlement = calculator.calculate(null, MARCH,
                List.of(leave("2024-03-04", "2024-03-05", false, LeaveApplication.Status.APPROVED)), List.of());

        assertThat(settlement.status()).isEqualTo(PayrollRecord.Status.SALARY_NOT_SET);
        assertThat(settlement.netPayable()).isNull();
        assertThat(settlement.leaveDeductions()).isNull();
        assertThat(settlement.unpaidLeaveDays()).isEqualByComparingTo("0");
    }

    @Test
    void twoApprovedLeaveDaysCostOneFifteenthOfSalary() {
        PayrollSettlement settlement = calculator.calculate(SALARY, MARCH,
                List.of(leave("2024-03-04", "2024-03-05", false, LeaveApplication.Status.APPROVED)), List.of());

        assertThat(settlement.status()).isEqualTo(PayrollRecord.Status.PENDING);
        assertThat(settlement.unpaidLeaveDays()).isEqualByComparingTo("2");
        assertThat(settlement.leaveDeductions()).isEqualByComparingTo("2000");
        assertThat(settlement.netPayable()).isEqualByComparingTo("28000");
    }

    @Test
    void halfDayLeavesCountHalf() {
        PayrollSettlement settlement = calculator.calculate(SALARY, MARCH,
                List.of(leave("2024-03-11", "2024-03-13", true, LeaveApplication.Status.APPROVED)), List.of());

        assertThat(settlement.unpaidLeaveDays()).isEqualByComparingTo("1.5");
        assertThat(settlement.netPayable()).isEqualByComparingTo("28500");
    }

    @Test
    void onlyApprovedLeaveDaysInsideTheMonthCount() {
        PayrollSettlement settlement = calculator.calculate(SALARY, MARCH, List.of(
                leave("2024-02-27", "2024-03-03", false, LeaveApplication.Status.APPROVED),
                leave("2024-03-10", "2024-03-12", false, LeaveApplication.Status.PENDING),
                leave("2024-03-20", "2024-03-21", false, LeaveApplication.Status.REJECTED),
                leave("2024-04-01", "2024-04-02", false, LeaveApplication.Status.APPROVED)), List.of());

        assertThat(settlement.unpaidLeaveDays()).isEqualByComparingTo("3");
    }

    @Test
    void overlappingLeavesAreCappedAtMonthLength() {
        YearMonth february = YearMonth.of(2024, 2);
        PayrollSettlement settlement = calculator.calculate(SALARY, february, List.of(
                leave("2024-02-01", "2024-02-29", false, LeaveApplication.Status.APPROVED),
                leave("2024-02-10", "2024-02-20", false, LeaveApplication.Status.APPROVED)), List.of());

        assertThat(settlement.unpaidLeaveDays()).isEqualByComparingTo("29");
        assertThat(settlement.leaveDeductions()).isEqualByComparingTo("29000");
        assertThat(settlement.netPayable()).isEqualByComparingTo("1000");
    }

    @Test
    void adjustmentsOfOtherMonthsAreIgnored() {
        PayrollSettlement settlement = calculator.calculate(SALARY, MARCH,
                List.of(leave("2024-03-04", "2024-03-05", false, LeaveApplication.Status.APPROVED)),
                List.of(adjustment(MARCH, "1500"), adjustment(YearMonth.of(2024, 4), "999")));

        assertThat(settlement.manualAdjustmentsTotal()).isEqualByComparingTo("1500");
        assertThat(settlement.netPayable()).isEqualByComparingTo("29500");
    }

    @Test
    void netPayableNeverGoesNegative() {
        PayrollSettlement settlement = calculator.calculate(new BigDecimal("3000"), MARCH, List.of(),
                List.of(adjustment(MARCH, "-5000")));

        assertThat(settlement.netPayable()).isEqualByComparingTo("0");
    }

    @Test
    void figuresAreRoundedHalfUpToWholeUnits() {
        PayrollSettlement settlement = calculator.calculate(new BigDecimal("10001"), MARCH,
                List.of(leave("2024-03-04", "2024-03-04", false, LeaveApplication.Status.APPROVED)), List.of());

        assertThat(settlement.leaveDeductions()).isEqualByComparingTo("333");
        assertThat(settlement.netPayable()).isEqualByComparingTo("9668");
    }
}
