package com.verticx.finance.payroll;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.YearMonth;

@Entity
@Table(name = "payroll_records",
        uniqueConstraints = @UniqueConstraint(columnNames = {"staff_id", "payroll_month"}))
@Getter
@Setter
@NoArgsConstructor
public class PayrollRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long branchId;

    @Column(name = "staff_id", nullable = false)
    private Long staffId;

    @Column(nullable = false)
    private String staffName;

    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private StaffMember.Role staffRole;

    @Column(name = "payroll_month", nullable = false, length = 7)
    private String month; // yyyy-MM

    @Column(precision = 18, scale = 2)
    private BigDecimal baseSalary;

    @Column(nullable = false, precision = 6, scale = 1)
    private BigDecimal unpaidLeaveDays = BigDecimal.ZERO;

    @Column(precision = 18, scale = 2)
    private BigDecimal leaveDeductions;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal manualAdjustmentsTotal = BigDecimal.ZERO;

    @Column(precision = 18, scale = 2)
    private BigDecimal netPayable;

    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private Status status;

    @Column
    private OffsetDateTime paidAt;

    @Column
    private String paidBy;

    @Version
    @Column(nullable = false)
    private Long version = 0L;

    public enum Status { SALARY_NOT_SET, PENDING, PAID }

    public YearMonth yearMonth() {
        return YearMonth.parse(month);
    }

    public boolean isFrozen() {
        return status == Status.PAID;
    }

    public void apply(PayrollSettlement settlement) {
        this.baseSalary = settlement.baseSalary();
        this.unpaidLeaveDays = settlement.unpaidLeaveDays();
        this.leaveDeductions = settlement.leaveDeductions();
        this.manualAdjustmentsTotal = settlement.manualAdjustmentsTotal();
        this.netPayable = settlement.netPayable();
        this.status = settlement.status();
    }
}
