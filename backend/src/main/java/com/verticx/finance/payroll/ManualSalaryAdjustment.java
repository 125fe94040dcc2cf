package com.verticx.finance.payroll;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.YearMonth;

@Entity
@Table(name = "manual_salary_adjustments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ManualSalaryAdjustment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long branchId;

    @Column(nullable = false, updatable = false)
    private Long staffId;

    @Column(name = "adjustment_month", nullable = false, updatable = false, length = 7)
    private String month; // yyyy-MM

    // Signed: bonuses are positive, deductions negative.
    @Column(nullable = false, updatable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false)
    private String reason;

    @Column(nullable = false, updatable = false)
    private String adjustedBy;

    @Column(nullable = false, updatable = false)
    private OffsetDateTime adjustedAt;

    public ManualSalaryAdjustment(Long branchId, Long staffId, YearMonth month, BigDecimal amount,
                                  String reason, String adjustedBy, OffsetDateTime adjustedAt) {
        this.branchId = branchId;
        this.staffId = staffId;
        this.month = month.toString();
        this.amount = amount;
        this.reason = reason;
        this.adjustedBy = adjustedBy;
        this.adjustedAt = adjustedAt;
    }

    public YearMonth yearMonth() {
        return YearMonth.parse(month);
    }
}
