package com.verticx.finance.fee.dto;

import com.verticx.finance.fee.MonthlyDue;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
public class FeeStatementDto {
    private Long studentId;
    private String studentName;
    private BigDecimal totalAnnualFee;
    private BigDecimal totalPaid;
    private BigDecimal totalOutstanding;
    private BigDecimal previousSessionDues;
    private BigDecimal previousSessionDuesPaid;
    private BigDecimal currentMonthDue;
    private LocalDate dueDate;
    private boolean monthlyBreakdownAvailable;
    private List<MonthlyDue> monthlyDues;
}
