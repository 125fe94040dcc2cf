package com.verticx.finance.fee.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
public class PaymentReceiptDto {
    private Long paymentId;
    private Long studentId;
    private String transactionId;
    private BigDecimal amount;
    private LocalDate paidDate;
    private BigDecimal totalPaid;
    private BigDecimal totalOutstanding;
}
