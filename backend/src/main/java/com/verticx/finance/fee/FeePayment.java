package com.verticx.finance.fee;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

@Entity
@Table(name = "fee_payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FeePayment implements FeeHistoryItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long studentId;

    @Column(nullable = false, updatable = false)
    private Long feeRecordId;

    @Column(nullable = false, updatable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false)
    private LocalDate paidDate;

    @Column(nullable = false, updatable = false, unique = true)
    private String transactionId;

    @Column(updatable = false)
    private String details;

    @Column(nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public FeePayment(FeeRecord record, BigDecimal amount, LocalDate paidDate, String transactionId, String details) {
        this.studentId = record.getStudentId();
        this.feeRecordId = record.getId();
        this.amount = amount;
        this.paidDate = paidDate;
        this.transactionId = transactionId;
        this.details = details;
        this.createdAt = OffsetDateTime.now();
    }

    @Override
    public LocalDate getDate() {
        return paidDate;
    }

    @Override
    public String getDescription() {
        return details != null ? details : "Payment " + transactionId;
    }
}
