package com.verticx.finance.fee;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "fee_adjustments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FeeAdjustment implements FeeHistoryItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long studentId;

    // Negative for concessions, positive for charges.
    @Column(nullable = false, updatable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false)
    @Enumerated(EnumType.STRING)
    private Type type;

    @Column(nullable = false, updatable = false)
    private String reason;

    @Column(nullable = false, updatable = false)
    private String adjustedBy;

    @Column(name = "adjustment_date", nullable = false, updatable = false)
    private LocalDate date;

    public enum Type { CONCESSION, CHARGE }

    public FeeAdjustment(Long studentId, Type type, BigDecimal magnitude, String reason, String adjustedBy, LocalDate date) {
        this.studentId = studentId;
        this.type = type;
        this.amount = type == Type.CONCESSION ? magnitude.abs().negate() : magnitude.abs();
        this.reason = reason;
        this.adjustedBy = adjustedBy;
        this.date = date;
    }

    @Override
    public String getDescription() {
        return reason;
    }
}
