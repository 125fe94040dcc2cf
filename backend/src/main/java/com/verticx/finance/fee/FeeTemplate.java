package com.verticx.finance.fee;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

@Entity
@Table(name = "fee_templates")
@Getter
@Setter
@NoArgsConstructor
public class FeeTemplate {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long branchId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private int gradeLevel;

    @Column(nullable = false, precision = 18, scale = 2)
    private BigDecimal amount; // annual total

    @JdbcTypeCode(SqlTypes.JSON)
    @Column
    private List<MonthlyFee> monthlyBreakdown;

    @Column(nullable = false)
    private OffsetDateTime createdAt;

    public boolean hasMonthlyBreakdown() {
        return monthlyBreakdown != null && !monthlyBreakdown.isEmpty();
    }
}
