package com.verticx.finance.payroll;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Entity
@Table(name = "leave_applications")
@Getter
@Setter
@NoArgsConstructor
public class LeaveApplication {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long applicantId;

    @Column(nullable = false)
    private Long branchId;

    @Column(nullable = false)
    private String leaveType;

    @Column
    private String reason;

    @Column(nullable = false)
    private LocalDate startDate;

    @Column(nullable = false)
    private LocalDate endDate;

    @Column(nullable = false)
    private boolean halfDay;

    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private Status status = Status.PENDING;

    @Column
    private String reviewedBy;

    @Column
    private OffsetDateTime reviewedAt;

    @Column(nullable = false)
    private OffsetDateTime createdAt;

    @Version
    @Column(nullable = false)
    private Long version = 0L;

    public enum Status { PENDING, APPROVED, REJECTED }
}
