package com.verticx.finance.calendar;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

@Entity
@Table(name = "academic_sessions")
@Getter
@Setter
@NoArgsConstructor
public class AcademicSession {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private Long branchId;

    @Column(nullable = false)
    private String label; // e.g., 2024-2025

    @Column(nullable = false)
    private LocalDate startDate;

    @Version
    @Column(nullable = false)
    private Long version = 0L;
}
