package com.verticx.finance.promotion;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "grade_entries")
@Getter
@Setter
@NoArgsConstructor
public class GradeEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long studentId;

    @Column(nullable = false)
    private String courseName;

    @Column(nullable = false)
    private String assessment;

    @Column(nullable = false, precision = 6, scale = 2)
    private BigDecimal score;

    @Column
    private String term;

    @Column(nullable = false)
    private String academicSession;
}
