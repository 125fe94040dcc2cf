package com.verticx.finance.school;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "students")
@Getter
@Setter
@NoArgsConstructor
public class Student {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long branchId;

    @Column(nullable = false)
    private String name;

    @Column
    private Integer rollNo;

    @Column(nullable = false)
    private int gradeLevel;

    @Column
    private Long classId;

    @Column
    private String guardianPhone;

    // Partition key for live grades and attendance.
    @Column(nullable = false)
    private String currentSession;
}
