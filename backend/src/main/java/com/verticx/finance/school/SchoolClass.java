package com.verticx.finance.school;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "school_classes")
@Getter
@Setter
@NoArgsConstructor
public class SchoolClass {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long branchId;

    @Column(nullable = false)
    private int gradeLevel;

    @Column(nullable = false)
    private String section;

    @Column
    private Long feeTemplateId;

    public String displayName() {
        return "Grade " + gradeLevel + " - " + section;
    }
}
