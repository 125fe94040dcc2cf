package com.verticx.finance.payroll;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "staff_members")
@Getter
@Setter
@NoArgsConstructor
public class StaffMember {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long branchId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private Role role;

    @Column(precision = 18, scale = 2)
    private BigDecimal salary; // monthly; null until set by the principal

    public enum Role { TEACHER, REGISTRAR, LIBRARIAN, SUPPORT_STAFF, PRINCIPAL }
}
