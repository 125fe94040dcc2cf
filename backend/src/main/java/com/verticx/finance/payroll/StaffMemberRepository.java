package com.verticx.finance.payroll;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface StaffMemberRepository extends JpaRepository<StaffMember, Long> {
    List<StaffMember> findByBranchIdAndRoleNotOrderByNameAsc(Long branchId, StaffMember.Role role);

    @Query("select distinct s.branchId from StaffMember s")
    List<Long> findDistinctBranchIds();
}
