package com.verticx.finance.payroll;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LeaveApplicationRepository extends JpaRepository<LeaveApplication, Long> {
    List<LeaveApplication> findByApplicantIdAndStatus(Long applicantId, LeaveApplication.Status status);

    List<LeaveApplication> findByApplicantIdOrderByStartDateDesc(Long applicantId);

    List<LeaveApplication> findByBranchIdAndStatusOrderByStartDateAsc(Long branchId, LeaveApplication.Status status);
}
