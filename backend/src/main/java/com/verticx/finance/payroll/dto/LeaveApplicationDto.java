package com.verticx.finance.payroll.dto;

import com.verticx.finance.payroll.LeaveApplication;

import java.time.LocalDate;
import java.time.OffsetDateTime;

public record LeaveApplicationDto(Long id, Long applicantId, Long branchId, String leaveType, String reason,
                                  LocalDate startDate, LocalDate endDate, boolean halfDay,
                                  LeaveApplication.Status status, String reviewedBy, OffsetDateTime reviewedAt) {

    public static LeaveApplicationDto from(LeaveApplication application) {
        return new LeaveApplicationDto(application.getId(), application.getApplicantId(), application.getBranchId(),
                application.getLeaveType(), application.getReason(), application.getStartDate(),
                application.getEndDate(), application.isHalfDay(), application.getStatus(),
                application.getReviewedBy(), application.getReviewedAt());
    }
}
