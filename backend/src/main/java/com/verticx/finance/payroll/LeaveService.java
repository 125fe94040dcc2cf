package com.verticx.finance.payroll;

import com.verticx.finance.common.exception.BusinessRuleException;
import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.common.exception.ResourceNotFoundException;
import com.verticx.finance.payroll.dto.LeaveApplicationDto;
import com.verticx.finance.payroll.dto.LeaveApplicationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

@Service
public class LeaveService {

    private static final Logger logger = LoggerFactory.getLogger(LeaveService.class);

    private final LeaveApplicationRepository leaveApplicationRepository;
    private final StaffMemberRepository staffMemberRepository;

    public LeaveService(LeaveApplicationRepository leaveApplicationRepository,
                        StaffMemberRepository staffMemberRepository) {
        this.leaveApplicationRepository = leaveApplicationRepository;
        this.staffMemberRepository = staffMemberRepository;
    }

    @Transactional
    public LeaveApplicationDto applyForLeave(Long applicantId, LeaveApplicationRequest request) {
        StaffMember applicant = staffMemberRepository.findById(applicantId)
                .orElseThrow(() -> new ResourceNotFoundException("StaffMember", applicantId));
        if (request.endDate().isBefore(request.startDate())) {
            throw new BusinessRuleException(ErrorCode.INVALID_LEAVE_PERIOD);
        }

        LeaveApplication application = new LeaveApplication();
        application.setApplicantId(applicantId);
        application.setBranchId(applicant.getBranchId());
        application.setLeaveType(request.leaveType());
        application.setReason(request.reason());
        application.setStartDate(request.startDate());
        application.setEndDate(request.endDate());
        application.setHalfDay(request.halfDay());
        application.setStatus(LeaveApplication.Status.PENDING);
        application.setCreatedAt(OffsetDateTime.now());
        return LeaveApplicationDto.from(leaveApplicationRepository.save(application));
    }

    /**
     * Approves or rejects a pending application. Reviewed applications are final.
     */
    @Transactional
    public LeaveApplicationDto reviewLeave(Long applicationId, boolean approve, String reviewer) {
        LeaveApplication application = leaveApplicationRepository.findById(applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("LeaveApplication", applicationId));
        if (application.getStatus() != LeaveApplication.Status.PENDING) {
            throw new BusinessRuleException(ErrorCode.LEAVE_ALREADY_REVIEWED,
                    "Leave application " + applicationId + " is already " + application.getStatus());
        }
        application.setStatus(approve ? LeaveApplication.Status.APPROVED : LeaveApplication.Status.REJECTED);
        application.setReviewedBy(reviewer);
        application.setReviewedAt(OffsetDateTime.now());
        leaveApplicationRepository.save(application);

        logger.info("Leave application {} {} by {}", applicationId, application.getStatus(), reviewer);
        return LeaveApplicationDto.from(application);
    }

    @Transactional(readOnly = true)
    public List<LeaveApplicationDto> getApplicationsForApplicant(Long applicantId) {
        return leaveApplicationRepository.findByApplicantIdOrderByStartDateDesc(applicantId).stream()
                .map(LeaveApplicationDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<LeaveApplicationDto> getPendingForBranch(Long branchId) {
        return leaveApplicationRepository
                .findByBranchIdAndStatusOrderByStartDateAsc(branchId, LeaveApplication.Status.PENDING).stream()
                .map(LeaveApplicationDto::from)
                .toList();
    }
}
