package com.verticx.finance.payroll;

import com.verticx.finance.common.exception.BusinessRuleException;
import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.common.exception.ResourceNotFoundException;
import com.verticx.finance.payroll.dto.LeaveApplicationDto;
import com.verticx.finance.payroll.dto.LeaveApplicationRequest;
import com.verticx.finance.payroll.dto.LeaveReviewRequest;
import com.verticx.finance.security.AuthenticatedPrincipal;
import com.verticx.finance.security.BranchAccessGuard;
import com.verticx.finance.user.Role;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Objects;

@RestController
@RequestMapping("/api/leaves")
public class LeaveController {

    private final LeaveService leaveService;
    private final LeaveApplicationRepository leaveApplicationRepository;
    private final StaffMemberRepository staffMemberRepository;
    private final BranchAccessGuard branchAccessGuard;

    public LeaveController(LeaveService leaveService,
                           LeaveApplicationRepository leaveApplicationRepository,
                           StaffMemberRepository staffMemberRepository,
                           BranchAccessGuard branchAccessGuard) {
        this.leaveService = leaveService;
        this.leaveApplicationRepository = leaveApplicationRepository;
        this.staffMemberRepository = staffMemberRepository;
        this.branchAccessGuard = branchAccessGuard;
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('TEACHER','REGISTRAR','LIBRARIAN')")
    public ResponseEntity<LeaveApplicationDto> apply(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                     @Valid @RequestBody LeaveApplicationRequest request) {
        if (principal.staffId() == null) {
            throw new BusinessRuleException(ErrorCode.ACCESS_DENIED, "Account is not linked to a staff member");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(leaveService.applyForLeave(principal.staffId(), request));
    }

    @PostMapping("/{applicationId}/review")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL')")
    public ResponseEntity<LeaveApplicationDto> review(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                      @PathVariable Long applicationId,
                                                      @Valid @RequestBody LeaveReviewRequest request) {
        LeaveApplication application = leaveApplicationRepository.findById(applicationId)
                .orElseThrow(() -> new ResourceNotFoundException("LeaveApplication", applicationId));
        branchAccessGuard.requireBranch(principal, application.getBranchId());
        return ResponseEntity.ok(leaveService.reviewLeave(applicationId, request.approve(), principal.username()));
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL','TEACHER','REGISTRAR','LIBRARIAN')")
    public ResponseEntity<List<LeaveApplicationDto>> forApplicant(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                                  @RequestParam Long applicantId) {
        if (!Objects.equals(principal.staffId(), applicantId)) {
            StaffMember applicant = staffMemberRepository.findById(applicantId)
                    .orElseThrow(() -> new ResourceNotFoundException("StaffMember", applicantId));
            if (!principal.isAdmin() && principal.role() != Role.PRINCIPAL) {
                throw new BusinessRuleException(ErrorCode.ACCESS_DENIED, "Cannot view another staff member's leaves");
            }
            branchAccessGuard.requireBranch(principal, applicant.getBranchId());
        }
        return ResponseEntity.ok(leaveService.getApplicationsForApplicant(applicantId));
    }

    @GetMapping("/branches/{branchId}/pending")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL')")
    public ResponseEntity<List<LeaveApplicationDto>> pending(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                             @PathVariable Long branchId) {
        branchAccessGuard.requireBranch(principal, branchId);
        return ResponseEntity.ok(leaveService.getPendingForBranch(branchId));
    }
}
