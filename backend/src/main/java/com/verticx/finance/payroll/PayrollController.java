package com.verticx.finance.payroll;

import com.verticx.finance.common.exception.ResourceNotFoundException;
import com.verticx.finance.payroll.dto.*;
import com.verticx.finance.security.AuthenticatedPrincipal;
import com.verticx.finance.security.BranchAccessGuard;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.YearMonth;
import java.util.List;

@RestController
@RequestMapping("/api/payroll")
@PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL')")
public class PayrollController {

    private final PayrollService payrollService;
    private final PayrollRecordRepository payrollRecordRepository;
    private final StaffMemberRepository staffMemberRepository;
    private final BranchAccessGuard branchAccessGuard;

    public PayrollController(PayrollService payrollService,
                             PayrollRecordRepository payrollRecordRepository,
                             StaffMemberRepository staffMemberRepository,
                             BranchAccessGuard branchAccessGuard) {
        this.payrollService = payrollService;
        this.payrollRecordRepository = payrollRecordRepository;
        this.staffMemberRepository = staffMemberRepository;
        this.branchAccessGuard = branchAccessGuard;
    }

    @GetMapping("/branches/{branchId}")
    public ResponseEntity<List<PayrollRecordDto>> payrollForMonth(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                                  @PathVariable Long branchId,
                                                                  @RequestParam YearMonth month) {
        branchAccessGuard.requireBranch(principal, branchId);
        return ResponseEntity.ok(payrollService.getStaffPayrollForMonth(branchId, month));
    }

    @PostMapping("/process")
    public ResponseEntity<PayrollProcessResult> process(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                        @Valid @RequestBody ProcessPayrollRequest request) {
        branchAccessGuard.requireBranch(principal, request.branchId());
        return ResponseEntity.ok(payrollService.processPayroll(request.branchId(), request.recordIds(), principal.username()));
    }

    @PostMapping("/records/{recordId}/pay")
    public ResponseEntity<PayrollRecordDto> markPaid(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                     @PathVariable Long recordId) {
        PayrollRecord record = payrollRecordRepository.findById(recordId)
                .orElseThrow(() -> new ResourceNotFoundException("PayrollRecord", recordId));
        branchAccessGuard.requireBranch(principal, record.getBranchId());
        return ResponseEntity.ok(payrollService.markPaid(recordId, principal.username()));
    }

    @PostMapping("/adjustments")
    public ResponseEntity<ManualAdjustmentDto> addAdjustment(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                             @Valid @RequestBody ManualAdjustmentRequest request) {
        StaffMember staff = staffMemberRepository.findById(request.staffId())
                .orElseThrow(() -> new ResourceNotFoundException("StaffMember", request.staffId()));
        branchAccessGuard.requireBranch(principal, staff.getBranchId());
        ManualAdjustmentDto adjustment = payrollService.addManualAdjustment(request.staffId(),
                YearMonth.parse(request.month()), request.amount(), request.reason(), principal.username());
        return ResponseEntity.status(HttpStatus.CREATED).body(adjustment);
    }
}
