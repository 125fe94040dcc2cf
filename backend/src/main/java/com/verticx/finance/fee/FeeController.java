package com.verticx.finance.fee;

import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.common.exception.ResourceNotFoundException;
import com.verticx.finance.fee.dto.*;
import com.verticx.finance.school.SchoolClass;
import com.verticx.finance.school.SchoolClassRepository;
import com.verticx.finance.school.Student;
import com.verticx.finance.school.StudentRepository;
import com.verticx.finance.security.AuthenticatedPrincipal;
import com.verticx.finance.security.BranchAccessGuard;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/fees")
public class FeeController {

    private final FeeLedgerService feeLedgerService;
    private final FeeReportService feeReportService;
    private final FeeTemplateService feeTemplateService;
    private final StudentRepository studentRepository;
    private final SchoolClassRepository schoolClassRepository;
    private final BranchAccessGuard branchAccessGuard;

    public FeeController(FeeLedgerService feeLedgerService,
                         FeeReportService feeReportService,
                         FeeTemplateService feeTemplateService,
                         StudentRepository studentRepository,
                         SchoolClassRepository schoolClassRepository,
                         BranchAccessGuard branchAccessGuard) {
        this.feeLedgerService = feeLedgerService;
        this.feeReportService = feeReportService;
        this.feeTemplateService = feeTemplateService;
        this.studentRepository = studentRepository;
        this.schoolClassRepository = schoolClassRepository;
        this.branchAccessGuard = branchAccessGuard;
    }

    @GetMapping("/students/{studentId}/statement")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL','REGISTRAR','STUDENT','PARENT')")
    public ResponseEntity<FeeStatementDto> statement(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                     @PathVariable Long studentId) {
        checkStudent(principal, studentId);
        return ResponseEntity.ok(feeLedgerService.getFeeStatement(studentId, LocalDate.now()));
    }

    @GetMapping("/students/{studentId}/history")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL','REGISTRAR','STUDENT','PARENT')")
    public ResponseEntity<List<FeeHistoryEntryDto>> history(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                            @PathVariable Long studentId) {
        checkStudent(principal, studentId);
        return ResponseEntity.ok(feeLedgerService.getFeeHistory(studentId));
    }

    @PostMapping("/students/{studentId}/payments")
    @PreAuthorize("hasAnyRole('ADMIN','REGISTRAR')")
    public ResponseEntity<PaymentReceiptDto> recordPayment(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                           @PathVariable Long studentId,
                                                           @Valid @RequestBody RecordPaymentRequest request) {
        checkStudent(principal, studentId);
        PaymentReceiptDto receipt = feeLedgerService.recordPayment(
                studentId, request.amount(), request.transactionId().trim(), request.details());
        return ResponseEntity.status(HttpStatus.CREATED).body(receipt);
    }

    @PostMapping("/students/{studentId}/adjustments")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL','REGISTRAR')")
    public ResponseEntity<FeeHistoryEntryDto> adjust(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                     @PathVariable Long studentId,
                                                     @Valid @RequestBody FeeAdjustmentRequest request) {
        checkStudent(principal, studentId);
        FeeHistoryEntryDto entry = feeLedgerService.applyAdjustment(
                studentId, request.type(), request.amount(), request.reason(), principal.username());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @PostMapping("/templates")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL')")
    public ResponseEntity<FeeTemplateDto> createTemplate(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                         @Valid @RequestBody FeeTemplateRequest request) {
        branchAccessGuard.requireBranch(principal, request.branchId());
        return ResponseEntity.status(HttpStatus.CREATED).body(feeTemplateService.createTemplate(request));
    }

    @GetMapping("/templates")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL','REGISTRAR')")
    public ResponseEntity<List<FeeTemplateDto>> templates(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                          @RequestParam Long branchId) {
        branchAccessGuard.requireBranch(principal, branchId);
        return ResponseEntity.ok(feeTemplateService.getTemplates(branchId));
    }

    @PutMapping("/classes/{classId}/template")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL')")
    public ResponseEntity<Void> assignTemplate(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                               @PathVariable Long classId,
                                               @RequestParam Long templateId) {
        branchAccessGuard.requireBranch(principal, loadClass(classId).getBranchId());
        feeTemplateService.assignTemplateToClass(classId, templateId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/branches/{branchId}/class-summaries")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL','REGISTRAR')")
    public ResponseEntity<List<ClassFeeSummaryDto>> classSummaries(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                                   @PathVariable Long branchId) {
        branchAccessGuard.requireBranch(principal, branchId);
        return ResponseEntity.ok(feeReportService.getClassFeeSummaries(branchId));
    }

    @GetMapping("/classes/{classId}/defaulters")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL','REGISTRAR','TEACHER')")
    public ResponseEntity<List<DefaulterDto>> defaulters(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                         @PathVariable Long classId) {
        branchAccessGuard.requireBranch(principal, loadClass(classId).getBranchId());
        return ResponseEntity.ok(feeReportService.getDefaultersForClass(classId));
    }

    @GetMapping("/branches/{branchId}/collection-overview")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL','REGISTRAR')")
    public ResponseEntity<List<MonthlyCollectionDto>> collectionOverview(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                                         @PathVariable Long branchId) {
        branchAccessGuard.requireBranch(principal, branchId);
        return ResponseEntity.ok(feeReportService.getMonthlyCollectionOverview(branchId, LocalDate.now()));
    }

    private void checkStudent(AuthenticatedPrincipal principal, Long studentId) {
        Student student = studentRepository.findById(studentId)
                .orElseThrow(() -> new ResourceNotFoundException("Student", studentId));
        branchAccessGuard.requireStudentAccess(principal, studentId, student.getBranchId());
    }

    private SchoolClass loadClass(Long classId) {
        return schoolClassRepository.findById(classId)
                .orElseThrow(() -> new ResourceNotFoundException("SchoolClass", classId, ErrorCode.CLASS_NOT_FOUND));
    }
}
