package com.verticx.finance.promotion;

import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.common.exception.ResourceNotFoundException;
import com.verticx.finance.promotion.dto.*;
import com.verticx.finance.school.SchoolClass;
import com.verticx.finance.school.SchoolClassRepository;
import com.verticx.finance.school.Student;
import com.verticx.finance.school.StudentRepository;
import com.verticx.finance.security.AuthenticatedPrincipal;
import com.verticx.finance.security.BranchAccessGuard;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final PromotionService promotionService;
    private final SchoolClassRepository schoolClassRepository;
    private final StudentRepository studentRepository;
    private final ArchivedStudentRecordRepository archivedStudentRecordRepository;
    private final BranchAccessGuard branchAccessGuard;

    public SessionController(PromotionService promotionService,
                             SchoolClassRepository schoolClassRepository,
                             StudentRepository studentRepository,
                             ArchivedStudentRecordRepository archivedStudentRecordRepository,
                             BranchAccessGuard branchAccessGuard) {
        this.promotionService = promotionService;
        this.schoolClassRepository = schoolClassRepository;
        this.studentRepository = studentRepository;
        this.archivedStudentRecordRepository = archivedStudentRecordRepository;
        this.branchAccessGuard = branchAccessGuard;
    }

    @PostMapping("/promotions")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL','REGISTRAR')")
    public ResponseEntity<PromotionResult> promote(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                   @Valid @RequestBody PromotionRequest request) {
        branchAccessGuard.requireBranch(principal, branchOfClass(request.targetClassId()));
        return ResponseEntity.ok(promotionService.promoteStudents(
                request.studentIds(), request.targetClassId(), request.academicSession()));
    }

    @PostMapping("/demotions")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL','REGISTRAR')")
    public ResponseEntity<PromotionResult> demote(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                  @Valid @RequestBody DemotionRequest request) {
        branchAccessGuard.requireBranch(principal, branchOfClass(request.targetClassId()));
        return ResponseEntity.ok(promotionService.demoteStudents(request.studentIds(), request.targetClassId()));
    }

    @PostMapping("/branches/{branchId}/start")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL')")
    public ResponseEntity<SessionStartResult> startSession(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                           @PathVariable Long branchId,
                                                           @Valid @RequestBody StartSessionRequest request) {
        branchAccessGuard.requireBranch(principal, branchId);
        return ResponseEntity.ok(promotionService.startNewAcademicSession(
                branchId, request.startDate(), request.label(), request.promotions()));
    }

    @GetMapping("/students/{studentId}/archives")
    @PreAuthorize("hasAnyRole('ADMIN','PRINCIPAL','REGISTRAR','TEACHER','STUDENT','PARENT')")
    public ResponseEntity<List<ArchivedStudentRecordDto>> archives(@AuthenticationPrincipal AuthenticatedPrincipal principal,
                                                                   @PathVariable Long studentId) {
        Student student = studentRepository.findById(studentId)
                .orElseThrow(() -> new ResourceNotFoundException("Student", studentId));
        branchAccessGuard.requireStudentAccess(principal, studentId, student.getBranchId());
        return ResponseEntity.ok(archivedStudentRecordRepository.findByStudentIdOrderByArchivedAtDesc(studentId).stream()
                .map(ArchivedStudentRecordDto::from)
                .toList());
    }

    private Long branchOfClass(Long classId) {
        return schoolClassRepository.findById(classId)
                .map(SchoolClass::getBranchId)
                .orElseThrow(() -> new ResourceNotFoundException("SchoolClass", classId, ErrorCode.CLASS_NOT_FOUND));
    }
}
