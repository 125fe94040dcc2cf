package com.verticx.finance.promotion;

import com.verticx.finance.calendar.AcademicSession;
import com.verticx.finance.calendar.AcademicSessionRepository;
import com.verticx.finance.common.exception.BusinessRuleException;
import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.common.exception.ResourceNotFoundException;
import com.verticx.finance.fee.FeeRecord;
import com.verticx.finance.fee.FeeRecordRepository;
import com.verticx.finance.fee.FeeTemplate;
import com.verticx.finance.fee.FeeTemplateRepository;
import com.verticx.finance.fee.LedgerLockService;
import com.verticx.finance.promotion.dto.PromotionGroup;
import com.verticx.finance.promotion.dto.PromotionResult;
import com.verticx.finance.promotion.dto.SessionStartResult;
import com.verticx.finance.school.SchoolClass;
import com.verticx.finance.school.SchoolClassRepository;
import com.verticx.finance.school.Student;
import com.verticx.finance.school.StudentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class PromotionService {

    private static final Logger logger = LoggerFactory.getLogger(PromotionService.class);
    private static final Pattern SESSION_LABEL = Pattern.compile("(\\d{4})-(\\d{4})");

    private final StudentRepository studentRepository;
    private final SchoolClassRepository schoolClassRepository;
    private final FeeRecordRepository feeRecordRepository;
    private final FeeTemplateRepository feeTemplateRepository;
    private final GradeEntryRepository gradeEntryRepository;
    private final AttendanceEntryRepository attendanceEntryRepository;
    private final ArchivedStudentRecordRepository archivedStudentRecordRepository;
    private final AcademicSessionRepository academicSessionRepository;
    private final SessionPromotionSettlement promotionSettlement;
    private final LedgerLockService ledgerLockService;

    public PromotionService(StudentRepository studentRepository,
                            SchoolClassRepository schoolClassRepository,
                            FeeRecordRepository feeRecordRepository,
                            FeeTemplateRepository feeTemplateRepository,
                            GradeEntryRepository gradeEntryRepository,
                            AttendanceEntryRepository attendanceEntryRepository,
                            ArchivedStudentRecordRepository archivedStudentRecordRepository,
                            AcademicSessionRepository academicSessionRepository,
                            SessionPromotionSettlement promotionSettlement,
                            LedgerLockService ledgerLockService) {
        this.studentRepository = studentRepository;
        this.schoolClassRepository = schoolClassRepository;
        this.feeRecordRepository = feeRecordRepository;
        this.feeTemplateRepository = feeTemplateRepository;
        this.gradeEntryRepository = gradeEntryRepository;
        this.attendanceEntryRepository = attendanceEntryRepository;
        this.archivedStudentRecordRepository = archivedStudentRecordRepository;
        this.academicSessionRepository = academicSessionRepository;
        this.promotionSettlement = promotionSettlement;
        this.ledgerLockService = ledgerLockService;
    }

    /**
     * Archives each student's records under {@code academicSession}, carries unpaid fees into the
     * target class's fee for the new session and moves the student into the target class.
     * Unknown students, and students of another branch, are skipped.
     */
    @Transactional
    public PromotionResult promoteStudents(List<Long> studentIds, Long targetClassId, String academicSession) {
        SchoolClass targetClass = loadClass(targetClassId);
        String nextSession = nextSessionFor(targetClass.getBranchId(), academicSession);
        return promoteInto(studentIds, targetClass, academicSession, nextSession);
    }

    /**
     * Moves students into a lower class. Fees and academic records are left as they are.
     */
    @Transactional
    public PromotionResult demoteStudents(List<Long> studentIds, Long targetClassId) {
        SchoolClass targetClass = loadClass(targetClassId);
        List<Long> moved = new ArrayList<>();
        List<Long> skipped = new ArrayList<>();
        for (Long studentId : studentIds) {
            Optional<Student> found = findInBranch(studentId, targetClass.getBranchId());
            if (found.isEmpty()) {
                skipped.add(studentId);
                continue;
            }
            moveToClass(found.get(), targetClass);
            moved.add(studentId);
        }
        logger.info("Demoted {} students into class {} ({} skipped)", moved.size(), targetClassId, skipped.size());
        return new PromotionResult(moved, skipped);
    }

    /**
     * Starts the branch's next session and promotes the listed groups into it, all or nothing.
     */
    @Transactional
    public SessionStartResult startNewAcademicSession(Long branchId, LocalDate startDate, String label,
                                                      List<PromotionGroup> promotions) {
        AcademicSession session = academicSessionRepository.findByBranchId(branchId).orElseGet(() -> {
            AcademicSession created = new AcademicSession();
            created.setBranchId(branchId);
            return created;
        });
        String closingLabel = session.getLabel();
        session.setStartDate(startDate);
        session.setLabel(label);
        academicSessionRepository.save(session);
        logger.info("Branch {} moved from session {} to {} starting {}", branchId, closingLabel, label, startDate);

        List<PromotionResult> results = new ArrayList<>();
        if (promotions != null) {
            for (PromotionGroup group : promotions) {
                SchoolClass targetClass = loadClass(group.targetClassId());
                if (!targetClass.getBranchId().equals(branchId)) {
                    throw new BusinessRuleException(ErrorCode.ACCESS_DENIED,
                            "Class " + targetClass.getId() + " does not belong to branch " + branchId);
                }
                results.add(promoteInto(group.studentIds(), targetClass, null, label));
            }
        }
        return new SessionStartResult(branchId, label, startDate, results);
    }

    /**
     * @param archivedSession label written on the archive; null archives under each student's own live session
     */
    private PromotionResult promoteInto(List<Long> studentIds, SchoolClass targetClass,
                                        String archivedSession, String nextSession) {
        FeeTemplate targetTemplate = targetClass.getFeeTemplateId() == null
                ? null
                : feeTemplateRepository.findById(targetClass.getFeeTemplateId()).orElse(null);
        LocalDate today = LocalDate.now();

        List<Long> moved = new ArrayList<>();
        List<Long> skipped = new ArrayList<>();
        for (Long studentId : studentIds) {
            Optional<Student> found = findInBranch(studentId, targetClass.getBranchId());
            if (found.isEmpty()) {
                skipped.add(studentId);
                continue;
            }
            Student student = found.get();
            archive(student, archivedSession != null ? archivedSession : student.getCurrentSession());
            student.setCurrentSession(nextSession);
            settleFees(student, targetTemplate, today);
            moveToClass(student, targetClass);
            moved.add(studentId);
        }
        logger.info("Promoted {} students into class {} for session {} ({} skipped)",
                moved.size(), targetClass.getId(), nextSession, skipped.size());
        return new PromotionResult(moved, skipped);
    }

    private void archive(Student student, String academicSession) {
        String liveSession = student.getCurrentSession();
        List<ArchivedStudentRecord.GradeSnapshot> grades = gradeEntryRepository
                .findByStudentIdAndAcademicSession(student.getId(), liveSession).stream()
                .map(ArchivedStudentRecord.GradeSnapshot::of)
                .toList();
        List<ArchivedStudentRecord.AttendanceSnapshot> attendance = attendanceEntryRepository
                .findByStudentIdAndAcademicSessionOrderByDateAsc(student.getId(), liveSession).stream()
                .map(ArchivedStudentRecord.AttendanceSnapshot::of)
                .toList();
        String finalClass = Optional.ofNullable(student.getClassId())
                .flatMap(schoolClassRepository::findById)
                .map(SchoolClass::displayName)
                .orElse("Grade " + student.getGradeLevel());

        archivedStudentRecordRepository.save(new ArchivedStudentRecord(student.getId(), student.getName(),
                student.getBranchId(), academicSession, finalClass, grades, attendance, OffsetDateTime.now()));
    }

    private void settleFees(Student student, FeeTemplate targetTemplate, LocalDate today) {
        String lockKey = LedgerLockService.feeLedgerKey(student.getId());
        String lockToken = ledgerLockService.tryAcquireLockWithRetry(lockKey);
        if (lockToken == null) {
            throw new BusinessRuleException(ErrorCode.LEDGER_BUSY,
                    "Fee ledger of student " + student.getId() + " is busy");
        }
        ledgerLockService.releaseAfterCompletion(lockKey, lockToken);

        FeeRecord record = feeRecordRepository.findByStudentId(student.getId()).orElse(null);
        PromotionFeeSettlement settlement = promotionSettlement.settle(record, targetTemplate, today);
        if (record == null) {
            if (settlement.newTotal().signum() <= 0) {
                return;
            }
            record = new FeeRecord();
            record.setStudentId(student.getId());
        }
        record.setTotalAmount(settlement.newTotal());
        record.setPaidAmount(settlement.paidAmount());
        record.setPreviousSessionDues(settlement.previousSessionDues());
        record.setDueDate(settlement.dueDate());
        record.setUpdatedAt(OffsetDateTime.now());
        feeRecordRepository.save(record);
    }

    private void moveToClass(Student student, SchoolClass targetClass) {
        student.setClassId(targetClass.getId());
        student.setGradeLevel(targetClass.getGradeLevel());
        studentRepository.save(student);
    }

    private Optional<Student> findInBranch(Long studentId, Long branchId) {
        Optional<Student> student = studentRepository.findById(studentId)
                .filter(s -> s.getBranchId().equals(branchId));
        if (student.isEmpty()) {
            logger.warn("Student {} not found in branch {}, skipping", studentId, branchId);
        }
        return student;
    }

    private SchoolClass loadClass(Long classId) {
        return schoolClassRepository.findById(classId)
                .orElseThrow(() -> new ResourceNotFoundException("SchoolClass", classId, ErrorCode.CLASS_NOT_FOUND));
    }

    /**
     * Live partition label for students leaving {@code closingSession}: the branch's current session
     * when it has already moved on, otherwise the following year range ("2024-2025" becomes "2025-2026").
     */
    String nextSessionFor(Long branchId, String closingSession) {
        Optional<String> branchLabel = academicSessionRepository.findByBranchId(branchId)
                .map(AcademicSession::getLabel)
                .filter(current -> !current.equals(closingSession));
        if (branchLabel.isPresent()) {
            return branchLabel.get();
        }
        return followingLabel(closingSession);
    }

    static String followingLabel(String sessionLabel) {
        Matcher matcher = SESSION_LABEL.matcher(sessionLabel);
        if (matcher.matches()) {
            int from = Integer.parseInt(matcher.group(1));
            int to = Integer.parseInt(matcher.group(2));
            return (from + 1) + "-" + (to + 1);
        }
        throw new BusinessRuleException(ErrorCode.INVALID_INPUT_VALUE,
                "Cannot derive the session after '" + sessionLabel + "'; start the new session for the branch first");
    }
}
