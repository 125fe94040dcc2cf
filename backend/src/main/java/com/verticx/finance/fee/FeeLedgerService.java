package com.verticx.finance.fee;

import com.verticx.finance.calendar.AcademicCalendarResolver;
import com.verticx.finance.calendar.AcademicSessionService;
import com.verticx.finance.calendar.SessionMonth;
import com.verticx.finance.common.exception.BusinessRuleException;
import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.common.exception.ResourceNotFoundException;
import com.verticx.finance.fee.dto.FeeHistoryEntryDto;
import com.verticx.finance.fee.dto.FeeStatementDto;
import com.verticx.finance.fee.dto.PaymentReceiptDto;
import com.verticx.finance.school.SchoolClass;
import com.verticx.finance.school.SchoolClassRepository;
import com.verticx.finance.school.Student;
import com.verticx.finance.school.StudentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class FeeLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(FeeLedgerService.class);

    private final FeeRecordRepository feeRecordRepository;
    private final FeePaymentRepository feePaymentRepository;
    private final FeeAdjustmentRepository feeAdjustmentRepository;
    private final FeeTemplateRepository feeTemplateRepository;
    private final StudentRepository studentRepository;
    private final SchoolClassRepository schoolClassRepository;
    private final AcademicSessionService academicSessionService;
    private final AcademicCalendarResolver calendarResolver;
    private final FeeTemplateAllocator feeTemplateAllocator;
    private final PaymentLedgerReducer paymentLedgerReducer;
    private final LedgerLockService ledgerLockService;

    public FeeLedgerService(FeeRecordRepository feeRecordRepository,
                            FeePaymentRepository feePaymentRepository,
                            FeeAdjustmentRepository feeAdjustmentRepository,
                            FeeTemplateRepository feeTemplateRepository,
                            StudentRepository studentRepository,
                            SchoolClassRepository schoolClassRepository,
                            AcademicSessionService academicSessionService,
                            AcademicCalendarResolver calendarResolver,
                            FeeTemplateAllocator feeTemplateAllocator,
                            PaymentLedgerReducer paymentLedgerReducer,
                            LedgerLockService ledgerLockService) {
        this.feeRecordRepository = feeRecordRepository;
        this.feePaymentRepository = feePaymentRepository;
        this.feeAdjustmentRepository = feeAdjustmentRepository;
        this.feeTemplateRepository = feeTemplateRepository;
        this.studentRepository = studentRepository;
        this.schoolClassRepository = schoolClassRepository;
        this.academicSessionService = academicSessionService;
        this.calendarResolver = calendarResolver;
        this.feeTemplateAllocator = feeTemplateAllocator;
        this.paymentLedgerReducer = paymentLedgerReducer;
        this.ledgerLockService = ledgerLockService;
    }

    @Transactional(readOnly = true)
    public FeeStatementDto getFeeStatement(Long studentId, LocalDate today) {
        Student student = studentRepository.findById(studentId)
                .orElseThrow(() -> new ResourceNotFoundException("Student", studentId));
        Optional<FeeRecord> record = feeRecordRepository.findByStudentId(studentId);

        BigDecimal totalAnnualFee = record.map(FeeRecord::getTotalAmount).orElse(BigDecimal.ZERO);
        BigDecimal totalPaid = record.map(FeeRecord::getPaidAmount).orElse(BigDecimal.ZERO);
        BigDecimal previousSessionDues = record.map(FeeRecord::getPreviousSessionDues).orElse(BigDecimal.ZERO);

        LocalDate sessionStart = academicSessionService.startDateFor(student.getBranchId(), today);
        List<SessionMonth> months = calendarResolver.resolveMonths(sessionStart);
        Optional<Map<String, BigDecimal>> dues = feeTemplateAllocator.allocate(templateOf(student), months);

        FeeStatementDto.FeeStatementDtoBuilder statement = FeeStatementDto.builder()
                .studentId(student.getId())
                .studentName(student.getName())
                .totalAnnualFee(totalAnnualFee)
                .totalPaid(totalPaid)
                .totalOutstanding(totalAnnualFee.subtract(totalPaid).max(BigDecimal.ZERO))
                .previousSessionDues(previousSessionDues)
                .dueDate(record.map(FeeRecord::getDueDate).orElse(nextDueDate(today)))
                .monthlyBreakdownAvailable(dues.isPresent());

        if (dues.isEmpty()) {
            logger.debug("No monthly breakdown for student {}, returning aggregate figures only", studentId);
            return statement
                    .previousSessionDuesPaid(totalPaid.min(previousSessionDues).max(BigDecimal.ZERO))
                    .currentMonthDue(BigDecimal.ZERO)
                    .monthlyDues(List.of())
                    .build();
        }

        LedgerAllocation allocation = paymentLedgerReducer.reduce(totalPaid, previousSessionDues, months, dues.get());
        int currentPosition = calendarResolver.positionOf(sessionStart, today);
        BigDecimal currentMonthDue = currentPosition == 0
                ? BigDecimal.ZERO
                : dues.get().getOrDefault(months.get(currentPosition - 1).shortLabel(), BigDecimal.ZERO);
        return statement
                .previousSessionDuesPaid(allocation.previousDuesPaid())
                .currentMonthDue(currentMonthDue)
                .monthlyDues(allocation.monthlyDues())
                .build();
    }

    /**
     * Appends a payment to the student's ledger and raises the record's paid amount, atomically.
     */
    @Transactional
    public PaymentReceiptDto recordPayment(Long studentId, BigDecimal amount, String transactionId, String details) {
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessRuleException(ErrorCode.INVALID_PAYMENT_AMOUNT);
        }
        String lockKey = LedgerLockService.feeLedgerKey(studentId);
        String lockToken = ledgerLockService.tryAcquireLockWithRetry(lockKey);
        if (lockToken == null) {
            throw new BusinessRuleException(ErrorCode.LEDGER_BUSY);
        }
        ledgerLockService.releaseAfterCompletion(lockKey, lockToken);

        FeeRecord record = feeRecordRepository.findByStudentId(studentId)
                .orElseThrow(() -> new ResourceNotFoundException("FeeRecord for student", studentId,
                        ErrorCode.FEE_RECORD_NOT_FOUND));
        if (feePaymentRepository.existsByTransactionId(transactionId)) {
            throw new BusinessRuleException(ErrorCode.DUPLICATE_TRANSACTION,
                    "Transaction " + transactionId + " was already recorded");
        }
        if (amount.compareTo(record.outstanding()) > 0) {
            throw new BusinessRuleException(ErrorCode.PAYMENT_EXCEEDS_OUTSTANDING,
                    "Payment of " + amount + " exceeds outstanding balance of " + record.outstanding());
        }

        LocalDate paidDate = LocalDate.now();
        FeePayment payment = feePaymentRepository.save(new FeePayment(record, amount, paidDate, transactionId, details));
        record.setPaidAmount(record.getPaidAmount().add(amount));
        record.setUpdatedAt(OffsetDateTime.now());
        feeRecordRepository.save(record);

        logger.info("Recorded payment {} of {} for student {}", transactionId, amount, studentId);
        return PaymentReceiptDto.builder()
                .paymentId(payment.getId())
                .studentId(studentId)
                .transactionId(transactionId)
                .amount(amount)
                .paidDate(paidDate)
                .totalPaid(record.getPaidAmount())
                .totalOutstanding(record.outstanding())
                .build();
    }

    /**
     * Records a concession or charge and moves the record's total accordingly. The total never
     * drops below zero.
     */
    @Transactional
    public FeeHistoryEntryDto applyAdjustment(Long studentId, FeeAdjustment.Type type, BigDecimal amount,
                                              String reason, String adjustedBy) {
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessRuleException(ErrorCode.INVALID_ADJUSTMENT_AMOUNT);
        }
        if (!studentRepository.existsById(studentId)) {
            throw new ResourceNotFoundException("Student", studentId);
        }
        String lockKey = LedgerLockService.feeLedgerKey(studentId);
        String lockToken = ledgerLockService.tryAcquireLockWithRetry(lockKey);
        if (lockToken == null) {
            throw new BusinessRuleException(ErrorCode.LEDGER_BUSY);
        }
        ledgerLockService.releaseAfterCompletion(lockKey, lockToken);

        FeeAdjustment adjustment = feeAdjustmentRepository.save(
                new FeeAdjustment(studentId, type, amount, reason, adjustedBy, LocalDate.now()));
        feeRecordRepository.findByStudentId(studentId).ifPresent(record -> {
            record.setTotalAmount(record.getTotalAmount().add(adjustment.getAmount()).max(BigDecimal.ZERO));
            record.setUpdatedAt(OffsetDateTime.now());
            feeRecordRepository.save(record);
        });
        logger.info("Applied {} of {} to student {} by {}", type, adjustment.getAmount(), studentId, adjustedBy);
        return FeeHistoryEntryDto.from(adjustment);
    }

    @Transactional(readOnly = true)
    public List<FeeHistoryEntryDto> getFeeHistory(Long studentId) {
        List<FeeHistoryItem> items = new ArrayList<>();
        items.addAll(feePaymentRepository.findByStudentIdOrderByPaidDateAsc(studentId));
        items.addAll(feeAdjustmentRepository.findByStudentIdOrderByDateAsc(studentId));
        return items.stream()
                .sorted(Comparator.comparing(FeeHistoryItem::getDate))
                .map(FeeHistoryEntryDto::from)
                .toList();
    }

    private FeeTemplate templateOf(Student student) {
        if (student.getClassId() == null) {
            return null;
        }
        return schoolClassRepository.findById(student.getClassId())
                .map(SchoolClass::getFeeTemplateId)
                .flatMap(feeTemplateRepository::findById)
                .orElse(null);
    }

    static LocalDate nextDueDate(LocalDate today) {
        return today.plusMonths(1).withDayOfMonth(10);
    }
}
