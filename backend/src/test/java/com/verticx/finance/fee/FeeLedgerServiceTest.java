package com.verticx.finance.fee;

import com.verticx.finance.calendar.AcademicCalendarResolver;
import com.verticx.finance.calendar.AcademicSessionService;
import com.verticx.finance.common.exception.BusinessRuleException;
import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.fee.dto.FeeHistoryEntryDto;
import com.verticx.finance.fee.dto.FeeStatementDto;
import com.verticx.finance.fee.dto.PaymentReceiptDto;
import com.verticx.finance.school.SchoolClass;
import com.verticx.finance.school.SchoolClassRepository;
import com.verticx.finance.school.Student;
import com.verticx.finance.school.StudentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeeLedgerServiceTest {

    private static final Long STUDENT_ID = 1L;
    private static final String LOCK_KEY = "ledger:fee:1";
    private static final String LOCK_TOKEN = "3f6c2a1e-lock";

    @Mock
    private FeeRecordRepository feeRecordRepository;
    @Mock
    private FeePaymentRepository feePaymentRepository;
    @Mock
    private FeeAdjustmentRepository feeAdjustmentRepository;
    @Mock
    private FeeTemplateRepository feeTemplateRepository;
    @Mock
    private StudentRepository studentRepository;
    @Mock
    private SchoolClassRepository schoolClassRepository;
    @Mock
    private AcademicSessionService academicSessionService;
    @Mock
    private LedgerLockService ledgerLockService;

    private FeeLedgerService feeLedgerService;

    @BeforeEach
    void setUp() {
        feeLedgerService = new FeeLedgerService(feeRecordRepository, feePaymentRepository, feeAdjustmentRepository,
                feeTemplateRepository, studentRepository, schoolClassRepository, academicSessionService,
                new AcademicCalendarResolver(), new FeeTemplateAllocator(), new PaymentLedgerReducer(),
                ledgerLockService);
    }

    private static FeeRecord feeRecord(String total, String paid, String previousDues) {
        FeeRecord record = new FeeRecord();
        record.setId(5L);
        record.setStudentId(STUDENT_ID);
        record.setTotalAmount(new BigDecimal(total));
        record.setPaidAmount(new BigDecimal(paid));
        record.setPreviousSessionDues(new BigDecimal(previousDues));
        record.setDueDate(LocalDate.of(2024, Month.MAY, 10));
        return record;
    }

    private static Student student(Long classId) {
        Student student = new Student();
        student.setId(STUDENT_ID);
        student.setBranchId(1L);
        student.setName("Aarav Sharma");
        student.setClassId(classId);
        student.setCurrentSession("2024-2025");
        return student;
    }

    @Test
    void recordPaymentRejectsNonPositiveAmountBeforeLocking() {
        assertThatThrownBy(() -> feeLedgerService.recordPayment(STUDENT_ID, BigDecimal.ZERO, "TXN-1", null))
                .isInstanceOf(BusinessRuleException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.INVALID_PAYMENT_AMOUNT);
        verifyNoInteractions(ledgerLockService, feePaymentRepository);
    }

    @Test
    void recordPaymentAppendsLedgerEntryAndRaisesPaidAmount() {
        FeeRecord record = feeRecord("60000", "10000", "0");
        when(ledgerLockService.tryAcquireLockWithRetry(LOCK_KEY)).thenReturn(LOCK_TOKEN);
        when(feeRecordRepository.findByStudentId(STUDENT_ID)).thenReturn(Optional.of(record));
        when(feePaymentRepository.existsByTransactionId("TXN-1")).thenReturn(false);
        when(feePaymentRepository.save(any(FeePayment.class))).thenAnswer(invocation -> invocation.getArgument(0));

        PaymentReceiptDto receipt = feeLedgerService.recordPayment(STUDENT_ID, new BigDecimal("5000"), "TXN-1", "Cash");

        assertThat(receipt.getTotalPaid()).isEqualByComparingTo("15000");
        assertThat(receipt.getTotalOutstanding()).isEqualByComparingTo("45000");
        assertThat(record.getPaidAmount()).isEqualByComparingTo("15000");
        verify(feeRecordRepository).save(record);
        verify(ledgerLockService).releaseAfterCompletion(LOCK_KEY, LOCK_TOKEN);
    }

    @Test
    void recordPaymentRejectsAmountAboveOutstanding() {
        when(ledgerLockService.tryAcquireLockWithRetry(LOCK_KEY)).thenReturn(LOCK_TOKEN);
        when(feeRecordRepository.findByStudentId(STUDENT_ID)).thenReturn(Optional.of(feeRecord("60000", "58000", "0")));
        when(feePaymentRepository.existsByTransactionId("TXN-2")).thenReturn(false);

        assertThatThrownBy(() -> feeLedgerService.recordPayment(STUDENT_ID, new BigDecimal("2500"), "TXN-2", null))
                .isInstanceOf(BusinessRuleException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.PAYMENT_EXCEEDS_OUTSTANDING);
        verify(feePaymentRepository, never()).save(any());
    }

    @Test
    void recordPaymentRejectsDuplicateTransactionId() {
        when(ledgerLockService.tryAcquireLockWithRetry(LOCK_KEY)).thenReturn(LOCK_TOKEN);
        when(feeRecordRepository.findByStudentId(STUDENT_ID)).thenReturn(Optional.of(feeRecord("60000", "0", "0")));
        when(feePaymentRepository.existsByTransactionId("TXN-1")).thenReturn(true);

        assertThatThrownBy(() -> feeLedgerService.recordPayment(STUDENT_ID, new BigDecimal("100"), "TXN-1", null))
                .isInstanceOf(BusinessRuleException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.DUPLICATE_TRANSACTION);
        verify(feeRecordRepository, never()).save(any());
    }

    @Test
    void recordPaymentFailsWhenLedgerIsLocked() {
        when(ledgerLockService.tryAcquireLockWithRetry(LOCK_KEY)).thenReturn(null);

        assertThatThrownBy(() -> feeLedgerService.recordPayment(STUDENT_ID, new BigDecimal("100"), "TXN-3", null))
                .isInstanceOf(BusinessRuleException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.LEDGER_BUSY);
        verifyNoInteractions(feeRecordRepository, feePaymentRepository);
    }

    @Test
    void statementAllocatesPaymentsAcrossMonthlyBreakdown() {
        LocalDate today = LocalDate.of(2024, Month.MAY, 15);
        SchoolClass schoolClass = new SchoolClass();
        schoolClass.setId(10L);
        schoolClass.setFeeTemplateId(20L);
        FeeTemplate template = new FeeTemplate();
        template.setAmount(new BigDecimal("24000"));
        List<MonthlyFee> breakdown = new ArrayList<>();
        for (Month month : List.of(Month.APRIL, Month.MAY, Month.JUNE, Month.JULY, Month.AUGUST, Month.SEPTEMBER,
                Month.OCTOBER, Month.NOVEMBER, Month.DECEMBER, Month.JANUARY, Month.FEBRUARY, Month.MARCH)) {
            breakdown.add(new MonthlyFee(month.name(), new BigDecimal("2000"), new ArrayList<>()));
        }
        template.setMonthlyBreakdown(breakdown);

        when(studentRepository.findById(STUDENT_ID)).thenReturn(Optional.of(student(10L)));
        when(feeRecordRepository.findByStudentId(STUDENT_ID)).thenReturn(Optional.of(feeRecord("24000", "3000", "0")));
        when(academicSessionService.startDateFor(1L, today)).thenReturn(LocalDate.of(2024, Month.APRIL, 1));
        when(schoolClassRepository.findById(10L)).thenReturn(Optional.of(schoolClass));
        when(feeTemplateRepository.findById(20L)).thenReturn(Optional.of(template));

        FeeStatementDto statement = feeLedgerService.getFeeStatement(STUDENT_ID, today);

        assertThat(statement.isMonthlyBreakdownAvailable()).isTrue();
        assertThat(statement.getTotalOutstanding()).isEqualByComparingTo("21000");
        assertThat(statement.getCurrentMonthDue()).isEqualByComparingTo("2000");
        assertThat(statement.getMonthlyDues()).hasSize(12);
        assertThat(statement.getMonthlyDues().get(0).status()).isEqualTo(DueStatus.PAID);
        assertThat(statement.getMonthlyDues().get(1).paid()).isEqualByComparingTo("1000");
        assertThat(statement.getMonthlyDues().get(1).status()).isEqualTo(DueStatus.PARTIALLY_PAID);
        assertThat(statement.getMonthlyDues().get(2).status()).isEqualTo(DueStatus.DUE);
    }

    @Test
    void statementFallsBackToAggregatesWithoutBreakdown() {
        LocalDate today = LocalDate.of(2024, Month.MAY, 15);
        when(studentRepository.findById(STUDENT_ID)).thenReturn(Optional.of(student(null)));
        when(feeRecordRepository.findByStudentId(STUDENT_ID)).thenReturn(Optional.of(feeRecord("10000", "4000", "3000")));
        when(academicSessionService.startDateFor(1L, today)).thenReturn(LocalDate.of(2024, Month.APRIL, 1));

        FeeStatementDto statement = feeLedgerService.getFeeStatement(STUDENT_ID, today);

        assertThat(statement.isMonthlyBreakdownAvailable()).isFalse();
        assertThat(statement.getMonthlyDues()).isEmpty();
        assertThat(statement.getTotalOutstanding()).isEqualByComparingTo("6000");
        assertThat(statement.getPreviousSessionDuesPaid()).isEqualByComparingTo("3000");
        assertThat(statement.getDueDate()).isEqualTo(LocalDate.of(2024, Month.MAY, 10));
    }

    @Test
    void concessionNeverTakesTotalBelowZero() {
        FeeRecord record = feeRecord("1000", "0", "0");
        when(studentRepository.existsById(STUDENT_ID)).thenReturn(true);
        when(ledgerLockService.tryAcquireLockWithRetry(LOCK_KEY)).thenReturn(LOCK_TOKEN);
        when(feeAdjustmentRepository.save(any(FeeAdjustment.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(feeRecordRepository.findByStudentId(STUDENT_ID)).thenReturn(Optional.of(record));

        FeeHistoryEntryDto entry = feeLedgerService.applyAdjustment(STUDENT_ID, FeeAdjustment.Type.CONCESSION,
                new BigDecimal("1500"), "Sibling discount", "principal");

        assertThat(entry.kind()).isEqualTo("CONCESSION");
        assertThat(entry.amount()).isEqualByComparingTo("-1500");
        assertThat(record.getTotalAmount()).isEqualByComparingTo("0");
    }
}
