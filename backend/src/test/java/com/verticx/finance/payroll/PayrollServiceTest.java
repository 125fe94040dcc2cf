package com.verticx.finance.payroll;

import com.verticx.finance.common.exception.BusinessRuleException;
import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.payroll.dto.PayrollProcessResult;
import com.verticx.finance.payroll.dto.PayrollRecordDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PayrollServiceTest {

    private static final Long BRANCH_ID = 1L;
    private static final YearMonth MARCH = YearMonth.of(2024, 3);

    @Mock
    private StaffMemberRepository staffMemberRepository;
    @Mock
    private PayrollRecordRepository payrollRecordRepository;
    @Mock
    private LeaveApplicationRepository leaveApplicationRepository;
    @Mock
    private ManualSalaryAdjustmentRepository manualSalaryAdjustmentRepository;

    private PayrollService payrollService;

    @BeforeEach
    void setUp() {
        payrollService = new PayrollService(staffMemberRepository, payrollRecordRepository, leaveApplicationRepository,
                manualSalaryAdjustmentRepository, new PayrollSettlementCalculator());
    }

    private static StaffMember teacher() {
        StaffMember staff = new StaffMember();
        staff.setId(7L);
        staff.setBranchId(BRANCH_ID);
        staff.setName("Rohan Mehta");
        staff.setRole(StaffMember.Role.TEACHER);
        staff.setSalary(new BigDecimal("30000"));
        return staff;
    }

    private static PayrollRecord record(Long id, PayrollRecord.Status status) {
        PayrollRecord record = new PayrollRecord();
        record.setId(id);
        record.setBranchId(BRANCH_ID);
        record.setStaffId(7L);
        record.setStaffName("Rohan Mehta");
        record.setMonth(MARCH.toString());
        record.setStatus(status);
        record.setNetPayable(new BigDecimal("25000"));
        return record;
    }

    @Test
    void paidRecordIsReturnedWithoutRecalculation() {
        PayrollRecord paid = record(3L, PayrollRecord.Status.PAID);
        when(staffMemberRepository.findByBranchIdAndRoleNotOrderByNameAsc(BRANCH_ID, StaffMember.Role.PRINCIPAL))
                .thenReturn(List.of(teacher()));
        when(payrollRecordRepository.findByStaffIdAndMonth(7L, "2024-03")).thenReturn(Optional.of(paid));

        List<PayrollRecordDto> sheet = payrollService.getStaffPayrollForMonth(BRANCH_ID, MARCH);

        assertThat(sheet).singleElement().satisfies(dto -> {
            assertThat(dto.status()).isEqualTo(PayrollRecord.Status.PAID);
            assertThat(dto.netPayable()).isEqualByComparingTo("25000");
        });
        verify(payrollRecordRepository, never()).save(any());
        verifyNoInteractions(leaveApplicationRepository, manualSalaryAdjustmentRepository);
    }

    @Test
    void draftIsCalculatedFromApprovedLeaves() {
        LeaveApplication leave = PayrollSettlementCalculatorTest.leave("2024-03-04", "2024-03-05", false,
                LeaveApplication.Status.APPROVED);
        when(staffMemberRepository.findByBranchIdAndRoleNotOrderByNameAsc(BRANCH_ID, StaffMember.Role.PRINCIPAL))
                .thenReturn(List.of(teacher()));
        when(payrollRecordRepository.findByStaffIdAndMonth(7L, "2024-03")).thenReturn(Optional.empty());
        when(leaveApplicationRepository.findByApplicantIdAndStatus(7L, LeaveApplication.Status.APPROVED))
                .thenReturn(List.of(leave));
        when(manualSalaryAdjustmentRepository.findByStaffIdAndMonth(7L, "2024-03")).thenReturn(List.of());
        when(payrollRecordRepository.save(any(PayrollRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        PayrollRecordDto dto = payrollService.getStaffPayrollForMonth(BRANCH_ID, MARCH).get(0);

        assertThat(dto.status()).isEqualTo(PayrollRecord.Status.PENDING);
        assertThat(dto.month()).isEqualTo("2024-03");
        assertThat(dto.leaveDeductions()).isEqualByComparingTo("2000");
        assertThat(dto.netPayable()).isEqualByComparingTo("28000");
    }

    @Test
    void processingTheSameBatchTwiceIsIdempotent() {
        PayrollRecord pending = record(1L, PayrollRecord.Status.PENDING);
        PayrollRecord paid = record(2L, PayrollRecord.Status.PAID);
        PayrollRecord salaryNotSet = record(3L, PayrollRecord.Status.SALARY_NOT_SET);
        when(payrollRecordRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(pending));
        when(payrollRecordRepository.findByIdForUpdate(2L)).thenReturn(Optional.of(paid));
        when(payrollRecordRepository.findByIdForUpdate(3L)).thenReturn(Optional.of(salaryNotSet));
        when(payrollRecordRepository.findByIdForUpdate(4L)).thenReturn(Optional.empty());

        PayrollProcessResult first = payrollService.processPayroll(BRANCH_ID, List.of(1L, 2L, 3L, 4L), "principal");
        PayrollProcessResult second = payrollService.processPayroll(BRANCH_ID, List.of(1L), "principal");

        assertThat(first.processed()).containsExactly(1L);
        assertThat(first.alreadyPaid()).containsExactly(2L);
        assertThat(first.skipped()).containsExactly(3L, 4L);
        assertThat(pending.getStatus()).isEqualTo(PayrollRecord.Status.PAID);
        assertThat(pending.getPaidBy()).isEqualTo("principal");
        assertThat(second.processed()).isEmpty();
        assertThat(second.alreadyPaid()).containsExactly(1L);
        verify(payrollRecordRepository, times(1)).save(pending);
    }

    @Test
    void markPaidRejectsFrozenRecord() {
        when(payrollRecordRepository.findByIdForUpdate(2L)).thenReturn(Optional.of(record(2L, PayrollRecord.Status.PAID)));

        assertThatThrownBy(() -> payrollService.markPaid(2L, "principal"))
                .isInstanceOf(BusinessRuleException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.FROZEN_RECORD_CONFLICT);
        verify(payrollRecordRepository, never()).save(any());
    }

    @Test
    void markPaidRejectsRecordWithoutSalary() {
        when(payrollRecordRepository.findByIdForUpdate(3L))
                .thenReturn(Optional.of(record(3L, PayrollRecord.Status.SALARY_NOT_SET)));

        assertThatThrownBy(() -> payrollService.markPaid(3L, "principal"))
                .isInstanceOf(BusinessRuleException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.SALARY_NOT_SET);
    }

    @Test
    void adjustmentAgainstPaidMonthIsRejected() {
        PayrollRecord paid = record(9L, PayrollRecord.Status.PAID);
        when(staffMemberRepository.findById(7L)).thenReturn(Optional.of(teacher()));
        when(payrollRecordRepository.findByStaffIdAndMonth(7L, "2024-03")).thenReturn(Optional.of(paid));
        when(payrollRecordRepository.findByIdForUpdate(9L)).thenReturn(Optional.of(paid));

        assertThatThrownBy(() -> payrollService.addManualAdjustment(7L, MARCH, new BigDecimal("500"), "bonus", "principal"))
                .isInstanceOf(BusinessRuleException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.FROZEN_RECORD_CONFLICT);
        verify(manualSalaryAdjustmentRepository, never()).save(any());
    }
}
