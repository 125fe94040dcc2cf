package com.verticx.finance.payroll;

import com.verticx.finance.common.exception.BusinessRuleException;
import com.verticx.finance.common.exception.ErrorCode;
import com.verticx.finance.common.exception.ResourceNotFoundException;
import com.verticx.finance.payroll.dto.ManualAdjustmentDto;
import com.verticx.finance.payroll.dto.PayrollProcessResult;
import com.verticx.finance.payroll.dto.PayrollRecordDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

@Service
public class PayrollService {

    private static final Logger logger = LoggerFactory.getLogger(PayrollService.class);

    private final StaffMemberRepository staffMemberRepository;
    private final PayrollRecordRepository payrollRecordRepository;
    private final LeaveApplicationRepository leaveApplicationRepository;
    private final ManualSalaryAdjustmentRepository manualSalaryAdjustmentRepository;
    private final PayrollSettlementCalculator settlementCalculator;

    public PayrollService(StaffMemberRepository staffMemberRepository,
                          PayrollRecordRepository payrollRecordRepository,
                          LeaveApplicationRepository leaveApplicationRepository,
                          ManualSalaryAdjustmentRepository manualSalaryAdjustmentRepository,
                          PayrollSettlementCalculator settlementCalculator) {
        this.staffMemberRepository = staffMemberRepository;
        this.payrollRecordRepository = payrollRecordRepository;
        this.leaveApplicationRepository = leaveApplicationRepository;
        this.manualSalaryAdjustmentRepository = manualSalaryAdjustmentRepository;
        this.settlementCalculator = settlementCalculator;
    }

    /**
     * Payroll sheet for every non-principal staff member of the branch. Paid records are returned as
     * stored; all others are recalculated and saved as drafts.
     */
    @Transactional
    public List<PayrollRecordDto> getStaffPayrollForMonth(Long branchId, YearMonth month) {
        return staffMemberRepository.findByBranchIdAndRoleNotOrderByNameAsc(branchId, StaffMember.Role.PRINCIPAL)
                .stream()
                .map(staff -> PayrollRecordDto.from(refreshRecord(staff, month)))
                .toList();
    }

    /**
     * Recalculates the branch's unpaid drafts for {@code month}.
     *
     * @return number of drafts written
     */
    @Transactional
    public int refreshDrafts(Long branchId, YearMonth month) {
        int refreshed = 0;
        for (StaffMember staff : staffMemberRepository.findByBranchIdAndRoleNotOrderByNameAsc(branchId, StaffMember.Role.PRINCIPAL)) {
            if (!refreshRecord(staff, month).isFrozen()) {
                refreshed++;
            }
        }
        return refreshed;
    }

    @Transactional
    public PayrollProcessResult processPayroll(Long branchId, List<Long> recordIds, String processedBy) {
        List<Long> processed = new ArrayList<>();
        List<Long> alreadyPaid = new ArrayList<>();
        List<Long> skipped = new ArrayList<>();

        for (Long recordId : new LinkedHashSet<>(recordIds)) {
            Optional<PayrollRecord> found = payrollRecordRepository.findByIdForUpdate(recordId);
            if (found.isEmpty() || !found.get().getBranchId().equals(branchId)) {
                logger.warn("Payroll record {} not found in branch {}, skipping", recordId, branchId);
                skipped.add(recordId);
                continue;
            }
            PayrollRecord record = found.get();
            if (record.isFrozen()) {
                alreadyPaid.add(recordId);
            } else if (record.getStatus() == PayrollRecord.Status.SALARY_NOT_SET) {
                skipped.add(recordId);
            } else {
                pay(record, processedBy);
                processed.add(recordId);
            }
        }
        logger.info("Payroll batch for branch {} by {}: {} paid, {} already paid, {} skipped",
                branchId, processedBy, processed.size(), alreadyPaid.size(), skipped.size());
        return new PayrollProcessResult(processed, alreadyPaid, skipped);
    }

    @Transactional
    public PayrollRecordDto markPaid(Long recordId, String processedBy) {
        PayrollRecord record = payrollRecordRepository.findByIdForUpdate(recordId)
                .orElseThrow(() -> new ResourceNotFoundException("PayrollRecord", recordId));
        if (record.isFrozen()) {
            throw new BusinessRuleException(ErrorCode.FROZEN_RECORD_CONFLICT,
                    "Payroll record " + recordId + " was already paid by " + record.getPaidBy());
        }
        if (record.getStatus() == PayrollRecord.Status.SALARY_NOT_SET) {
            throw new BusinessRuleException(ErrorCode.SALARY_NOT_SET,
                    "Staff member " + record.getStaffName() + " has no base salary set");
        }
        pay(record, processedBy);
        logger.info("Payroll record {} marked paid by {}", recordId, processedBy);
        return PayrollRecordDto.from(record);
    }

    @Transactional
    public ManualAdjustmentDto addManualAdjustment(Long staffId, YearMonth month, BigDecimal amount,
                                                   String reason, String adjustedBy) {
        StaffMember staff = staffMemberRepository.findById(staffId)
                .orElseThrow(() -> new ResourceNotFoundException("StaffMember", staffId));
        Optional<PayrollRecord> existing = payrollRecordRepository.findByStaffIdAndMonth(staffId, month.toString())
                .flatMap(record -> payrollRecordRepository.findByIdForUpdate(record.getId()));
        if (existing.isPresent() && existing.get().isFrozen()) {
            throw new BusinessRuleException(ErrorCode.FROZEN_RECORD_CONFLICT,
                    "Payroll for " + staff.getName() + " in " + month + " is already paid");
        }

        ManualSalaryAdjustment adjustment = manualSalaryAdjustmentRepository.save(new ManualSalaryAdjustment(
                staff.getBranchId(), staffId, month, amount, reason, adjustedBy, OffsetDateTime.now()));
        if (existing.isPresent()) {
            refreshRecord(staff, month);
        }
        logger.info("Manual salary adjustment of {} for staff {} in {} by {}", amount, staffId, month, adjustedBy);
        return ManualAdjustmentDto.from(adjustment);
    }

    private PayrollRecord refreshRecord(StaffMember staff, YearMonth month) {
        PayrollRecord record = payrollRecordRepository.findByStaffIdAndMonth(staff.getId(), month.toString())
                .orElse(null);
        if (record != null && record.isFrozen()) {
            return record;
        }
        if (record == null) {
            record = new PayrollRecord();
            record.setBranchId(staff.getBranchId());
            record.setStaffId(staff.getId());
            record.setMonth(month.toString());
        }
        record.setStaffName(staff.getName());
        record.setStaffRole(staff.getRole());

        PayrollSettlement settlement = settlementCalculator.calculate(
                staff.getSalary(),
                month,
                leaveApplicationRepository.findByApplicantIdAndStatus(staff.getId(), LeaveApplication.Status.APPROVED),
                manualSalaryAdjustmentRepository.findByStaffIdAndMonth(staff.getId(), month.toString()));
        record.apply(settlement);
        return payrollRecordRepository.save(record);
    }

    private void pay(PayrollRecord record, String processedBy) {
        record.setStatus(PayrollRecord.Status.PAID);
        record.setPaidAt(OffsetDateTime.now());
        record.setPaidBy(processedBy);
        payrollRecordRepository.save(record);
    }
}
