package com.verticx.finance.payroll.dto;

import com.verticx.finance.payroll.PayrollRecord;
import com.verticx.finance.payroll.StaffMember;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public record PayrollRecordDto(Long id,
                               Long branchId,
                               Long staffId,
                               String staffName,
                               StaffMember.Role staffRole,
                               String month,
                               BigDecimal baseSalary,
                               BigDecimal unpaidLeaveDays,
                               BigDecimal leaveDeductions,
                               BigDecimal manualAdjustmentsTotal,
                               BigDecimal netPayable,
                               PayrollRecord.Status status,
                               OffsetDateTime paidAt,
                               String paidBy) {

    public static PayrollRecordDto from(PayrollRecord record) {
        return new PayrollRecordDto(record.getId(), record.getBranchId(), record.getStaffId(),
                record.getStaffName(), record.getStaffRole(), record.getMonth(), record.getBaseSalary(),
                record.getUnpaidLeaveDays(), record.getLeaveDeductions(), record.getManualAdjustmentsTotal(),
                record.getNetPayable(), record.getStatus(), record.getPaidAt(), record.getPaidBy());
    }
}
