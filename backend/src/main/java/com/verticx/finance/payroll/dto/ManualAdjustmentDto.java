package com.verticx.finance.payroll.dto;

import com.verticx.finance.payroll.ManualSalaryAdjustment;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public record ManualAdjustmentDto(Long id, Long staffId, String month, BigDecimal amount, String reason,
                                  String adjustedBy, OffsetDateTime adjustedAt) {

    public static ManualAdjustmentDto from(ManualSalaryAdjustment adjustment) {
        return new ManualAdjustmentDto(adjustment.getId(), adjustment.getStaffId(), adjustment.getMonth(),
                adjustment.getAmount(), adjustment.getReason(), adjustment.getAdjustedBy(), adjustment.getAdjustedAt());
    }
}
