package com.verticx.finance.fee.dto;

import com.verticx.finance.fee.FeeTemplate;
import com.verticx.finance.fee.MonthlyFee;

import java.math.BigDecimal;
import java.util.List;

public record FeeTemplateDto(Long id, Long branchId, String name, int gradeLevel, BigDecimal amount,
                             List<MonthlyFee> monthlyBreakdown) {

    public static FeeTemplateDto from(FeeTemplate template) {
        return new FeeTemplateDto(template.getId(), template.getBranchId(), template.getName(),
                template.getGradeLevel(), template.getAmount(), template.getMonthlyBreakdown());
    }
}
