package com.verticx.finance.fee.dto;

import java.math.BigDecimal;

public record ClassFeeSummaryDto(Long classId, String className, long studentCount, long defaulterCount,
                                 BigDecimal pendingAmount) {
}
