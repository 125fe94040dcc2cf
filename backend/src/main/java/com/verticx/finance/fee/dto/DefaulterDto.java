package com.verticx.finance.fee.dto;

import java.math.BigDecimal;

public record DefaulterDto(Long studentId, String studentName, Integer rollNo, BigDecimal pendingAmount,
                           String guardianPhone) {
}
