package com.verticx.finance.fee.dto;

import java.math.BigDecimal;

public record MonthlyCollectionDto(String month, int year, BigDecimal paid, BigDecimal pending) {
}
