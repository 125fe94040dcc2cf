package com.verticx.finance.promotion.dto;

import java.time.LocalDate;
import java.util.List;

public record SessionStartResult(Long branchId, String label, LocalDate startDate, List<PromotionResult> promotions) {
}
