package com.verticx.finance.promotion.dto;

import java.util.List;

public record PromotionResult(List<Long> moved, List<Long> skipped) {
}
