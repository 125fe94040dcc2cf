package com.verticx.finance.promotion.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record PromotionGroup(@NotEmpty List<Long> studentIds, @NotNull Long targetClassId) {
}
