package com.verticx.finance.promotion.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record PromotionRequest(@NotEmpty List<Long> studentIds,
                               @NotNull Long targetClassId,
                               @NotBlank String academicSession) {
}
