package com.verticx.finance.promotion.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;

public record StartSessionRequest(@NotNull LocalDate startDate,
                                  @NotBlank String label,
                                  List<@Valid PromotionGroup> promotions) {
}
