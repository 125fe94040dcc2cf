package com.verticx.finance.fee.dto;

import com.verticx.finance.fee.FeeAdjustment;
import com.verticx.finance.fee.FeeHistoryItem;
import com.verticx.finance.fee.FeePayment;

import java.math.BigDecimal;
import java.time.LocalDate;

public record FeeHistoryEntryDto(String kind, BigDecimal amount, LocalDate date, String description, String reference) {

    public static FeeHistoryEntryDto from(FeeHistoryItem item) {
        if (item instanceof FeePayment) {
            FeePayment payment = (FeePayment) item;
            return new FeeHistoryEntryDto("PAYMENT", payment.getAmount(), payment.getDate(),
                    payment.getDescription(), payment.getTransactionId());
        }
        FeeAdjustment adjustment = (FeeAdjustment) item;
        return new FeeHistoryEntryDto(adjustment.getType().name(), adjustment.getAmount(), adjustment.getDate(),
                adjustment.getDescription(), adjustment.getAdjustedBy());
    }
}
