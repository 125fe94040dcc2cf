package com.verticx.finance.promotion;

import com.verticx.finance.fee.FeeRecord;
import com.verticx.finance.fee.FeeTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;

@Component
public class SessionPromotionSettlement {

    static final int DUE_DAY_OF_MONTH = 10;

    /**
     * @param currentRecord  the student's fee record for the closing session, or null if none exists
     * @param targetTemplate fee template of the class the student moves into, or null if it has none
     */
    public PromotionFeeSettlement settle(FeeRecord currentRecord, FeeTemplate targetTemplate, LocalDate today) {
        BigDecimal outstanding = currentRecord == null
                ? BigDecimal.ZERO
                : currentRecord.getTotalAmount().subtract(currentRecord.getPaidAmount()).max(BigDecimal.ZERO);
        BigDecimal templateAmount = targetTemplate == null ? BigDecimal.ZERO : targetTemplate.getAmount();

        return new PromotionFeeSettlement(
                outstanding,
                templateAmount.add(outstanding),
                BigDecimal.ZERO,
                outstanding,
                today.plusMonths(1).withDayOfMonth(DUE_DAY_OF_MONTH));
    }
}
