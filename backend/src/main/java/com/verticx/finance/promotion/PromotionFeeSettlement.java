package com.verticx.finance.promotion;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Fee record values for a student entering a new session. Unpaid balance from the closing session
 * is carried into both {@code newTotal} and {@code previousSessionDues}.
 */
public record PromotionFeeSettlement(BigDecimal outstandingBalance,
                                     BigDecimal newTotal,
                                     BigDecimal paidAmount,
                                     BigDecimal previousSessionDues,
                                     LocalDate dueDate) {
}
