package com.verticx.finance.fee;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyFee {
    private String month; // "April" or "Apr"
    private BigDecimal total;
    private List<FeeComponent> breakdown = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FeeComponent {
        private String component;
        private BigDecimal amount;
    }
}
