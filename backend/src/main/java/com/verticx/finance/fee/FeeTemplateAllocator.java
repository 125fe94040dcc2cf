package com.verticx.finance.fee;

import com.verticx.finance.calendar.SessionMonth;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Spreads a fee template's monthly breakdown over the months of a session.
 */
@Component
public class FeeTemplateAllocator {

    /**
     * Returns short month label to due amount, in session order. Months missing from the breakdown
     * are due 0. Empty when the template has no monthly breakdown, in which case only aggregate
     * fee-record figures are meaningful.
     */
    public Optional<Map<String, BigDecimal>> allocate(FeeTemplate template, List<SessionMonth> months) {
        if (template == null || !template.hasMonthlyBreakdown()) {
            return Optional.empty();
        }
        Map<String, BigDecimal> dues = new LinkedHashMap<>();
        for (SessionMonth month : months) {
            dues.put(month.shortLabel(), dueFor(template.getMonthlyBreakdown(), month));
        }
        return Optional.of(dues);
    }

    private BigDecimal dueFor(List<MonthlyFee> breakdown, SessionMonth month) {
        String key = normalize(month.shortLabel());
        return breakdown.stream()
                .filter(fee -> fee.getMonth() != null && normalize(fee.getMonth()).equals(key))
                .map(MonthlyFee::getTotal)
                .filter(total -> total != null)
                .findFirst()
                .map(total -> total.max(BigDecimal.ZERO))
                .orElse(BigDecimal.ZERO);
    }

    private static String normalize(String label) {
        String trimmed = label.trim();
        return (trimmed.length() > 3 ? trimmed.substring(0, 3) : trimmed).toLowerCase(Locale.ROOT);
    }
}
