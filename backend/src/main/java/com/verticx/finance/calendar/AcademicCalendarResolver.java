package com.verticx.finance.calendar;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.Month;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolves the month ordering of an academic session anchored at a branch's session start date.
 */
@Component
public class AcademicCalendarResolver {

    public static final int MONTHS_IN_SESSION = 12;

    /**
     * Returns the twelve session months starting at the month of {@code sessionStartDate}, wrapping
     * December to January. Months that wrap belong to the following calendar year.
     */
    public List<SessionMonth> resolveMonths(LocalDate sessionStartDate) {
        Month startMonth = sessionStartDate.getMonth();
        int startYear = sessionStartDate.getYear();
        List<SessionMonth> months = new ArrayList<>(MONTHS_IN_SESSION);
        for (int offset = 0; offset < MONTHS_IN_SESSION; offset++) {
            Month month = startMonth.plus(offset);
            int year = month.getValue() < startMonth.getValue() ? startYear + 1 : startYear;
            months.add(new SessionMonth(month, year, offset + 1));
        }
        return Collections.unmodifiableList(months);
    }

    /**
     * Number of session months that are due as of {@code today}, clamped to [0, 12].
     */
    public int elapsedMonths(LocalDate sessionStartDate, LocalDate today) {
        int startMonth = sessionStartDate.getMonthValue();
        int todayMonth = today.getMonthValue();
        int elapsed;
        if (today.getYear() > sessionStartDate.getYear()) {
            elapsed = (MONTHS_IN_SESSION - startMonth) + todayMonth + 1;
        } else if (today.getYear() == sessionStartDate.getYear()) {
            elapsed = todayMonth - startMonth + 1;
        } else {
            elapsed = 0;
        }
        return Math.min(MONTHS_IN_SESSION, Math.max(0, elapsed));
    }

    /**
     * 1-based position of {@code date}'s month in the session, or 0 when the date lies outside it.
     */
    public int positionOf(LocalDate sessionStartDate, LocalDate date) {
        return resolveMonths(sessionStartDate).stream()
                .filter(m -> m.month() == date.getMonth() && m.year() == date.getYear())
                .mapToInt(SessionMonth::position)
                .findFirst()
                .orElse(0);
    }

    /**
     * The first {@link #elapsedMonths} months of the session.
     */
    public List<SessionMonth> monthsDueSoFar(LocalDate sessionStartDate, LocalDate today) {
        return resolveMonths(sessionStartDate).subList(0, elapsedMonths(sessionStartDate, today));
    }
}
