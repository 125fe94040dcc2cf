package com.verticx.finance.calendar;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * One calendar month placed inside an academic session.
 *
 * @param month    calendar month
 * @param year     calendar year the month falls in
 * @param position 1-based position within the session
 */
public record SessionMonth(Month month, int year, int position) {

    public String shortLabel() {
        return month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    public String fullLabel() {
        return month.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}
