package com.gnucash.matcher.match;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Allowed distance between a payment and the document it settles, measured as
 * {@code paymentDate - documentDate} in days. A bounded window accepts a difference {@code d} when
 * {@code -daysBefore <= d <= daysAfter}; an unbounded window accepts every pair of dates.
 */
public final class DateWindow {

    private static final DateWindow UNBOUNDED = new DateWindow(null, null);

    private final Integer daysBefore;
    private final Integer daysAfter;

    private DateWindow(Integer daysBefore, Integer daysAfter) {
        this.daysBefore = daysBefore;
        this.daysAfter = daysAfter;
    }

    public static DateWindow unbounded() {
        return UNBOUNDED;
    }

    public static DateWindow of(int daysBefore, int daysAfter) {
        return new DateWindow(daysBefore, daysAfter);
    }

    /** Date filtering only applies when both bounds are given. */
    public static DateWindow fromBounds(Integer daysBefore, Integer daysAfter) {
        if (daysBefore == null || daysAfter == null) {
            return UNBOUNDED;
        }
        return of(daysBefore.intValue(), daysAfter.intValue());
    }

    public boolean isBounded() {
        return daysBefore != null;
    }

    /** True when no pair of dates can satisfy the window. */
    public boolean isEmpty() {
        return isBounded() && -(long) daysBefore > daysAfter;
    }

    public Integer getDaysBefore() {
        return daysBefore;
    }

    public Integer getDaysAfter() {
        return daysAfter;
    }

    public boolean contains(LocalDate paymentDate, LocalDate documentDate) {
        if (!isBounded()) {
            return true;
        }
        long diff = ChronoUnit.DAYS.between(documentDate, paymentDate);
        return -(long) daysBefore <= diff && diff <= daysAfter;
    }

    @Override
    public String toString() {
        return isBounded() ? "[-" + daysBefore + ", +" + daysAfter + "] days" : "unbounded";
    }
}
