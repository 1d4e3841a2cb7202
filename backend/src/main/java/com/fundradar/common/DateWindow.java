package com.fundradar.common;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive calendar date range [start, end].
 */
public record DateWindow(LocalDate start, LocalDate end) {

    public DateWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }

    public long days() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    /**
     * Splits into consecutive, non-overlapping windows of at most {@code batchDays} days each.
     */
    public List<DateWindow> split(int batchDays) {
        if (batchDays <= 0) {
            throw new IllegalArgumentException("batchDays must be positive");
        }
        List<DateWindow> windows = new ArrayList<>();
        LocalDate cursor = start;
        while (!cursor.isAfter(end)) {
            LocalDate windowEnd = cursor.plusDays(batchDays - 1L);
            if (windowEnd.isAfter(end)) {
                windowEnd = end;
            }
            windows.add(new DateWindow(cursor, windowEnd));
            cursor = windowEnd.plusDays(1);
        }
        return windows;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
