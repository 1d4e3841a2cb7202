package com.fundradar.analytics;

import java.time.YearMonth;

/** Return of one calendar month from the previous month's last value (the first value for the first month). */
public record MonthlyReturn(YearMonth month, double startValue, double endValue, double returnPct) {
}
