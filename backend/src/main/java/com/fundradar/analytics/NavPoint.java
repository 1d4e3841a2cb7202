package com.fundradar.analytics;

import java.time.LocalDate;

/** One observation of a value series (fund NAV or benchmark close). */
public record NavPoint(LocalDate date, double value) {
}
