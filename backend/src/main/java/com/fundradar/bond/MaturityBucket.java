package com.fundradar.bond;

import java.math.BigDecimal;
import java.time.YearMonth;

public record MaturityBucket(YearMonth month, BigDecimal valueMaturing, int bonds) {
}
