package com.fundradar.domain;

/**
 * Fee record lifecycle: PENDING → CALCULATED → PAID. PAID is terminal.
 */
public enum FeeStatus {
    PENDING,
    CALCULATED,
    PAID
}
