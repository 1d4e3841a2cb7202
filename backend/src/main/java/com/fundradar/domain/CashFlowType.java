package com.fundradar.domain;

import java.util.Locale;

public enum CashFlowType {
    DEPOSIT,
    WITHDRAWAL;

    public static CashFlowType parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("cash flow type is required");
        }
        return switch (value.strip().toLowerCase(Locale.ROOT)) {
            case "deposit", "deposito", "depósito" -> DEPOSIT;
            case "withdrawal", "withdraw", "resgate", "saque" -> WITHDRAWAL;
            default -> throw new IllegalArgumentException("Unknown cash flow type: " + value);
        };
    }
}
