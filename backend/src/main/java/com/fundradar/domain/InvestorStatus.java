package com.fundradar.domain;

public enum InvestorStatus {
    ACTIVE,
    INACTIVE
}
