package com.fundradar.domain;

/**
 * Asset classes held by a fund. EQUITY and CRYPTO are tracked by position ledgers; FIXED_INCOME by bond holdings.
 */
public enum AssetClass {
    EQUITY,
    CRYPTO,
    FIXED_INCOME
}
