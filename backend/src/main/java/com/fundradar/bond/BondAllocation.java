package com.fundradar.bond;

import java.math.BigDecimal;

/**
 * Current value and P&amp;L of one bucket (indexer or bond type) with its share of the bond portfolio.
 */
public record BondAllocation(String key, BigDecimal currentValue, BigDecimal pnl, BigDecimal allocationPct, int bonds) {
}
