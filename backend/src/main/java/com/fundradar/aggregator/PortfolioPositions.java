package com.fundradar.aggregator;

import com.fundradar.bond.BondValuation;
import com.fundradar.ledger.PositionValuation;

import java.time.LocalDate;
import java.util.List;

/** Open positions of every asset class as of a date, each in its own currency. */
public record PortfolioPositions(
        LocalDate asOf,
        List<PositionValuation> equities,
        List<PositionValuation> crypto,
        List<BondValuation> bonds
) {
}
