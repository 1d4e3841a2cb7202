package com.fundradar.ledger;

import com.fundradar.common.RowError;
import com.fundradar.domain.AssetClass;

import java.util.List;
import java.util.Set;

/**
 * Result of recording a batch of transactions: how many were applied, which rows were rejected and which asset
 * classes needed a full rebuild because a transaction arrived out of order.
 */
public record LedgerUpdateReport(int applied, List<RowError> rejected, Set<AssetClass> rebuilt) {
}
