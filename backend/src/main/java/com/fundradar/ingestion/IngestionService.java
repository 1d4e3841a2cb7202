package com.fundradar.ingestion;

import com.fundradar.bond.BondPortfolioService;
import com.fundradar.common.RowError;
import com.fundradar.common.RowResult;
import com.fundradar.context.PortfolioContext;
import com.fundradar.domain.AssetClass;
import com.fundradar.domain.BondHolding;
import com.fundradar.domain.CashFlow;
import com.fundradar.domain.FeeRecord;
import com.fundradar.domain.LedgerTransaction;
import com.fundradar.fund.CashLedger;
import com.fundradar.fund.FeeEngine;
import com.fundradar.ledger.LedgerUpdateReport;
import com.fundradar.ledger.PositionLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.Reader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Imports CSV files into a portfolio. Malformed rows are reported and skipped; valid rows are recorded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    private final PositionLedgerService positionLedgerService;
    private final BondPortfolioService bondPortfolioService;
    private final CashLedger cashLedger;
    private final FeeEngine feeEngine;

    public ImportReport importTransactions(PortfolioContext ctx, Reader input, AssetClass assetClass, String source) {
        List<RowResult<LedgerTransaction>> rows = TransactionCsvParser.parse(input, assetClass);
        LedgerUpdateReport update = positionLedgerService.recordAll(ctx, rows);
        return report(source, rows.size(), update.applied(), update.rejected());
    }

    public ImportReport importBonds(PortfolioContext ctx, Reader input, String bondType, String source) {
        List<RowResult<BondHolding>> rows = BondCsvParser.parse(input, bondType);
        List<RowError> rejected = new ArrayList<>();
        List<BondHolding> valid = new ArrayList<>();
        for (RowResult<BondHolding> row : rows) {
            row.getValue().ifPresent(valid::add);
            row.getError().ifPresent(rejected::add);
        }
        List<BondHolding> stored = valid.isEmpty() ? List.of() : bondPortfolioService.addHoldings(ctx, valid);
        return report(source, rows.size(), stored.size(), rejected);
    }

    public ImportReport importCashFlows(PortfolioContext ctx, Reader input, String source) {
        List<RowResult<CashFlow>> rows = CashFlowCsvParser.parse(input, ctx.baseCurrency());
        List<RowError> rejected = cashLedger.addAll(ctx, rows);
        return report(source, rows.size(), rows.size() - rejected.size(), rejected);
    }

    public ImportReport importFeeRecords(PortfolioContext ctx, Reader input, String source) {
        List<RowResult<FeeRecord>> rows = FeeRecordCsvParser.parse(input, ctx.baseCurrency());
        List<RowError> rejected = feeEngine.importRecords(ctx, rows);
        return report(source, rows.size(), rows.size() - rejected.size(), rejected);
    }

    private ImportReport report(String source, int rows, int stored, List<RowError> rejected) {
        List<RowError> sorted = new ArrayList<>(rejected);
        sorted.sort(Comparator.comparingInt(RowError::row));
        if (!sorted.isEmpty()) {
            log.warn("{}: {} of {} row(s) rejected, first at row {}: {}", source, sorted.size(), rows,
                    sorted.get(0).row(), sorted.get(0).message());
        }
        log.info("{}: imported {} of {} row(s)", source, stored, rows);
        return new ImportReport(source, rows, stored, List.copyOf(sorted));
    }
}
