package com.fundradar.ingestion;

import com.fundradar.common.RowResult;
import com.fundradar.domain.CashFlow;
import com.fundradar.domain.CashFlowType;

import java.io.Reader;
import java.math.BigDecimal;
import java.util.List;

/**
 * Investor deposits and withdrawals: {@code date, investor_id, investor_name, type, amount, currency,
 * amount_in_base_currency, description}.
 */
public final class CashFlowCsvParser {

    private CashFlowCsvParser() {
    }

    public static List<RowResult<CashFlow>> parse(Reader input, String baseCurrency) {
        return CsvRowReader.read(input).stream()
                .map(row -> parseRow(row, baseCurrency))
                .toList();
    }

    static RowResult<CashFlow> parseRow(CsvRow row, String baseCurrency) {
        try {
            CashFlow flow = new CashFlow();
            flow.setDate(FieldParsers.date(row.get("date"), "date"));
            flow.setInvestorId(row.require("investor_id"));
            flow.setInvestorName(row.get("investor_name"));
            flow.setType(CashFlowType.parse(row.require("type")));
            BigDecimal amount = FieldParsers.decimal(row.get("amount"), "amount");
            if (amount.signum() <= 0) {
                return RowResult.rejected(row.row(), "amount must be positive");
            }
            flow.setAmount(amount);
            flow.setCurrency(FieldParsers.currency(row.get("currency"), baseCurrency));
            flow.setAmountInBaseCurrency(FieldParsers.optionalDecimal(
                    row.get("amount_in_base_currency", "amount_brl"), "amount_in_base_currency"));
            flow.setDescription(row.get("description"));
            return RowResult.ok(row.row(), flow);
        } catch (IllegalArgumentException e) {
            return RowResult.rejected(row.row(), e.getMessage());
        }
    }
}
