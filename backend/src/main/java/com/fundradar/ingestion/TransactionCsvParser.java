package com.fundradar.ingestion;

import com.fundradar.common.RowResult;
import com.fundradar.domain.AssetClass;
import com.fundradar.domain.LedgerTransaction;
import com.fundradar.pricing.MarketSymbolMapper;

import java.io.Reader;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Equity and crypto orders: {@code date, symbol, price, signed_quantity[, market][, currency]}.
 * Positive quantity buys, negative sells. Portuguese broker headers (Data, Ativo, Preço, Quantidade, Mercado)
 * are accepted as well.
 */
public final class TransactionCsvParser {

    private TransactionCsvParser() {
    }

    public static List<RowResult<LedgerTransaction>> parse(Reader input, AssetClass assetClass) {
        if (assetClass == AssetClass.FIXED_INCOME) {
            throw new IllegalArgumentException("Fixed income is imported with BondCsvParser");
        }
        return CsvRowReader.read(input).stream()
                .map(row -> parseRow(row, assetClass))
                .toList();
    }

    static RowResult<LedgerTransaction> parseRow(CsvRow row, AssetClass assetClass) {
        try {
            LedgerTransaction tx = new LedgerTransaction();
            tx.setAssetClass(assetClass);
            tx.setDate(FieldParsers.date(row.get("date", "data"), "date"));
            tx.setSymbol(row.require("symbol", "ativo", "ticker").toUpperCase(Locale.ROOT));
            BigDecimal price = FieldParsers.decimal(row.get("price", "preço", "preco"), "price");
            if (price.signum() < 0) {
                return RowResult.rejected(row.row(), "price must be zero or positive");
            }
            tx.setPrice(price);
            BigDecimal quantity = FieldParsers.decimal(row.get("signed_quantity", "quantity", "quantidade"), "signed_quantity");
            if (quantity.signum() == 0) {
                return RowResult.rejected(row.row(), "signed_quantity must be non-zero");
            }
            tx.setQuantity(quantity);
            tx.setMarket(row.get("market", "mercado"));
            tx.setCurrency(FieldParsers.currency(row.get("currency", "moeda"),
                    MarketSymbolMapper.quoteCurrency(assetClass, tx.getMarket())));
            return RowResult.ok(row.row(), tx);
        } catch (IllegalArgumentException e) {
            return RowResult.rejected(row.row(), e.getMessage());
        }
    }
}
