package com.fundradar.ingestion;

import com.fundradar.common.RowResult;
import com.fundradar.domain.BondHolding;
import com.fundradar.domain.Indexer;

import java.io.Reader;
import java.math.BigDecimal;
import java.util.List;

/**
 * Fixed-income holdings: {@code title, issuer, quantity, unit_price, invested_value, indexer, percent_indexed,
 * application_date, maturity_date[, bond_type][, currency]}. {@code percent_indexed} accepts forms like
 * {@code IPCA + 6%} or {@code 110% CDI}; the indexer column may be left out when the rate names it.
 */
public final class BondCsvParser {

    private BondCsvParser() {
    }

    public static List<RowResult<BondHolding>> parse(Reader input, String defaultBondType) {
        return CsvRowReader.read(input).stream()
                .map(row -> parseRow(row, defaultBondType))
                .toList();
    }

    static RowResult<BondHolding> parseRow(CsvRow row, String defaultBondType) {
        try {
            BondHolding bond = new BondHolding();
            bond.setTitle(row.require("title", "título", "titulo"));
            bond.setIssuer(row.get("issuer", "emissor"));
            bond.setBondType(row.get("bond_type", "tipo_de_título") != null ? row.get("bond_type", "tipo_de_título") : defaultBondType);
            bond.setQuantity(FieldParsers.optionalDecimal(row.get("quantity", "quantidade"), "quantity"));
            bond.setUnitPrice(FieldParsers.optionalDecimal(row.get("unit_price", "preço_unitário", "preco_unitario"), "unit_price"));
            BigDecimal invested = FieldParsers.optionalDecimal(row.get("invested_value", "valor_investido"), "invested_value");
            if (invested == null && bond.getQuantity() != null && bond.getUnitPrice() != null) {
                invested = bond.getQuantity().multiply(bond.getUnitPrice());
            }
            if (invested == null || invested.signum() <= 0) {
                return RowResult.rejected(row.row(), "invested_value must be positive");
            }
            bond.setInvestedValue(invested);
            String rateText = row.get("percent_indexed", "rate", "taxa");
            String indexerText = row.get("indexer", "indexador");
            bond.setIndexer(Indexer.parse(indexerText != null ? indexerText : rateText));
            bond.setRate(rateText == null ? BigDecimal.ZERO : FieldParsers.percent(rateText, "percent_indexed"));
            bond.setApplicationDate(FieldParsers.date(row.get("application_date", "data_de_aplicação_resgate", "data"), "application_date"));
            bond.setMaturityDate(FieldParsers.optionalDate(row.get("maturity_date", "vencimento"), "maturity_date"));
            if (bond.getMaturityDate() != null && bond.getMaturityDate().isBefore(bond.getApplicationDate())) {
                return RowResult.rejected(row.row(), "maturity_date is before application_date");
            }
            bond.setCurrency(FieldParsers.currency(row.get("currency"), "BRL"));
            return RowResult.ok(row.row(), bond);
        } catch (IllegalArgumentException e) {
            return RowResult.rejected(row.row(), e.getMessage());
        }
    }
}
