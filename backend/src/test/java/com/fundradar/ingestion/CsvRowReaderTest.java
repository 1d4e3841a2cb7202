package com.fundradar.ingestion;

import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CsvRowReaderTest {

    @Test
    void read_normalizesHeadersAndNumbersDataRows() {
        String csv = "\uFEFFDate, Investor ID ,Amount\n"
                + "2024-01-02, alice ,100\n"
                + "\n"
                + "2024-01-03,bob,200\n";

        List<CsvRow> rows = CsvRowReader.read(new StringReader(csv));

        assertThat(rows).extracting(CsvRow::row).containsExactly(1, 2);
        assertThat(rows.get(0).values()).containsKeys("date", "investor_id", "amount");
        assertThat(rows.get(0).get("investor_id")).isEqualTo("alice");
        assertThat(rows.get(1).require("amount")).isEqualTo("200");
    }

    @Test
    void get_firstNonBlankAlias() {
        CsvRow row = new CsvRow(1, Map.of("data", "2024-01-02", "date", " "));

        assertThat(row.get("date", "data")).isEqualTo("2024-01-02");
        assertThat(row.get("missing")).isNull();
    }

    @Test
    void normalize() {
        assertThat(CsvRowReader.normalize(" Data de Aplicação/Resgate ")).isEqualTo("data_de_aplicação_resgate");
    }
}
