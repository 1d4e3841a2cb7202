package com.fundradar.ingestion;

import com.fundradar.common.RowResult;
import com.fundradar.domain.BondHolding;
import com.fundradar.domain.Indexer;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BondCsvParserTest {

    private static final String HEADER =
            "title,issuer,quantity,unit_price,invested_value,indexer,percent_indexed,application_date,maturity_date\n";

    @Test
    void parse_rateFormsAndIndexers() {
        String csv = HEADER
                + "CDB Banco X,Banco X,10,1000,,,110% CDI,2024-01-02,2026-01-02\n"
                + "Tesouro IPCA+ 2035,Tesouro Nacional,2,3000,6000,,IPCA + 6%,2024-01-02,2035-05-15\n"
                + "LTN 2027,Tesouro Nacional,,,9000,Prefixado,12.5%,2024-01-02,2027-01-01\n";

        List<RowResult<BondHolding>> rows = BondCsvParser.parse(new StringReader(csv), "CDB");

        assertThat(rows).allMatch(RowResult::isOk);
        BondHolding cdb = rows.get(0).getValue().orElseThrow();
        assertThat(cdb.getIndexer()).isEqualTo(Indexer.CDI);
        assertThat(cdb.getRate()).isEqualByComparingTo("110");
        assertThat(cdb.getInvestedValue()).isEqualByComparingTo("10000");
        assertThat(cdb.getBondType()).isEqualTo("CDB");
        assertThat(cdb.getMaturityDate()).isEqualTo(LocalDate.of(2026, 1, 2));
        BondHolding ipca = rows.get(1).getValue().orElseThrow();
        assertThat(ipca.getIndexer()).isEqualTo(Indexer.IPCA);
        assertThat(ipca.getRate()).isEqualByComparingTo("6");
        BondHolding pre = rows.get(2).getValue().orElseThrow();
        assertThat(pre.getIndexer()).isEqualTo(Indexer.PREFIXADO);
        assertThat(pre.getRate()).isEqualByComparingTo("12.5");
        assertThat(pre.getCurrency()).isEqualTo("BRL");
    }

    @Test
    void parse_rejectsRowsWithoutValueOrWithMaturityBeforeApplication() {
        String csv = HEADER
                + "CDB A,Bank,,,,,100% CDI,2024-01-02,2025-01-02\n"
                + "CDB B,Bank,,,1000,,100% CDI,2024-01-02,2023-01-02\n";

        List<RowResult<BondHolding>> rows = BondCsvParser.parse(new StringReader(csv), "CDB");

        assertThat(rows.get(0).getError().orElseThrow().message()).isEqualTo("invested_value must be positive");
        assertThat(rows.get(1).getError().orElseThrow().message()).isEqualTo("maturity_date is before application_date");
    }
}
