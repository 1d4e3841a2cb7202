package com.fundradar.marketdata;

import com.fundradar.domain.Indexer;
import com.fundradar.domain.IndexerRate;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BcbIndexerSeriesGatewayTest {

    @Test
    void parseSeries_parsesSgsRows() {
        String json = "[{\"data\":\"01/01/2024\",\"valor\":\"0.42\"},{\"data\":\"01/02/2024\",\"valor\":\"0.83\"}]";

        List<IndexerRate> rates = BcbIndexerSeriesGateway.parseSeries(Indexer.IPCA, json);

        assertThat(rates).hasSize(2);
        assertThat(rates.get(0).getId()).isEqualTo("IPCA:2024-01-01");
        assertThat(rates.get(1).getDate()).isEqualTo(LocalDate.of(2024, 2, 1));
        assertThat(rates.get(1).getValuePct()).isEqualByComparingTo("0.83");
    }

    @Test
    void parseSeries_skipsUnparseableRows() {
        String json = "[{\"data\":\"02/01/2024\",\"valor\":\"0.043739\"},{\"data\":\"bad\",\"valor\":\"1\"},"
                + "{\"data\":\"03/01/2024\",\"valor\":\"\"}]";

        List<IndexerRate> rates = BcbIndexerSeriesGateway.parseSeries(Indexer.CDI, json);

        assertThat(rates).extracting(IndexerRate::getDate).containsExactly(LocalDate.of(2024, 1, 2));
    }

    @Test
    void parseSeries_nonArray_returnsEmpty() {
        assertThat(BcbIndexerSeriesGateway.parseSeries(Indexer.SELIC, "{\"erro\":\"x\"}")).isEmpty();
        assertThat(BcbIndexerSeriesGateway.parseSeries(Indexer.SELIC, null)).isEmpty();
    }
}
