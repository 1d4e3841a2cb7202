package com.fundradar.ledger;

import com.fundradar.domain.AssetClass;
import com.fundradar.domain.LedgerPosition;
import com.fundradar.domain.LedgerTransaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PositionLedgerTest {

    private static final LocalDate D1 = LocalDate.of(2024, 1, 10);
    private static final LocalDate D2 = LocalDate.of(2024, 2, 15);
    private static final LocalDate D3 = LocalDate.of(2024, 3, 20);

    private static long seq = 0;

    private static LedgerTransaction tx(String symbol, LocalDate date, String qty, String price) {
        LedgerTransaction t = new LedgerTransaction();
        t.setId(symbol + "-" + (++seq));
        t.setAssetClass(AssetClass.EQUITY);
        t.setSymbol(symbol);
        t.setDate(date);
        t.setQuantity(new BigDecimal(qty));
        t.setPrice(new BigDecimal(price));
        t.setCurrency("BRL");
        t.setMarket("Nacional");
        t.setSequence(seq);
        return t;
    }

    private static PositionLedger ledger(OversellPolicy policy) {
        return new PositionLedger("fund-1", AssetClass.EQUITY, policy);
    }

    @Test
    @DisplayName("buys average the cost, a sell books realized P&L at the average")
    void weightedAverageCost() {
        PositionLedger ledger = ledger(OversellPolicy.REJECT);

        ledger.apply(tx("ITSA4", D1, "1000", "14.00"));
        ledger.apply(tx("ITSA4", D2, "500", "14.45"));
        PositionLedger.Outcome sell = ledger.apply(tx("ITSA4", D3, "-100", "15.60"));

        assertThat(sell.applied()).isTrue();
        LedgerPosition p = ledger.position("ITSA4").orElseThrow();
        assertThat(p.getQuantity()).isEqualByComparingTo("1400");
        assertThat(p.getAvgCost()).isEqualByComparingTo("14.15");
        assertThat(p.getRealizedPnl()).isEqualByComparingTo("145");
        assertThat(p.getTotalInvested()).isEqualByComparingTo("19810");
        assertThat(p.getLastTradePrice()).isEqualByComparingTo("15.60");
        assertThat(p.getFirstTransactionDate()).isEqualTo(D1);
        assertThat(p.getLastTransactionDate()).isEqualTo(D3);
        assertThat(p.getTransactionCount()).isEqualTo(3);
        assertThat(p.getId()).isEqualTo("fund-1:EQUITY:ITSA4");
    }

    @Test
    @DisplayName("replay result does not depend on input order")
    void replayIsOrderIndependent() {
        List<LedgerTransaction> txs = List.of(
                tx("ITSA4", D1, "1000", "14.00"),
                tx("ITSA4", D2, "500", "14.45"),
                tx("ITSA4", D3, "-100", "15.60"),
                tx("PETR4", D1, "200", "36.00"),
                tx("PETR4", D3, "-50", "38.00"));
        List<LedgerTransaction> shuffled = new ArrayList<>(txs);
        Collections.reverse(shuffled);

        PositionLedger a = PositionLedger.replay("fund-1", AssetClass.EQUITY, OversellPolicy.REJECT, txs).ledger();
        PositionLedger b = PositionLedger.replay("fund-1", AssetClass.EQUITY, OversellPolicy.REJECT, shuffled).ledger();

        for (String symbol : List.of("ITSA4", "PETR4")) {
            LedgerPosition pa = a.position(symbol).orElseThrow();
            LedgerPosition pb = b.position(symbol).orElseThrow();
            assertThat(pb.getQuantity()).isEqualByComparingTo(pa.getQuantity());
            assertThat(pb.getAvgCost()).isEqualByComparingTo(pa.getAvgCost());
            assertThat(pb.getRealizedPnl()).isEqualByComparingTo(pa.getRealizedPnl());
        }
        assertThat(a.position("PETR4").orElseThrow().getRealizedPnl()).isEqualByComparingTo("100");
        assertThat(a.lastAppliedDate()).isEqualTo(D3);
    }

    @Test
    void oversell_rejected_leavesPositionUntouched() {
        PositionLedger ledger = ledger(OversellPolicy.REJECT);
        ledger.apply(tx("BBAS3", D1, "10", "50"));

        PositionLedger.Outcome outcome = ledger.apply(tx("BBAS3", D2, "-20", "55"));

        assertThat(outcome.applied()).isFalse();
        assertThat(outcome.error()).contains("exceeds held quantity");
        LedgerPosition p = ledger.position("BBAS3").orElseThrow();
        assertThat(p.getQuantity()).isEqualByComparingTo("10");
        assertThat(p.getRealizedPnl()).isEqualByComparingTo("0");
        assertThat(p.getTransactionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("short allowed: the short opens at the sell price and the covering buy realizes its P&L")
    void oversell_allowShort() {
        PositionLedger ledger = ledger(OversellPolicy.ALLOW_SHORT);
        ledger.apply(tx("BBAS3", D1, "10", "50"));

        ledger.apply(tx("BBAS3", D2, "-20", "55"));
        LedgerPosition shortPos = ledger.position("BBAS3").orElseThrow();
        assertThat(shortPos.getQuantity()).isEqualByComparingTo("-10");
        assertThat(shortPos.isShort()).isTrue();
        assertThat(shortPos.getRealizedPnl()).isEqualByComparingTo("50");
        assertThat(shortPos.getAvgCost()).isEqualByComparingTo("55");

        ledger.apply(tx("BBAS3", D3, "15", "52"));
        LedgerPosition p = ledger.position("BBAS3").orElseThrow();
        assertThat(p.getQuantity()).isEqualByComparingTo("5");
        assertThat(p.getRealizedPnl()).isEqualByComparingTo("80");
        assertThat(p.getAvgCost()).isEqualByComparingTo("52");
        assertThat(p.getTotalInvested()).isEqualByComparingTo("260");
    }

    @Test
    void allowShort_addingToShortWeightsTheEntryAndPartialCoverRealizes() {
        PositionLedger ledger = ledger(OversellPolicy.ALLOW_SHORT);
        ledger.apply(tx("PETR4", D1, "-10", "30"));
        ledger.apply(tx("PETR4", D2, "-10", "40"));

        LedgerPosition shortPos = ledger.position("PETR4").orElseThrow();
        assertThat(shortPos.getQuantity()).isEqualByComparingTo("-20");
        assertThat(shortPos.getAvgCost()).isEqualByComparingTo("35");
        assertThat(shortPos.getRealizedPnl()).isEqualByComparingTo("0");

        ledger.apply(tx("PETR4", D3, "5", "38"));
        LedgerPosition p = ledger.position("PETR4").orElseThrow();
        assertThat(p.getQuantity()).isEqualByComparingTo("-15");
        assertThat(p.getAvgCost()).isEqualByComparingTo("35");
        assertThat(p.getRealizedPnl()).isEqualByComparingTo("-15");
    }

    @Test
    void invalidTransactions_areRejected() {
        PositionLedger ledger = ledger(OversellPolicy.REJECT);

        assertThat(ledger.apply(tx("X", D1, "0", "10")).applied()).isFalse();
        assertThat(ledger.apply(tx("X", D1, "1", "-1")).applied()).isFalse();
        assertThat(ledger.positions()).isEmpty();
    }

    @Test
    void fullSell_closesPosition() {
        PositionLedger ledger = ledger(OversellPolicy.REJECT);
        ledger.apply(tx("WEGE3", D1, "100", "40"));

        ledger.apply(tx("WEGE3", D2, "-100", "44"));

        LedgerPosition p = ledger.position("WEGE3").orElseThrow();
        assertThat(p.isOpen()).isFalse();
        assertThat(p.getRealizedPnl()).isEqualByComparingTo("400");
        assertThat(p.getTotalInvested()).isEqualByComparingTo("0");
    }
}
