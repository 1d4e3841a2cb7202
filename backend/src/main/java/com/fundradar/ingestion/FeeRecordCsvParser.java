package com.fundradar.ingestion;

import com.fundradar.common.RowResult;
import com.fundradar.domain.FeeRecord;
import com.fundradar.domain.FeeStatus;
import com.fundradar.domain.FeeType;

import java.io.Reader;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Historical fee records: {@code date, investor_id, investor_name, fee_type, period_start, period_end, nav_start,
 * nav_end, fee_rate, fee_amount, paid, payment_date}. Rows become CALCULATED, or PAID when {@code paid} is true.
 * A {@code fee_rate} above 1 is read as a percentage.
 */
public final class FeeRecordCsvParser {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private FeeRecordCsvParser() {
    }

    public static List<RowResult<FeeRecord>> parse(Reader input, String baseCurrency) {
        return CsvRowReader.read(input).stream()
                .map(row -> parseRow(row, baseCurrency))
                .toList();
    }

    static RowResult<FeeRecord> parseRow(CsvRow row, String baseCurrency) {
        try {
            FeeRecord fee = new FeeRecord();
            fee.setDate(FieldParsers.date(row.get("date"), "date"));
            String investor = row.get("investor_id");
            fee.setInvestorId(isFundLevel(investor) ? FeeRecord.FUND_INVESTOR_ID : investor);
            fee.setInvestorName(row.get("investor_name"));
            fee.setFeeType(FeeType.parse(row.get("fee_type")));
            fee.setPeriodStart(FieldParsers.date(row.get("period_start"), "period_start"));
            fee.setPeriodEnd(FieldParsers.date(row.get("period_end"), "period_end"));
            if (fee.getPeriodEnd().isBefore(fee.getPeriodStart())) {
                return RowResult.rejected(row.row(), "period_end is before period_start");
            }
            fee.setNavStart(FieldParsers.optionalDecimal(row.get("nav_start"), "nav_start"));
            fee.setNavEnd(FieldParsers.optionalDecimal(row.get("nav_end"), "nav_end"));
            BigDecimal rate = row.get("fee_rate") == null ? null : FieldParsers.percent(row.get("fee_rate"), "fee_rate");
            if (rate != null && rate.compareTo(BigDecimal.ONE) > 0) {
                rate = rate.divide(HUNDRED, MathContext.DECIMAL64);
            }
            fee.setRate(rate);
            BigDecimal amount = FieldParsers.decimal(row.get("fee_amount", "amount"), "fee_amount");
            if (amount.signum() < 0) {
                return RowResult.rejected(row.row(), "fee_amount must not be negative");
            }
            fee.setAmount(amount);
            fee.setCurrency(FieldParsers.currency(row.get("currency"), baseCurrency));
            fee.setStatus(FeeStatus.CALCULATED);
            if (FieldParsers.bool(row.get("paid"))) {
                fee.setStatus(FeeStatus.PAID);
                LocalDate paymentDate = FieldParsers.optionalDate(row.get("payment_date"), "payment_date");
                fee.setPaymentDate(paymentDate != null ? paymentDate : fee.getDate());
            }
            return RowResult.ok(row.row(), fee);
        } catch (IllegalArgumentException e) {
            return RowResult.rejected(row.row(), e.getMessage());
        }
    }

    /** Blank, "ALL" and "FUND" all mean a fund-level fee. */
    private static boolean isFundLevel(String investorId) {
        if (investorId == null) {
            return true;
        }
        String id = investorId.toUpperCase(Locale.ROOT);
        return id.equals("ALL") || id.equals(FeeRecord.FUND_INVESTOR_ID);
    }
}
