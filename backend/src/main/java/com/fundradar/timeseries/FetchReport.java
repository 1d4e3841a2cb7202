package com.fundradar.timeseries;

/**
 * Outcome of fetching one symbol. {@code upToDate} means nothing had to be requested.
 */
public record FetchReport(
        String symbol,
        int windowsPlanned,
        int windowsCompleted,
        int windowsFailed,
        int recordsStored,
        boolean cancelled,
        boolean upToDate
) {

    public static FetchReport upToDate(String symbol) {
        return new FetchReport(symbol, 0, 0, 0, 0, false, true);
    }

    public boolean isSuccess() {
        return windowsFailed == 0 && !cancelled;
    }
}
