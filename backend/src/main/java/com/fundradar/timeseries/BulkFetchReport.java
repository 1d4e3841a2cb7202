package com.fundradar.timeseries;

import java.util.List;
import java.util.Map;

/**
 * Per-symbol results of a bulk fetch. Symbols that threw are in {@code errors}; symbols never reached because
 * of cancellation are in {@code skipped}.
 */
public record BulkFetchReport(
        List<FetchReport> reports,
        Map<String, String> errors,
        List<String> skipped,
        boolean cancelled
) {

    public int totalRecordsStored() {
        return reports.stream().mapToInt(FetchReport::recordsStored).sum();
    }

    public boolean hasFailures() {
        return !errors.isEmpty() || reports.stream().anyMatch(r -> r.windowsFailed() > 0);
    }
}
