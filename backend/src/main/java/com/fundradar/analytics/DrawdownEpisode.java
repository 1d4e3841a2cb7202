package com.fundradar.analytics;

import java.time.LocalDate;

/**
 * A decline from a peak to a trough and, if it happened within the series, the first recovery to the peak value.
 * Indexes are positions in the value series; recovery fields are null while unrecovered.
 */
public record DrawdownEpisode(
        int peakIndex,
        LocalDate peakDate,
        double peakValue,
        int troughIndex,
        LocalDate troughDate,
        double troughValue,
        Integer recoveryIndex,
        LocalDate recoveryDate,
        double depthPct
) {

    public boolean isRecovered() {
        return recoveryIndex != null;
    }
}
