package com.fundradar.timeseries;

import com.fundradar.common.DateWindow;
import com.fundradar.domain.SymbolMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Plans the windows a fetch must request given what the cache already covers.
 * Only the ranges before {@code firstDate} and after {@code lastDate} are planned; the range in between is
 * covered. Gaps are extended up to the covered edge so coverage stays contiguous. The tail gap starts at
 * {@code lastDate} itself so the last stored bar, possibly from an open session, is requested again.
 */
public final class FetchGapPlanner {

    private FetchGapPlanner() {
    }

    public static List<DateWindow> gaps(SymbolMetadata metadata, DateWindow requested) {
        if (metadata == null || !metadata.hasCoverage()) {
            return List.of(requested);
        }
        List<DateWindow> gaps = new ArrayList<>(2);
        if (requested.start().isBefore(metadata.getFirstDate())) {
            gaps.add(new DateWindow(requested.start(), metadata.getFirstDate().minusDays(1)));
        }
        if (requested.end().isAfter(metadata.getLastDate())) {
            gaps.add(new DateWindow(metadata.getLastDate(), requested.end()));
        }
        return gaps;
    }

    public static List<DateWindow> windows(SymbolMetadata metadata, DateWindow requested, int batchDays) {
        List<DateWindow> out = new ArrayList<>();
        for (DateWindow gap : gaps(metadata, requested)) {
            out.addAll(gap.split(batchDays));
        }
        return out;
    }
}
