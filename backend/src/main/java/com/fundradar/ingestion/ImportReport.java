package com.fundradar.ingestion;

import com.fundradar.common.RowError;

import java.util.List;

/** Rows stored and rows rejected (with their 1-based data row numbers) for one imported file. */
public record ImportReport(String source, int rows, int stored, List<RowError> rejected) {

    public boolean isClean() {
        return rejected.isEmpty();
    }
}
