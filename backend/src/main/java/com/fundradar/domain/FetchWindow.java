package com.fundradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Persistent status of one batch window of a symbol fetch. COMPLETE windows are never re-fetched or rolled back;
 * FAILED windows are retried by the next fetch of the symbol.
 */
@Document(collection = "fetch_windows")
@CompoundIndex(name = "symbol_status", def = "{'symbol': 1, 'status': 1, 'windowStart': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class FetchWindow {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String symbol;
    private LocalDate windowStart;
    private LocalDate windowEnd;
    private WindowStatus status;
    private int recordsStored;
    private int retryCount;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;
    private Instant updatedAt;

    public static String idFor(String symbol, LocalDate start, LocalDate end) {
        return symbol + ":" + start + ":" + end;
    }

    public enum WindowStatus {
        PENDING,
        RUNNING,
        COMPLETE,
        FAILED
    }
}
