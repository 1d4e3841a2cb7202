package com.fundradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Highest NAV on which a performance fee has been charged, one per portfolio. Never decreases.
 * Versioned: a save against a stale version fails with OptimisticLockingFailureException.
 */
@Document(collection = "high_water_marks")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class HighWaterMark {

    @Id
    @EqualsAndHashCode.Include
    private String portfolioId;
    private BigDecimal value;
    private LocalDate asOf;
    private Instant updatedAt;
    @Version
    private Long version;

    /** Raises the mark to {@code candidate} if higher; returns true when it moved. */
    public boolean raiseTo(BigDecimal candidate, LocalDate date, Instant at) {
        if (value != null && candidate.compareTo(value) <= 0) {
            return false;
        }
        this.value = candidate;
        this.asOf = date;
        this.updatedAt = at;
        return true;
    }
}
