package com.civics.ingest.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Campaign-finance totals for one candidate and election cycle.
 *
 * @param candidateId    campaign-finance candidate identifier
 * @param cycle          two-year election cycle, always an even year
 * @param totalRaised    total receipts
 * @param totalSpent     total disbursements
 * @param cashOnHand     cash on hand at the end of the coverage period
 * @param lastFilingDate end of the most recent coverage period, may be null
 */
public record FinanceSummary(
        String candidateId,
        int cycle,
        BigDecimal totalRaised,
        BigDecimal totalSpent,
        BigDecimal cashOnHand,
        LocalDate lastFilingDate
) {
    public FinanceSummary {
        Objects.requireNonNull(candidateId, "candidateId is required");
        if (cycle % 2 != 0) {
            throw new IllegalArgumentException("cycle must be an even year: " + cycle);
        }
    }

    /**
     * Rounds an arbitrary year up to the election cycle it belongs to.
     */
    public static int cycleFor(int year) {
        return year % 2 == 0 ? year : year + 1;
    }
}
