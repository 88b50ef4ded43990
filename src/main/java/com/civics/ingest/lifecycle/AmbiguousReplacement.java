package com.civics.ingest.lifecycle;

import com.civics.ingest.core.model.OfficeSlot;

import java.util.List;
import java.util.Objects;

/**
 * More claimants to one office slot than it has seats, or a mix of newcomers and departing
 * occupants that cannot be paired. No transition is applied for the slot; the case is held
 * for manual review.
 *
 * @param claimantIds entities the roster reports as currently holding the slot
 * @param occupantIds active entities in the slot the roster no longer reports
 */
public record AmbiguousReplacement(OfficeSlot slot, int seats, List<String> claimantIds, List<String> occupantIds) {

    public AmbiguousReplacement {
        Objects.requireNonNull(slot, "slot is required");
        claimantIds = claimantIds.stream().sorted().toList();
        occupantIds = occupantIds.stream().sorted().toList();
    }

    public String describe() {
        return claimantIds.size() + " current claimant(s) for " + seats + " seat(s) in " + slot
                + (occupantIds.isEmpty() ? "" : ", departing " + occupantIds);
    }
}
