package com.civics.ingest.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * The (office, jurisdiction, district) tuple identifying one elected seat.
 * Components are stored normalized so slots from different providers compare equal.
 */
public record OfficeSlot(String office, String jurisdiction, String district) {

    public OfficeSlot {
        Objects.requireNonNull(office, "office is required");
        Objects.requireNonNull(jurisdiction, "jurisdiction is required");
        office = normalize(office);
        jurisdiction = normalize(jurisdiction);
        district = district == null || district.isBlank() ? null : normalize(district);
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    @Override
    public String toString() {
        return office + "|" + jurisdiction + "|" + (district != null ? district : "-");
    }
}
