package com.civics.ingest.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Where a displayed field's value came from.
 *
 * @param source           provider that supplied the winning value
 * @param fetchedAt        fetch time of the record that first supplied the winning value
 * @param reportingSources number of records that reported the field in the reconciling pass
 * @param agreeingSources  number of those records whose value matched the winner
 * @param reports          last value each provider reported for the field, with the time that value
 *                         was first fetched
 */
public record FieldProvenance(Provider source, Instant fetchedAt, int reportingSources, int agreeingSources,
                              Map<Provider, Report> reports) {

    public FieldProvenance {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        if (reportingSources < 1) {
            throw new IllegalArgumentException("reportingSources must be >= 1");
        }
        if (agreeingSources < 1 || agreeingSources > reportingSources) {
            throw new IllegalArgumentException("agreeingSources must be within [1, reportingSources]");
        }
        Map<Provider, Report> copy = new EnumMap<>(Provider.class);
        if (reports != null) {
            copy.putAll(reports);
        }
        reports = Collections.unmodifiableMap(copy);
    }

    public FieldProvenance(Provider source, Instant fetchedAt, int reportingSources, int agreeingSources) {
        this(source, fetchedAt, reportingSources, agreeingSources, Map.of());
    }

    public double agreementRatio() {
        return (double) agreeingSources / reportingSources;
    }

    /**
     * When {@code provider} first reported {@code value}, if that is still the value it last reported.
     */
    public Instant firstSeen(Provider provider, Object value) {
        Report report = reports.get(provider);
        return report != null && report.value().equals(value) ? report.firstSeen() : null;
    }

    /**
     * One provider's value for a field.
     */
    public record Report(Object value, Instant firstSeen) {

        public Report {
            Objects.requireNonNull(value, "value is required");
            Objects.requireNonNull(firstSeen, "firstSeen is required");
        }
    }
}
