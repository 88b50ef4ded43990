package com.civics.ingest.connector;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Two-letter postal codes for states, DC and territories.
 */
final class StateCodes {

    private static final Pattern OCD_STATE = Pattern.compile("state:([a-z]{2})(?:/|$)");

    private static final Map<String, String> BY_NAME = Map.ofEntries(
            Map.entry("alabama", "AL"), Map.entry("alaska", "AK"), Map.entry("arizona", "AZ"),
            Map.entry("arkansas", "AR"), Map.entry("california", "CA"), Map.entry("colorado", "CO"),
            Map.entry("connecticut", "CT"), Map.entry("delaware", "DE"), Map.entry("florida", "FL"),
            Map.entry("georgia", "GA"), Map.entry("hawaii", "HI"), Map.entry("idaho", "ID"),
            Map.entry("illinois", "IL"), Map.entry("indiana", "IN"), Map.entry("iowa", "IA"),
            Map.entry("kansas", "KS"), Map.entry("kentucky", "KY"), Map.entry("louisiana", "LA"),
            Map.entry("maine", "ME"), Map.entry("maryland", "MD"), Map.entry("massachusetts", "MA"),
            Map.entry("michigan", "MI"), Map.entry("minnesota", "MN"), Map.entry("mississippi", "MS"),
            Map.entry("missouri", "MO"), Map.entry("montana", "MT"), Map.entry("nebraska", "NE"),
            Map.entry("nevada", "NV"), Map.entry("new hampshire", "NH"), Map.entry("new jersey", "NJ"),
            Map.entry("new mexico", "NM"), Map.entry("new york", "NY"), Map.entry("north carolina", "NC"),
            Map.entry("north dakota", "ND"), Map.entry("ohio", "OH"), Map.entry("oklahoma", "OK"),
            Map.entry("oregon", "OR"), Map.entry("pennsylvania", "PA"), Map.entry("rhode island", "RI"),
            Map.entry("south carolina", "SC"), Map.entry("south dakota", "SD"), Map.entry("tennessee", "TN"),
            Map.entry("texas", "TX"), Map.entry("utah", "UT"), Map.entry("vermont", "VT"),
            Map.entry("virginia", "VA"), Map.entry("washington", "WA"), Map.entry("west virginia", "WV"),
            Map.entry("wisconsin", "WI"), Map.entry("wyoming", "WY"),
            Map.entry("district of columbia", "DC"), Map.entry("puerto rico", "PR"), Map.entry("guam", "GU"),
            Map.entry("american samoa", "AS"), Map.entry("virgin islands", "VI"),
            Map.entry("northern mariana islands", "MP")
    );

    private StateCodes() {
    }

    /**
     * Resolves a full state name or an existing two-letter code.
     */
    static Optional<String> toCode(String nameOrCode) {
        if (nameOrCode == null || nameOrCode.isBlank()) {
            return Optional.empty();
        }
        String trimmed = nameOrCode.trim();
        if (trimmed.length() == 2) {
            String upper = trimmed.toUpperCase(Locale.ROOT);
            return BY_NAME.containsValue(upper) ? Optional.of(upper) : Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(trimmed.toLowerCase(Locale.ROOT)));
    }

    /**
     * Extracts the state code from an OCD identifier such as
     * {@code ocd-jurisdiction/country:us/state:ca/government}.
     */
    static Optional<String> fromOcd(String ocdId) {
        if (ocdId == null) {
            return Optional.empty();
        }
        Matcher m = OCD_STATE.matcher(ocdId.toLowerCase(Locale.ROOT));
        return m.find() ? toCode(m.group(1)) : Optional.empty();
    }
}
