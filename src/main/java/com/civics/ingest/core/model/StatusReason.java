package com.civics.ingest.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Coded reason recorded with every status transition.
 */
public enum StatusReason {
    TERM_ENDED("term_ended"),
    REPLACED("replaced"),
    RETIRED("retired"),
    DECEASED("deceased"),
    NOT_CURRENT_IN_SOURCE("not_current_in_source");

    private final String code;

    StatusReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Parses a source hint such as {@code "deceased"} or {@code "Term Ended"}.
     * Unknown or blank hints yield empty.
     */
    public static Optional<StatusReason> fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        String normalized = hint.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        return Arrays.stream(values())
                .filter(r -> r.code.equals(normalized))
                .findFirst();
    }

    /**
     * Whether this reason is an acceptable hint for promoting an inactive entity to historical.
     */
    public boolean isPromotionReason() {
        return this == TERM_ENDED || this == RETIRED || this == DECEASED;
    }
}
