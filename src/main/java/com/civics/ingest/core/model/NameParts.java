package com.civics.ingest.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Structured person name plus its display form.
 *
 * @param display display form, e.g. "Jane Q. Smith Jr."
 * @param given   given name
 * @param middle  middle name or initial, may be null
 * @param family  family name
 * @param suffix  generational suffix, may be null
 */
public record NameParts(String display, String given, String middle, String family, String suffix) {

    private static final Set<String> SUFFIXES = Set.of("jr", "sr", "ii", "iii", "iv", "v");

    public NameParts {
        Objects.requireNonNull(display, "display is required");
        if (display.isBlank()) {
            throw new IllegalArgumentException("display must not be blank");
        }
    }

    /**
     * Parses either "Family, Given Middle" or "Given Middle Family Suffix" forms.
     */
    public static NameParts parse(String raw) {
        Objects.requireNonNull(raw, "name is required");
        String trimmed = raw.trim().replaceAll("\\s+", " ");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("name must not be blank");
        }

        List<String> tokens;
        String family;
        if (trimmed.contains(",")) {
            String[] halves = trimmed.split(",", 2);
            family = halves[0].trim();
            tokens = new ArrayList<>(Arrays.asList(halves[1].trim().split(" ")));
        } else {
            tokens = new ArrayList<>(Arrays.asList(trimmed.split(" ")));
            family = null;
        }
        tokens.removeIf(String::isBlank);

        String suffix = null;
        if (!tokens.isEmpty() && isSuffix(tokens.get(tokens.size() - 1))) {
            suffix = tokens.remove(tokens.size() - 1);
        }
        if (family == null) {
            family = tokens.isEmpty() ? trimmed : tokens.remove(tokens.size() - 1);
        }
        String given = tokens.isEmpty() ? null : tokens.remove(0);
        String middle = tokens.isEmpty() ? null : String.join(" ", tokens);

        return new NameParts(compose(given, middle, family, suffix), given, middle, family, suffix);
    }

    public static NameParts of(String given, String middle, String family, String suffix) {
        return new NameParts(compose(given, middle, family, suffix), given, middle, family, suffix);
    }

    private static boolean isSuffix(String token) {
        return SUFFIXES.contains(token.toLowerCase(Locale.ROOT).replace(".", ""));
    }

    private static String compose(String given, String middle, String family, String suffix) {
        StringBuilder sb = new StringBuilder();
        for (String part : new String[]{given, middle, family, suffix}) {
            if (part != null && !part.isBlank()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(part.trim());
            }
        }
        return sb.toString();
    }
}
