package com.warewise.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Positional components of a canonical storage code {@code AA-RR-PPPL}.
 */
public record StandardLocationCode(
    int aisle,
    int rack,
    int position,
    char level
) {

    public static final Pattern CANONICAL_PATTERN = Pattern.compile("^(\\d{2})-(\\d{2})-(\\d{3})([A-Z])$");

    public static Optional<StandardLocationCode> parse(String canonicalCode) {
        if (canonicalCode == null) {
            return Optional.empty();
        }
        Matcher m = CANONICAL_PATTERN.matcher(canonicalCode);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new StandardLocationCode(
                Integer.parseInt(m.group(1)),
                Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)),
                m.group(4).charAt(0)));
    }

    public String format() {
        return String.format("%02d-%02d-%03d%c", aisle, rack, position, level);
    }
}
