package com.warewise.model;

/**
 * Output of the location canonicalizer.
 * For UNPARSEABLE results {@code value} holds the cleaned (trimmed, upper-cased) input.
 */
public record CanonicalResult(
    CanonicalKind kind,
    String value
) {

    public static CanonicalResult special(String value) {
        return new CanonicalResult(CanonicalKind.SPECIAL, value);
    }

    public static CanonicalResult standard(String value) {
        return new CanonicalResult(CanonicalKind.STANDARD, value);
    }

    public static CanonicalResult unparseable(String value) {
        return new CanonicalResult(CanonicalKind.UNPARSEABLE, value == null ? "" : value);
    }

    public boolean isParsed() {
        return kind != CanonicalKind.UNPARSEABLE;
    }

    public boolean isEmpty() {
        return value == null || value.isEmpty();
    }
}
