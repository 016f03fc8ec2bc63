package com.warewise.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Named, non-positional location declared by a warehouse template.
 */
public record SpecialArea(
    String code,
    LocationType type,
    int capacity,
    String zone
) {

    public SpecialArea {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(type, "type");
        if (!type.isSpecialArea()) {
            throw new IllegalArgumentException("Special area " + code + " cannot be of type " + type);
        }
        zone = zone == null || zone.isBlank() ? type.name() : zone.trim().toUpperCase(Locale.ROOT);
    }
}
