package com.warewise.model;

import java.util.Locale;

public enum Priority {
    VERY_HIGH,
    HIGH,
    MEDIUM,
    LOW;

    public static Priority fromName(String name) {
        if (name == null || name.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
