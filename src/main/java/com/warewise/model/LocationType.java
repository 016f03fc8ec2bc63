package com.warewise.model;

/**
 * Resolved classification of a location code within one warehouse.
 */
public enum LocationType {
    STORAGE,
    RECEIVING,
    STAGING,
    DOCK,
    TRANSITIONAL,
    UNKNOWN,
    MISSING;

    /**
     * Types a {@link SpecialArea} may declare.
     */
    public boolean isSpecialArea() {
        return this == RECEIVING || this == STAGING || this == DOCK || this == TRANSITIONAL;
    }

    public boolean isFinalStorage() {
        return this == STORAGE;
    }
}
