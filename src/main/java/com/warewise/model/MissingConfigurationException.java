package com.warewise.model;

/**
 * A rule cannot run because configuration it depends on is absent
 * (no warehouse template, no resolved warehouse context).
 * Fails the single rule; the rest of the run continues.
 */
public class MissingConfigurationException extends RuntimeException {

    public MissingConfigurationException(String message) {
        super(message);
    }
}
