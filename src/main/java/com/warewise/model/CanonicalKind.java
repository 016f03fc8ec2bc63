package com.warewise.model;

public enum CanonicalKind {
    SPECIAL,
    STANDARD,
    UNPARSEABLE
}
