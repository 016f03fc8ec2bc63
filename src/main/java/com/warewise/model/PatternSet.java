package com.warewise.model;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Regular expressions that classify canonical codes as storage or transitional
 * for one warehouse and rule type.
 */
public record PatternSet(
    List<Pattern> storagePatterns,
    List<Pattern> transitionalPatterns,
    PatternSource source,
    double confidence
) {

    public PatternSet {
        storagePatterns = List.copyOf(storagePatterns);
        transitionalPatterns = List.copyOf(transitionalPatterns);
    }

    public boolean isTransitional(String code) {
        return code != null && matchesAny(transitionalPatterns, code);
    }

    /**
     * Transitional patterns win over storage patterns when both match.
     */
    public boolean isStorage(String code) {
        return code != null && !isTransitional(code) && matchesAny(storagePatterns, code);
    }

    public boolean isFallback() {
        return source == PatternSource.DEFAULT_FALLBACK;
    }

    private static boolean matchesAny(List<Pattern> patterns, String code) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(code).matches()) {
                return true;
            }
        }
        return false;
    }
}
