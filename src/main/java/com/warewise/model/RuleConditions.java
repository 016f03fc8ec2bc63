package com.warewise.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Typed view over a rule's JSON parameter bag.
 *
 * Missing keys fall back to the caller's default. A key that is present with a value of
 * the wrong type raises {@link RuleContractViolationException}.
 */
public final class RuleConditions {

    private static final RuleConditions EMPTY = new RuleConditions(Map.of());

    private final Map<String, Object> values;

    private RuleConditions(Map<String, Object> values) {
        this.values = values;
    }

    public static RuleConditions empty() {
        return EMPTY;
    }

    public static RuleConditions of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        // Map.copyOf rejects null values, which JSON may legitimately carry
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (v != null) {
                copy.put(k, v);
            }
        });
        return new RuleConditions(Collections.unmodifiableMap(copy));
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public double getDouble(String key, double defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new RuleContractViolationException(
                        "Rule parameter '" + key + "' must be numeric but was '" + s + "'", e);
            }
        }
        throw new RuleContractViolationException(
                "Rule parameter '" + key + "' must be numeric but was " + value.getClass().getSimpleName());
    }

    public double getNonNegativeDouble(String key, double defaultValue) {
        double value = getDouble(key, defaultValue);
        if (value < 0 || Double.isNaN(value)) {
            throw new RuleContractViolationException("Rule parameter '" + key + "' must not be negative, was " + value);
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        double value = getDouble(key, defaultValue);
        if (value != Math.rint(value)) {
            throw new RuleContractViolationException("Rule parameter '" + key + "' must be an integer, was " + value);
        }
        return (int) value;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String normalized = s.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals("true") || normalized.equals("false")) {
                return Boolean.parseBoolean(normalized);
            }
        }
        throw new RuleContractViolationException("Rule parameter '" + key + "' must be a boolean but was '" + value + "'");
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw new RuleContractViolationException("Rule parameter '" + key + "' must be a string but was " + value.getClass().getSimpleName());
    }

    /**
     * Accepts a JSON array or a comma-separated string.
     */
    public List<String> getStringList(String key, List<String> defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        return toStringList(key, value);
    }

    /**
     * Nested object parameter whose values are string lists, e.g. a keyword vocabulary.
     */
    public Map<String, List<String>> getStringListMap(String key, Map<String, List<String>> defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new RuleContractViolationException("Rule parameter '" + key + "' must be an object");
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (v != null) {
                result.put(String.valueOf(k), toStringList(key + "." + k, v));
            }
        });
        return result;
    }

    private static List<String> toStringList(String key, Object value) {
        if (value instanceof String s) {
            return Arrays.stream(s.split(","))
                    .map(String::trim)
                    .filter(part -> !part.isEmpty())
                    .toList();
        }
        if (value instanceof Iterable<?> iterable) {
            List<String> result = new ArrayList<>();
            for (Object element : iterable) {
                if (element == null) {
                    continue;
                }
                if (!(element instanceof String) && !(element instanceof Number)) {
                    throw new RuleContractViolationException("Rule parameter '" + key + "' must contain only strings");
                }
                result.add(element.toString().trim());
            }
            return List.copyOf(result);
        }
        throw new RuleContractViolationException("Rule parameter '" + key + "' must be a list but was " + value.getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
