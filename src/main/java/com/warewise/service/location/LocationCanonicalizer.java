package com.warewise.service.location;

import com.warewise.model.CanonicalResult;
import com.warewise.model.SpecialArea;
import com.warewise.model.WarehouseTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts user-supplied location spellings into one canonical form.
 *
 * Canonical storage codes are {@code AA-RR-PPPL} (e.g. {@code 02-01-015B}); special areas keep
 * their code with numbered areas padded to two digits ({@code RECV-1 -> RECV-01}).
 *
 * Parsers run in a fixed order and the first match wins:
 * <ol>
 *   <li>special-area vocabulary, including the template's own special codes</li>
 *   <li>standard {@code A-R-PL} with 1-2 digit aisle/rack and 1-3 digit position</li>
 *   <li>compact {@code A{side}PL}, e.g. {@code 2A15B}; the side letter is not a rack, rack is always 01</li>
 *   <li>user-common groupings, accepted only when they consume the whole string</li>
 * </ol>
 *
 * Instances are immutable and safe to share between threads. {@link #canonicalize} never throws.
 */
@Component
@Slf4j
public class LocationCanonicalizer {

    private static final String CANONICAL_FORMAT = "%02d-%02d-%03d%s";

    private static final List<Pattern> GENERIC_PREFIXES = List.of(
            Pattern.compile("^USER_[A-Z0-9]+_"),
            Pattern.compile("^WH\\d+_"),
            Pattern.compile("^DEFAULT_"),
            Pattern.compile("^WAREHOUSE_"));

    private static final Set<String> SPECIAL_WORDS = Set.of("RECEIVING", "STAGING", "SHIPPING", "DOCK");

    private static final Pattern NUMBERED_SPECIAL = Pattern.compile("^(RECV|STAGE|DOCK|AISLE)-(\\d{1,3})$");
    private static final Pattern STANDARD = Pattern.compile("^(\\d{1,2})-(\\d{1,2})-(\\d{1,3})-?([A-Z])$");
    private static final Pattern COMPACT = Pattern.compile("^(\\d{1,2})([A-Z])(\\d{1,3})([A-Z])$");

    // user-common groupings
    private static final Pattern POSITION_LEVEL_RACK = Pattern.compile("^(\\d{1,3})([A-Z])(\\d{1,2})$");
    private static final Pattern LEVEL_RACK_POSITION = Pattern.compile("^([A-Z])(\\d{1,2})-(\\d{1,3})$");
    private static final Pattern AISLE_RACKLETTER_POSITION_LEVEL = Pattern.compile("^(\\d{1,2})-([A-Z])(\\d{1,3})-([A-Z])$");
    private static final Pattern AISLE_RACKLETTER_POSITION_LEVEL_SEPARATED = Pattern.compile("^(\\d{1,2})-([A-Z])-(\\d{1,3})-([A-Z])$");

    private final Set<String> specialVocabulary;
    private final List<String> warehousePrefixes;

    public LocationCanonicalizer() {
        this(SPECIAL_WORDS, List.of());
    }

    private LocationCanonicalizer(Set<String> specialVocabulary, List<String> warehousePrefixes) {
        this.specialVocabulary = specialVocabulary;
        this.warehousePrefixes = warehousePrefixes;
    }

    /**
     * Canonicalizer that also knows the template's special-area codes and strips its
     * {@code <WAREHOUSE_ID>_} prefix.
     */
    public LocationCanonicalizer forTemplate(WarehouseTemplate template) {
        if (template == null) {
            return this;
        }
        Set<String> vocabulary = new LinkedHashSet<>(specialVocabulary);
        for (SpecialArea area : template.specialAreas()) {
            vocabulary.add(normalizeSpecialCode(area.code()));
        }
        List<String> prefixes = new ArrayList<>(warehousePrefixes);
        prefixes.add(template.warehouseId() + "_");
        return new LocationCanonicalizer(Collections.unmodifiableSet(vocabulary), List.copyOf(prefixes));
    }

    /**
     * Canonical form of a special-area code as declared in a template.
     */
    public static String normalizeSpecialCode(String code) {
        String cleaned = code.trim().toUpperCase(Locale.ROOT);
        Matcher m = NUMBERED_SPECIAL.matcher(cleaned);
        if (m.matches()) {
            return String.format("%s-%02d", m.group(1), Integer.parseInt(m.group(2)));
        }
        return cleaned;
    }

    public CanonicalResult canonicalize(String raw) {
        if (raw == null) {
            return CanonicalResult.unparseable("");
        }
        String cleaned = raw.trim().toUpperCase(Locale.ROOT);
        if (cleaned.isEmpty()) {
            return CanonicalResult.unparseable("");
        }
        String code = removePrefixes(cleaned);

        Optional<CanonicalResult> result = parseSpecial(code)
                .or(() -> parseStandard(code))
                .or(() -> parseCompact(code))
                .or(() -> parseUserCommon(code));

        if (result.isPresent()) {
            log.debug("Location normalized: '{}' -> '{}'", cleaned, result.get().value());
            return result.get();
        }
        log.debug("Location unchanged: '{}' (no parser matched)", cleaned);
        return CanonicalResult.unparseable(cleaned);
    }

    private String removePrefixes(String code) {
        String result = code;
        for (String prefix : warehousePrefixes) {
            if (result.startsWith(prefix) && result.length() > prefix.length()) {
                result = result.substring(prefix.length());
            }
        }
        for (Pattern prefix : GENERIC_PREFIXES) {
            Matcher m = prefix.matcher(result);
            if (m.find() && m.end() < result.length()) {
                result = result.substring(m.end());
            }
        }
        return result;
    }

    private Optional<CanonicalResult> parseSpecial(String code) {
        Matcher m = NUMBERED_SPECIAL.matcher(code);
        if (m.matches()) {
            return Optional.of(CanonicalResult.special(
                    String.format("%s-%02d", m.group(1), Integer.parseInt(m.group(2)))));
        }
        if (specialVocabulary.contains(code)) {
            return Optional.of(CanonicalResult.special(code));
        }
        return Optional.empty();
    }

    private Optional<CanonicalResult> parseStandard(String code) {
        Matcher m = STANDARD.matcher(code);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(standard(m.group(1), m.group(2), m.group(3), m.group(4)));
    }

    private Optional<CanonicalResult> parseCompact(String code) {
        Matcher m = COMPACT.matcher(code);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(standard(m.group(1), "1", m.group(3), m.group(4)));
    }

    private Optional<CanonicalResult> parseUserCommon(String code) {
        Matcher m = POSITION_LEVEL_RACK.matcher(code);
        if (m.matches()) {
            return Optional.of(standard("1", m.group(3), m.group(1), m.group(2)));
        }
        m = LEVEL_RACK_POSITION.matcher(code);
        if (m.matches()) {
            return Optional.of(standard("1", m.group(2), m.group(3), m.group(1)));
        }
        m = AISLE_RACKLETTER_POSITION_LEVEL.matcher(code);
        if (!m.matches()) {
            m = AISLE_RACKLETTER_POSITION_LEVEL_SEPARATED.matcher(code);
        }
        if (m.matches()) {
            int rack = m.group(2).charAt(0) - 'A' + 1;
            return Optional.of(standard(m.group(1), String.valueOf(rack), m.group(3), m.group(4)));
        }
        return Optional.empty();
    }

    private static CanonicalResult standard(String aisle, String rack, String position, String level) {
        return CanonicalResult.standard(String.format(CANONICAL_FORMAT,
                Integer.parseInt(aisle), Integer.parseInt(rack), Integer.parseInt(position), level));
    }
}
